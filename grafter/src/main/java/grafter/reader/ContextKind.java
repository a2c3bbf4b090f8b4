// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

/**
 * The kinds of collection contexts the reader keeps on its stack.
 */
public enum ContextKind {
    /** The whole source. */
    TOP,
    /** A context opened by the section trigger. */
    SECTION,
    /** A context opened by the structure trigger. */
    STRUCTURE,
    /** A context opened by the effect trigger. */
    EFFECT,
    /** The indented block following an associative symbol that ends a line. */
    CHAIN_SECTION,
    /** A list written with explicit brackets. */
    DELIMITED
}
