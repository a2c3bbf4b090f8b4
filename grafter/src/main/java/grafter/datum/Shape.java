// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

/**
 * A purely syntactic hint attached to lists whose delimiter is one of the specially configured ones.
 */
public enum Shape {
    STRUCT,
    BINARY
}
