// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

/**
 * The rule that produced a {@link Datum.List}.
 * <p>
 * Like spans, origins are provenance: they never take part in equality.
 */
public enum ListOrigin {
    /** Written with explicit brackets in the source. */
    BRACKET,
    /** A run of several units, a glue, a graft chain or a fold. */
    APPLICATION,
    /** A materialized section. */
    SECTION,
    /** A materialized structure. */
    STRUCTURE,
    /** A materialized effect. */
    EFFECT,
    /** A type tag applied to a materialized context, or a bare tag item. */
    TYPE_TAG,
    /** Adjacent clauses of one sibling keyword group. */
    SIBLING_GROUP,
    /** The root of a parse. */
    TOP
}
