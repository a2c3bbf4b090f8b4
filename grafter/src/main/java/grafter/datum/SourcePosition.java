// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

/**
 * A point in a source text.
 *
 * @param offset The number of UTF-16 code units before this point.
 * @param line   The 1-based line number.
 * @param column The 1-based column, counted in UTF-16 code units.
 */
public record SourcePosition(int offset, int line, int column) {
    /**
     * The position of the first character of any source.
     */
    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    public SourcePosition {
        if (offset < 0 || line < 1 || column < 1) {
            throw new IllegalArgumentException(
                "Invalid source position: offset " + offset + ", line " + line + ", column " + column);
        }
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column + " (offset " + offset + ")";
    }
}
