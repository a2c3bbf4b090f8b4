// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

/**
 * What a maximal run of whitespace and comments amounted to.
 *
 * @param newlineCount  The number of line breaks consumed.
 * @param indentColumns The indentation of the line holding the next significant character, or -1 if the run neither
 *                      crossed a line break nor started at the beginning of a line.
 * @param hadComment    Whether at least one comment was discarded.
 * @param length        The number of characters consumed; zero means the next token is glued to the previous one.
 */
public record WhitespaceRun(int newlineCount, int indentColumns, boolean hadComment, int length) {
    /**
     * Returns {@code true} iff no characters at all were consumed.
     */
    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Returns {@code true} iff the next significant character is the first one on its line.
     */
    public boolean startsLine() {
        return indentColumns >= 0;
    }
}
