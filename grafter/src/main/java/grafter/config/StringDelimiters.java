// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import grafter.datum.AtomKind;
import grafter.util.annotation.Nullable;

/**
 * The opening (and closing) characters of the three string literal kinds.
 */
public record StringDelimiters(char escaped, char raw, char binary) {
    /**
     * Returns the kind of string opened by {@code c}, or {@code null} if it doesn't open a string.
     */
    public @Nullable AtomKind kindOpenedBy(final char c) {
        if (c == escaped) {
            return AtomKind.ESCAPED_STRING;
        } else if (c == raw) {
            return AtomKind.RAW_STRING;
        } else if (c == binary) {
            return AtomKind.BINARY_STRING;
        } else {
            return null;
        }
    }

    /**
     * Returns the character that opens and closes strings of the given kind.
     *
     * @throws IllegalArgumentException If {@code kind} is not a string kind.
     */
    public char delimiterOf(final AtomKind kind) {
        return switch (kind) {
            case ESCAPED_STRING -> escaped;
            case RAW_STRING -> raw;
            case BINARY_STRING -> binary;
            default -> throw new IllegalArgumentException(kind + " is not a string kind");
        };
    }
}
