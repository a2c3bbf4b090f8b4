// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

/**
 * A pair of opening and closing bracket characters.
 */
public record Delimiter(char open, char close) {
    public Delimiter {
        if (open == close) {
            throw new IllegalArgumentException("A delimiter cannot open and close with the same character " + open);
        }
    }

    /**
     * Parses a two-character pair such as {@code "()"}.
     *
     * @throws IllegalArgumentException If {@code pair} is not exactly two distinct characters.
     */
    public static Delimiter of(final String pair) {
        if (pair.length() != 2) {
            throw new IllegalArgumentException("A delimiter pair must be exactly two characters, got \"" + pair + '"');
        }
        return new Delimiter(pair.charAt(0), pair.charAt(1));
    }

    @Override
    public String toString() {
        return String.valueOf(open) + close;
    }
}
