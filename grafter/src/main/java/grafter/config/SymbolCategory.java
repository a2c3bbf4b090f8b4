// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

/**
 * The syntactic roles a configured symbol can play.
 */
public enum SymbolCategory {
    PREFIX_GLUE("prefix glue"),
    SUFFIX_GLUE("suffix glue"),
    INFIX("infix"),
    ASSOCIATIVE_LEFT("left-associative"),
    ASSOCIATIVE_RIGHT("right-associative"),
    SEPARATOR("separator"),
    SEQUENCE("sequence"),
    TRIGGER("trigger");

    SymbolCategory(final String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns {@code true} iff one symbol may belong to both this category and {@code other}.
     * <p>
     * Only suffix glue shares symbols, and only with the categories that require whitespace on both sides: the
     * attached form {@code a:b} and the spaced form {@code a : b} can always be told apart.
     */
    public boolean compatibleWith(final SymbolCategory other) {
        if (this == other) {
            return false;
        }
        return (this == SUFFIX_GLUE && other.isSpaced()) || (other == SUFFIX_GLUE && isSpaced());
    }

    /**
     * Retrieves the user-readable name of this category.
     */
    public String displayName() {
        return displayName;
    }

    private boolean isSpaced() {
        return this == INFIX || this == ASSOCIATIVE_LEFT || this == ASSOCIATIVE_RIGHT || this == TRIGGER;
    }

    private final String displayName;
}
