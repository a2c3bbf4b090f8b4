// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

/**
 * What kind of source text an {@link Datum.Atom} was read from.
 */
public enum AtomKind {
    /**
     * Any run of non-delimiter characters: identifiers, numbers, operators, keywords.
     */
    SYMBOL,
    /**
     * A string literal with backslash escapes, holding the decoded content.
     */
    ESCAPED_STRING,
    /**
     * A string literal taken literally, holding the content with doubled closing delimiters undoubled.
     */
    RAW_STRING,
    /**
     * A bit-pattern literal, holding its digits as written.
     */
    BINARY_STRING,
    /**
     * A filesystem path or URL, never split by any glue rule.
     */
    PATH,
    /**
     * A word introduced by the directive prefix, holding the text after the prefix.
     */
    DIRECTIVE,
    /**
     * The interpreter line at the very start of a source, holding the text after {@code #!}.
     */
    SHEBANG
}
