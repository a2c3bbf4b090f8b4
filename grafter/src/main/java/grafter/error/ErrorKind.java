// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.error;

/**
 * The taxonomy of fatal errors.
 */
public enum ErrorKind {
    /**
     * Conflicting or malformed configuration, detected before any parse starts.
     */
    CONFIGURATION,
    /**
     * Malformed characters: bad string literals, tabs in indentation, invalid directives.
     */
    LEXICAL,
    /**
     * Malformed grouping: unmatched delimiters, contexts open at end of input, dangling glue, empty sections.
     */
    STRUCTURAL
}
