// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.Delimiter;
import grafter.datum.SourcePosition;
import grafter.datum.SourceSpan;
import grafter.util.annotation.Nullable;

/**
 * A lexical token, together with the whitespace run that preceded it.
 *
 * @param text      The word text, the decoded atom text, or the delimiter character.
 * @param atomKind  The kind of atom an {@link TokenKind#ATOM} token stands for; {@code null} for other tokens.
 * @param delimiter The bracket pair of {@link TokenKind#OPEN} and {@link TokenKind#CLOSE} tokens.
 */
record Token(
    TokenKind kind,
    String text,
    @Nullable AtomKind atomKind,
    @Nullable Delimiter delimiter,
    SourceSpan span,
    WhitespaceRun whitespace
) {
    SourcePosition start() {
        return span.start();
    }

    /**
     * Returns {@code true} iff no character at all separates this token from the previous one.
     */
    boolean glued() {
        return whitespace.isEmpty() && span.start().offset() > 0;
    }

    /**
     * Returns {@code true} iff this token can begin the operand of a glue symbol.
     */
    boolean startsOperand() {
        return kind == TokenKind.WORD || kind == TokenKind.OPEN
            || (kind == TokenKind.ATOM && atomKind != AtomKind.SHEBANG);
    }

    boolean isString() {
        return atomKind == AtomKind.ESCAPED_STRING || atomKind == AtomKind.RAW_STRING
            || atomKind == AtomKind.BINARY_STRING;
    }

    /**
     * Returns the atom this token stands for: its own kind for {@link TokenKind#ATOM} tokens, a symbol otherwise.
     */
    Datum.Atom toAtom() {
        final var kind = atomKind;
        return new Datum.Atom(text, (kind != null) ? kind : AtomKind.SYMBOL, span);
    }
}
