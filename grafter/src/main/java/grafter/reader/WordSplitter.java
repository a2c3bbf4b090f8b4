// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.util.ArrayList;
import java.util.List;
import grafter.config.Configuration;
import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.SourcePosition;
import grafter.datum.SourceSpan;

/**
 * Splits words into the glue pieces the unit assembler consumes.
 * <p>
 * A unit word is {@code prefix* primary (suffix prefix* primary)*}: leading prefix glue symbols are matched longest
 * first as long as something remains after them, and suffix glue symbols are found left to right, longest first, at
 * any position after the start of the current primary. A suffix does not split when the text before it consists only
 * of glue characters ({@code ...}) or when it sits between an integer and a digit ({@code 1.5}).
 */
final class WordSplitter {
    WordSplitter(final Configuration configuration) {
        this.configuration = configuration;
        final var glue = new StringBuilder();
        for (final var symbol : configuration.suffixGlue().values()) {
            glue.append(symbol);
        }
        suffixGlueCharacters = glue.toString();
    }

    /**
     * Returns {@code true} iff the whole word is a sequence of prefix glue symbols, with nothing to apply them to.
     */
    boolean isPrefixOnly(final String word) {
        var i = 0;
        while (i < word.length()) {
            final var symbol = configuration.matchPrefixGlue(word, i);
            if (symbol == null) {
                return false;
            }
            i += symbol.length();
        }
        return !word.isEmpty();
    }

    /**
     * Splits a word consisting only of prefix glue symbols.
     */
    List<Piece> prefixes(final Token token) {
        final var pieces = new ArrayList<Piece>();
        final var word = token.text();
        var i = 0;
        while (i < word.length()) {
            final var symbol = configuration.matchPrefixGlue(word, i);
            assert symbol != null : "Not a prefix-only word: " + word;
            pieces.add(piece(Piece.Kind.PREFIX, token, i, i + symbol.length()));
            i += symbol.length();
        }
        return pieces;
    }

    /**
     * Splits a word that starts a new unit, or the operand of a pending glue symbol.
     */
    List<Piece> unit(final Token token) {
        final var pieces = new ArrayList<Piece>();
        splitChain(token, 0, pieces);
        return pieces;
    }

    /**
     * Splits a word starting with a suffix glue symbol that continues the preceding unit.
     */
    List<Piece> continuation(final Token token, final String suffix) {
        final var pieces = new ArrayList<Piece>();
        pieces.add(piece(Piece.Kind.SUFFIX, token, 0, suffix.length()));
        splitChain(token, suffix.length(), pieces);
        return pieces;
    }

    /**
     * Splits a bare type tag word, {@code <tag>operand}.
     */
    List<Piece> bareTag(final Token token, final String tag) {
        final var pieces = new ArrayList<Piece>();
        pieces.add(piece(Piece.Kind.TAG, token, 0, tag.length()));
        splitChain(token, tag.length(), pieces);
        return pieces;
    }

    private void splitChain(final Token token, final int from, final List<Piece> pieces) {
        final var word = token.text();
        var i = splitPrefixes(token, from, pieces);
        if (i == word.length()) {
            return;
        }
        var primaryStart = i;
        var j = primaryStart + 1;
        while (j < word.length()) {
            final var suffix = configuration.matchSuffixGlue(word, j);
            if (suffix != null && splits(word, primaryStart, j, suffix)) {
                pieces.add(piece(Piece.Kind.PRIMARY, token, primaryStart, j));
                pieces.add(piece(Piece.Kind.SUFFIX, token, j, j + suffix.length()));
                i = splitPrefixes(token, j + suffix.length(), pieces);
                if (i == word.length()) {
                    return;
                }
                primaryStart = i;
                j = primaryStart + 1;
            } else {
                j += 1;
            }
        }
        pieces.add(piece(Piece.Kind.PRIMARY, token, primaryStart, word.length()));
    }

    private int splitPrefixes(final Token token, final int from, final List<Piece> pieces) {
        final var word = token.text();
        var i = from;
        while (true) {
            final var symbol = configuration.matchPrefixGlue(word, i);
            if (symbol == null || i + symbol.length() >= word.length()) {
                return i;
            }
            pieces.add(piece(Piece.Kind.PREFIX, token, i, i + symbol.length()));
            i += symbol.length();
        }
    }

    private boolean splits(final String word, final int primaryStart, final int index, final String suffix) {
        var onlyGlue = true;
        for (int i = primaryStart; i < index; i += 1) {
            if (suffixGlueCharacters.indexOf(word.charAt(i)) < 0) {
                onlyGlue = false;
                break;
            }
        }
        if (onlyGlue) {
            return false;
        }
        final var after = index + suffix.length();
        return !(isInteger(word, primaryStart, index) && after < word.length() && isDigit(word.charAt(after)));
    }

    private static boolean isInteger(final String word, final int start, final int end) {
        var i = start;
        if (i < end && (word.charAt(i) == '+' || word.charAt(i) == '-')) {
            i += 1;
        }
        if (i == end) {
            return false;
        }
        for (; i < end; i += 1) {
            if (!isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static Piece piece(final Piece.Kind kind, final Token token, final int start, final int end) {
        final var origin = token.start();
        final var span = new SourceSpan(shift(origin, start), shift(origin, end));
        return new Piece(kind, new Datum.Atom(token.text().substring(start, end), AtomKind.SYMBOL, span));
    }

    // Words never contain line breaks, so every character of a word is on the word's first line.
    private static SourcePosition shift(final SourcePosition position, final int count) {
        return new SourcePosition(position.offset() + count, position.line(), position.column() + count);
    }

    private final Configuration configuration;
    private final String suffixGlueCharacters;

    /**
     * One glue-relevant part of a word.
     */
    record Piece(Kind kind, Datum.Atom atom) {
        enum Kind {
            PREFIX,
            TAG,
            PRIMARY,
            SUFFIX
        }
    }
}
