// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import grafter.config.Configuration;
import grafter.datum.AtomKind;
import grafter.datum.SourcePosition;
import grafter.datum.SourceSpan;
import grafter.util.UnreachableCodeReachedError;

/**
 * The atom scanner: splits the character stream into words, finished atoms and structural characters.
 * <p>
 * Precedence, highest first: a shebang at the very start of input, bracket, separator and sequence characters,
 * string literals, directives, then words. A word matching a system path pattern is extended to the next whitespace
 * and becomes a path atom that no glue rule ever looks into. A comment ends a word like whitespace does.
 */
final class Lexer {
    Lexer(final CharStream stream, final Configuration configuration, final ErrorSignaler errors) {
        this.stream = stream;
        this.configuration = configuration;
        this.errors = errors;
        analyzer = new WhitespaceAnalyzer(stream, configuration, errors);
    }

    /**
     * Reads the next token.
     *
     * @param pathTerminator The closing character of the innermost open bracket list, which ends a system path as
     *                       whitespace does, or {@link CharStream#END} if no list is open.
     */
    Token next(final int pathTerminator) {
        final var whitespace = analyzer.skip();
        final var start = stream.position();
        final var c = stream.peek();
        if (c == CharStream.END) {
            return new Token(TokenKind.END, "", null, null, SourceSpan.at(start), whitespace);
        }
        final var ch = (char) c;
        if (start.offset() == 0 && stream.lookingAt(shebangMarker)) {
            return readShebang(start, whitespace);
        }
        final var opened = configuration.delimiterOpenedBy(ch);
        if (opened != null) {
            stream.advance();
            return new Token(TokenKind.OPEN, String.valueOf(ch), null, opened, span(start), whitespace);
        }
        final var closed = configuration.delimiterClosedBy(ch);
        if (closed != null) {
            stream.advance();
            return new Token(TokenKind.CLOSE, String.valueOf(ch), null, closed, span(start), whitespace);
        }
        if (configuration.isSeparator(ch)) {
            stream.advance();
            return new Token(TokenKind.SEPARATOR, String.valueOf(ch), null, null, span(start), whitespace);
        }
        if (configuration.isSequence(ch)) {
            stream.advance();
            return new Token(TokenKind.SEQUENCE, String.valueOf(ch), null, null, span(start), whitespace);
        }
        final var stringKind = configuration.stringDelimiters().kindOpenedBy(ch);
        if (stringKind != null) {
            final var text = readString(stringKind, ch);
            return new Token(TokenKind.ATOM, text, stringKind, null, span(start), whitespace);
        }
        if (stream.lookingAt(configuration.directivePrefix())) {
            return readDirective(start, whitespace);
        }
        final var word = readWord();
        if (isSystemPath(word)) {
            final var path = readPathRest(word, pathTerminator);
            return new Token(TokenKind.ATOM, path, AtomKind.PATH, null, span(start), whitespace);
        }
        return new Token(TokenKind.WORD, word, null, null, span(start), whitespace);
    }

    private Token readShebang(final SourcePosition start, final WhitespaceRun whitespace) {
        for (int i = 0; i < shebangMarker.length(); i += 1) {
            stream.advance();
        }
        final var text = new StringBuilder();
        while (stream.peek() != CharStream.END && stream.peek() != '\n') {
            text.append(stream.advance());
        }
        return new Token(TokenKind.ATOM, stripCarriageReturn(text), AtomKind.SHEBANG, null, span(start), whitespace);
    }

    private Token readDirective(final SourcePosition start, final WhitespaceRun whitespace) {
        final var prefix = configuration.directivePrefix();
        final var next = stream.peek(prefix.length());
        if (next == CharStream.END || configuration.breaksWord((char) next)) {
            throw errors.lexical("Directive prefix \"" + prefix + "\" must be followed by a word", start);
        }
        for (int i = 0; i < prefix.length(); i += 1) {
            stream.advance();
        }
        return new Token(TokenKind.ATOM, readWord(), AtomKind.DIRECTIVE, null, span(start), whitespace);
    }

    private String readWord() {
        final var word = new StringBuilder();
        while (true) {
            final var c = stream.peek();
            if (c == CharStream.END || configuration.breaksWord((char) c) || analyzer.atComment()) {
                return word.toString();
            }
            word.append(stream.advance());
        }
    }

    private String readPathRest(final String word, final int terminator) {
        final var path = new StringBuilder(word);
        while (true) {
            final var c = stream.peek();
            if (c == CharStream.END || c == terminator || Character.isWhitespace(c)) {
                return path.toString();
            }
            path.append(stream.advance());
        }
    }

    private String readString(final AtomKind kind, final char delimiter) {
        final var start = stream.position();
        stream.advance();
        final var contents = new StringBuilder();
        while (true) {
            final var position = stream.position();
            final var c = stream.peek();
            if (c == CharStream.END) {
                throw errors.lexical("Unterminated string literal, expected closing '" + delimiter + "'", start);
            }
            stream.advance();
            switch (kind) {
                case ESCAPED_STRING -> {
                    if (c == delimiter) {
                        return contents.toString();
                    } else if (c == '\\') {
                        readEscape(contents, delimiter, position);
                    } else {
                        contents.append((char) c);
                    }
                }
                case RAW_STRING -> {
                    if (c != delimiter) {
                        contents.append((char) c);
                    } else if (stream.peek() == delimiter) {
                        stream.advance();
                        contents.append(delimiter);
                    } else {
                        return contents.toString();
                    }
                }
                case BINARY_STRING -> {
                    if (c == delimiter) {
                        return contents.toString();
                    } else if (c == '0' || c == '1' || c == '_' || c == ' ') {
                        contents.append((char) c);
                    } else {
                        throw errors.lexical(
                            "Invalid character '" + (char) c + "' in binary string, only 0, 1, _ and spaces are allowed",
                            position);
                    }
                }
                default -> throw new UnreachableCodeReachedError("Not a string kind: " + kind);
            }
        }
    }

    private void readEscape(final StringBuilder contents, final char delimiter, final SourcePosition position) {
        final var c = stream.peek();
        if (c == CharStream.END) {
            throw errors.lexical("Unterminated escape sequence", position);
        }
        stream.advance();
        switch (c) {
            case '\\' -> contents.append('\\');
            case '"' -> contents.append('"');
            case 'n' -> contents.append('\n');
            case 't' -> contents.append('\t');
            case 'r' -> contents.append('\r');
            case '0' -> contents.append('\0');
            case 'u' -> contents.appendCodePoint(readUnicodeEscape(position));
            default -> {
                if (c != delimiter) {
                    throw errors.lexical("Invalid escape sequence \\" + (char) c, position);
                }
                contents.append(delimiter);
            }
        }
    }

    private int readUnicodeEscape(final SourcePosition position) {
        if (stream.peek() != '{') {
            throw errors.lexical("Expected '{' after \\u", position);
        }
        stream.advance();
        var codePoint = 0;
        var digits = 0;
        while (true) {
            final var c = stream.peek();
            if (c == '}') {
                stream.advance();
                break;
            }
            final var digit = (c == CharStream.END) ? -1 : Character.digit((char) c, 16);
            if (digit < 0 || digits == maxUnicodeEscapeDigits) {
                throw errors.lexical("Malformed \\u{...} escape sequence", position);
            }
            stream.advance();
            codePoint = codePoint * 16 + digit;
            digits += 1;
        }
        if (digits == 0 || !Character.isValidCodePoint(codePoint)) {
            throw errors.lexical("Invalid code point in \\u{...} escape sequence", position);
        }
        return codePoint;
    }

    private SourceSpan span(final SourcePosition start) {
        return new SourceSpan(start, stream.position());
    }

    private static boolean isSystemPath(final String word) {
        for (final var prefix : pathPrefixes) {
            if (word.startsWith(prefix)) {
                return true;
            }
        }
        return word.contains(":/");
    }

    private static String stripCarriageReturn(final CharSequence text) {
        final var length = text.length();
        return (length > 0 && text.charAt(length - 1) == '\r')
            ? text.subSequence(0, length - 1).toString()
            : text.toString();
    }

    private static final String shebangMarker = "#!";
    private static final String[] pathPrefixes = {"./", "../", "~/", ":/"};
    private static final int maxUnicodeEscapeDigits = 6;

    private final CharStream stream;
    private final Configuration configuration;
    private final ErrorSignaler errors;
    private final WhitespaceAnalyzer analyzer;
}
