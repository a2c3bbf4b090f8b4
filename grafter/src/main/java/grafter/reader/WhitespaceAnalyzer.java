// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import grafter.config.Configuration;

/**
 * Consumes whitespace and comments, reporting line breaks and indentation.
 * <p>
 * A comment is the configured comment prefix followed by a space, a tab, a line break or end of input; it extends up
 * to, but excluding, the next line break. Indentation is counted in spaces; a tab between the start of a line and the
 * first significant character on it is a fatal lexical error. Carriage returns are ignored.
 */
public final class WhitespaceAnalyzer {
    /**
     * Initializes a new analyzer over the given stream, which is assumed to be at the start of a line.
     * <p>
     * Errors are reported as occurring in the {@link ContextKind#TOP} context of a source named {@code "<input>"}.
     */
    public WhitespaceAnalyzer(final CharStream stream, final Configuration configuration) {
        this(stream, configuration, new ErrorSignaler("<input>", () -> ContextKind.TOP));
    }

    WhitespaceAnalyzer(final CharStream stream, final Configuration configuration, final ErrorSignaler errors) {
        this.stream = stream;
        this.errors = errors;
        commentPrefix = configuration.commentPrefix();
    }

    /**
     * Consumes a maximal run of whitespace and comments.
     * <p>
     * If a tab is found in leading indentation, a fatal {@link ParseErrorCondition} is signaled.
     */
    public WhitespaceRun skip() {
        var newlineCount = 0;
        var indent = atLineStart ? 0 : -1;
        var hadComment = false;
        var length = 0;
        while (true) {
            final var c = stream.peek();
            if (c == CharStream.END) {
                break;
            } else if (c == '\n') {
                newlineCount += 1;
                indent = 0;
                atLineStart = true;
            } else if (c == ' ') {
                if (atLineStart) {
                    indent += 1;
                }
            } else if (c == '\t') {
                if (atLineStart) {
                    throw errors.lexical("Tab character in indentation", stream.position());
                }
            } else if (!Character.isWhitespace(c)) {
                // Carriage returns and other whitespace fall through: neither indentation nor line breaks.
                if (!atComment()) {
                    break;
                }
                length += skipComment();
                hadComment = true;
                continue;
            }
            stream.advance();
            length += 1;
        }
        if (stream.peek() != CharStream.END) {
            atLineStart = false;
        }
        return new WhitespaceRun(newlineCount, indent, hadComment, length);
    }

    /**
     * Returns {@code true} iff the stream is at the start of a comment.
     */
    boolean atComment() {
        if (!stream.lookingAt(commentPrefix)) {
            return false;
        }
        final var next = stream.peek(commentPrefix.length());
        return next == CharStream.END || next == ' ' || next == '\t' || next == '\n' || next == '\r';
    }

    private int skipComment() {
        var count = 0;
        while (true) {
            final var c = stream.peek();
            if (c == CharStream.END || c == '\n') {
                return count;
            }
            stream.advance();
            count += 1;
        }
    }

    private final CharStream stream;
    private final ErrorSignaler errors;
    private final String commentPrefix;
    private boolean atLineStart = true;
}
