// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.io.IOException;
import java.io.Reader;
import grafter.datum.SourcePosition;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.exception.IOExceptionCondition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A stream of characters with bounded multi-character lookahead and position tracking.
 * <p>
 * Characters are pulled lazily from the underlying {@link Reader}, which is buffered internally, so the passed reader
 * does not need to be buffered for performance. Lines are separated by {@code '\n'}; offsets and columns count UTF-16
 * code units.
 */
public final class CharStream {
    /**
     * The value returned by {@link #peek()} at end of input.
     */
    public static final int END = -1;

    /**
     * Initializes a new character stream reading from the given reader.
     */
    public CharStream(final @NotNull Reader reader) {
        this.reader = reader;
        buffer = new char[bufferCapacity];
    }

    /**
     * Returns the current character without consuming it, or {@link #END} at end of input.
     * <p>
     * If an I/O error occurs, the {@link IOException} is caught and signaled as a fatal {@link IOExceptionCondition}.
     */
    public int peek() {
        return peek(0);
    }

    /**
     * Returns the character {@code ahead} positions past the current one without consuming anything, or {@link #END}
     * if the input ends before it.
     */
    public int peek(final int ahead) {
        assert ahead >= 0 && ahead < maxLookahead : "Lookahead out of bounds: " + ahead;
        while (position + ahead >= bufferSize) {
            if (!refill()) {
                return END;
            }
        }
        return buffer[position + ahead];
    }

    /**
     * Consumes the current character and returns it.
     * <p>
     * Calling this method at end of input is an error; check with {@link #peek()} first.
     */
    public char advance() {
        final var c = peek();
        assert c != END : "advance() called at end of input";
        position += 1;
        offset += 1;
        if (c == '\n') {
            line += 1;
            column = 1;
        } else {
            column += 1;
        }
        return (char) c;
    }

    /**
     * Returns {@code true} iff the characters at the current position spell {@code text}.
     */
    public boolean lookingAt(final @NotNull String text) {
        for (int i = 0; i < text.length(); i += 1) {
            if (peek(i) != text.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the position of the current character.
     */
    public @NotNull SourcePosition position() {
        return new SourcePosition(offset, line, column);
    }

    private boolean refill() {
        final var source = reader;
        if (source == null) {
            return false;
        }
        // Keep the unconsumed lookahead, move it to the front.
        final var remaining = bufferSize - position;
        System.arraycopy(buffer, position, buffer, 0, remaining);
        position = 0;
        bufferSize = remaining;
        final int count;
        try {
            count = source.read(buffer, bufferSize, buffer.length - bufferSize);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        if (count > 0) {
            bufferSize += count;
            return true;
        }
        // End of input: drop the reader so that it can be collected and never asked again.
        reader = null;
        return false;
    }

    private static final int bufferCapacity = 8192;
    private static final int maxLookahead = 64;

    private @Nullable Reader reader;
    private final char @NotNull [] buffer;
    private int position = 0;
    private int bufferSize = 0;
    private int offset = 0;
    private int line = 1;
    private int column = 1;
}
