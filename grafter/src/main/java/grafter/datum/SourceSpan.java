// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A contiguous range of a source text, from {@code start} inclusive to {@code end} exclusive.
 */
public record SourceSpan(SourcePosition start, SourcePosition end) {
    public SourceSpan {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span ends before it starts: " + start + " to " + end);
        }
    }

    /**
     * Returns the empty span located at {@code position}.
     */
    public static SourceSpan at(final SourcePosition position) {
        return new SourceSpan(position, position);
    }

    /**
     * Returns the smallest span covering both this span and {@code other}.
     */
    @CheckReturnValue
    public SourceSpan union(final SourceSpan other) {
        final var first = (other.start.offset() < start.offset()) ? other.start : start;
        final var last = (other.end.offset() > end.offset()) ? other.end : end;
        return new SourceSpan(first, last);
    }

    /**
     * Returns the number of UTF-16 code units covered.
     */
    public int length() {
        return end.offset() - start.offset();
    }

    @Override
    public String toString() {
        return start.line() + ":" + start.column() + "-" + end.line() + ":" + end.column();
    }
}
