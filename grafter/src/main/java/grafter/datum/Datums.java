// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

import java.util.List;
import grafter.util.annotation.Nullable;

/**
 * A utility class containing common operations on data.
 */
public final class Datums {
    private Datums() {
    }

    /**
     * Returns the given {@code datum} as an atom, or {@code null} if it's a list.
     */
    public static Datum.@Nullable Atom asAtom(final Datum datum) {
        return (datum instanceof Datum.Atom atom) ? atom : null;
    }

    /**
     * Returns the given {@code datum} as a list, or {@code null} if it's an atom.
     */
    public static Datum.@Nullable List asList(final Datum datum) {
        return (datum instanceof Datum.List list) ? list : null;
    }

    /**
     * Returns {@code true} iff the given {@code datum} is a symbol atom with exactly the given text.
     */
    public static boolean isSymbol(final Datum datum, final String text) {
        return datum instanceof Datum.Atom atom && atom.isSymbol(text);
    }

    /**
     * Returns the first child of the given {@code datum} if it's a non-empty list, or {@code null} otherwise.
     */
    public static @Nullable Datum head(final Datum datum) {
        return (datum instanceof Datum.List list && !list.isEmpty()) ? list.get(0) : null;
    }

    /**
     * Returns the union of the spans of {@code data}, which must not be empty.
     */
    public static SourceSpan spanOf(final List<? extends Datum> data) {
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute the span of no data");
        }
        var span = data.get(0).span();
        for (int i = 1; i < data.size(); i += 1) {
            span = span.union(data.get(i).span());
        }
        return span;
    }

    /**
     * Renders the given datum on one line, for debugging. Strings are shown with Java-style double quotes whatever
     * delimiters they were written with; use {@code grafter.reader.CanonicalPrinter} for reparsable output.
     */
    public static String debugString(final Datum datum) {
        final var builder = new StringBuilder();
        appendDebug(builder, datum);
        return builder.toString();
    }

    private static void appendDebug(final StringBuilder builder, final Datum datum) {
        if (datum instanceof Datum.Atom atom) {
            switch (atom.kind()) {
                case SYMBOL, PATH -> builder.append(atom.text());
                case DIRECTIVE -> builder.append("#").append(atom.text());
                case SHEBANG -> builder.append("#!").append(atom.text());
                case ESCAPED_STRING, RAW_STRING, BINARY_STRING -> builder
                    .append('"')
                    .append(atom.text().replace("\\", "\\\\").replace("\"", "\\\""))
                    .append('"');
            }
        } else if (datum instanceof Datum.List list) {
            builder.append(list.delimiter().open());
            var first = true;
            for (final var child : list.children()) {
                if (!first) {
                    builder.append(' ');
                }
                first = false;
                appendDebug(builder, child);
            }
            builder.append(list.delimiter().close());
        }
    }
}
