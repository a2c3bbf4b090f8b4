// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import grafter.config.Configuration;
import grafter.datum.AtomKind;
import grafter.datum.Datum;

/**
 * Prints data in the canonical form: every list with its explicit delimiters, children separated by single spaces.
 * <p>
 * Reading the printed form of a tree back with the same configuration yields an equal tree.
 */
public final class CanonicalPrinter {
    public CanonicalPrinter(final Configuration configuration) {
        this.configuration = configuration;
    }

    /**
     * Prints {@code datum} on one line.
     */
    public String print(final Datum datum) {
        final var builder = new StringBuilder();
        append(builder, datum);
        return builder.toString();
    }

    /**
     * Prints the items of a root list, each terminated by a sequence character and a line break. Without a sequence
     * character, the line break alone ends each item.
     */
    public String printRoot(final Datum.List root) {
        final var builder = new StringBuilder();
        for (final var item : root.children()) {
            append(builder, item);
            if (item instanceof Datum.Atom atom && atom.kind() == AtomKind.SHEBANG) {
                builder.append('\n');
                continue;
            }
            final var sequence = configuration.firstSequence();
            if (sequence != null) {
                // A path runs up to whitespace, so it must not touch the sequence character.
                if (item instanceof Datum.Atom atom && atom.kind() == AtomKind.PATH) {
                    builder.append(' ');
                }
                builder.append(sequence.charValue());
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    private void append(final StringBuilder builder, final Datum datum) {
        if (datum instanceof Datum.Atom atom) {
            appendAtom(builder, atom);
        } else if (datum instanceof Datum.List list) {
            builder.append(list.delimiter().open());
            for (int i = 0; i < list.size(); i += 1) {
                if (i != 0) {
                    builder.append(' ');
                }
                append(builder, list.get(i));
            }
            builder.append(list.delimiter().close());
        }
    }

    private void appendAtom(final StringBuilder builder, final Datum.Atom atom) {
        final var text = atom.text();
        switch (atom.kind()) {
            case SYMBOL, PATH -> builder.append(text);
            case DIRECTIVE -> builder.append(configuration.directivePrefix()).append(text);
            case SHEBANG -> builder.append("#!").append(text);
            case ESCAPED_STRING -> appendEscaped(builder, text);
            case RAW_STRING -> {
                final var delimiter = configuration.stringDelimiters().raw();
                builder.append(delimiter);
                for (int i = 0; i < text.length(); i += 1) {
                    final var c = text.charAt(i);
                    if (c == delimiter) {
                        builder.append(delimiter);
                    }
                    builder.append(c);
                }
                builder.append(delimiter);
            }
            case BINARY_STRING -> {
                final var delimiter = configuration.stringDelimiters().binary();
                builder.append(delimiter).append(text).append(delimiter);
            }
        }
    }

    private void appendEscaped(final StringBuilder builder, final String text) {
        final var delimiter = configuration.stringDelimiters().escaped();
        builder.append(delimiter);
        for (int i = 0; i < text.length(); i += 1) {
            final var c = text.charAt(i);
            if (c == '\\' || c == delimiter) {
                builder.append('\\').append(c);
            } else if (c == '\n') {
                builder.append("\\n");
            } else if (c == '\t') {
                builder.append("\\t");
            } else if (c == '\r') {
                builder.append("\\r");
            } else if (c == '\0') {
                builder.append("\\0");
            } else if (Character.isISOControl(c)) {
                builder.append("\\u{").append(Integer.toHexString(c)).append('}');
            } else {
                builder.append(c);
            }
        }
        builder.append(delimiter);
    }

    private final Configuration configuration;
}
