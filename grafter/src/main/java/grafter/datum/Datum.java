// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.datum;

import java.util.Objects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import grafter.util.annotation.Nullable;

/**
 * The base type of syntax tree nodes.
 * <p>
 * Data are immutable. Equality is structural: source spans and list origins are provenance and are ignored by
 * {@code equals} and {@code hashCode}, so a tree compares equal to the tree of its canonical printed form.
 */
public sealed interface Datum {
    /**
     * Retrieves the source text range this datum was read from. Synthetic data cover the union of their parts.
     */
    SourceSpan span();

    /**
     * An indivisible text span.
     */
    @SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
    record Atom(java.lang.String text, AtomKind kind, SourceSpan span) implements Datum {
        /**
         * Returns {@code true} iff this is a {@link AtomKind#SYMBOL} atom with exactly the given text.
         */
        public boolean isSymbol(final java.lang.String symbol) {
            return kind == AtomKind.SYMBOL && text.equals(symbol);
        }

        @Override
        public boolean equals(final @Nullable Object object) {
            return object instanceof Atom atom && text.equals(atom.text) && kind == atom.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, kind);
        }

        @Override
        public java.lang.String toString() {
            return Datums.debugString(this);
        }
    }

    /**
     * An ordered sequence of data, tagged with the delimiter dictated by the rule that produced it.
     */
    @SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
    record List(
        ListOrigin origin,
        Delimiter delimiter,
        @Nullable Shape shape,
        java.util.List<Datum> children,
        SourceSpan span
    ) implements Datum {
        public List {
            children = java.util.List.copyOf(children);
        }

        /**
         * Returns the number of children.
         */
        public int size() {
            return children.size();
        }

        /**
         * Returns the child at {@code index}.
         */
        public Datum get(final int index) {
            return children.get(index);
        }

        /**
         * Returns {@code true} iff this list has no children.
         */
        public boolean isEmpty() {
            return children.isEmpty();
        }

        @Override
        public boolean equals(final @Nullable Object object) {
            return object instanceof List list
                && delimiter.equals(list.delimiter)
                && shape == list.shape
                && children.equals(list.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(delimiter, shape, children);
        }

        @Override
        public java.lang.String toString() {
            return Datums.debugString(this);
        }
    }
}
