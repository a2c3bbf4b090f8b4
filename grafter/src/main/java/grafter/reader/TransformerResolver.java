// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.util.ArrayList;
import java.util.List;
import grafter.config.Associativity;
import grafter.config.Configuration;
import grafter.datum.Datum;
import grafter.datum.Datums;
import grafter.datum.Delimiter;
import grafter.datum.ListOrigin;
import grafter.datum.SourceSpan;

/**
 * Builds the synthetic lists of glue, graft and fold rules, and materializes closed contexts.
 * <p>
 * Every synthetic list spans the union of its constituents.
 */
final class TransformerResolver {
    TransformerResolver(final Configuration configuration) {
        this.configuration = configuration;
    }

    /**
     * Creates a list with the given delimiter spanning its children, which must not be empty.
     */
    Datum.List list(final ListOrigin origin, final Delimiter delimiter, final List<Datum> children) {
        return list(origin, delimiter, children, Datums.spanOf(children));
    }

    Datum.List list(
        final ListOrigin origin,
        final Delimiter delimiter,
        final List<Datum> children,
        final SourceSpan span
    ) {
        return new Datum.List(origin, delimiter, configuration.shapeOf(delimiter), children, span);
    }

    Datum.List application(final List<Datum> children) {
        return list(ListOrigin.APPLICATION, configuration.applicationDelimiter(), children);
    }

    /**
     * Applies a prefix glue symbol, or a bare type tag, to its operand: {@code (symbol operand)}.
     */
    Datum.List prefix(final Datum.Atom symbol, final Datum operand, final ListOrigin origin) {
        return list(origin, configuration.applicationDelimiter(), List.of(symbol, operand));
    }

    /**
     * Applies a suffix glue symbol: {@code (symbol left right)}.
     */
    Datum.List suffix(final Datum.Atom symbol, final Datum left, final Datum right) {
        return application(List.of(symbol, left, right));
    }

    /**
     * Wraps a string literal glued after a plain atom: {@code (prefix "string")}.
     */
    Datum.List prefixedString(final Datum.Atom prefix, final Datum.Atom string) {
        return application(List.of(prefix, string));
    }

    /**
     * Attaches bracket lists glued after {@code base}.
     * <p>
     * A list written in brackets takes the grafted lists as additional children (tail graft). Any other base becomes
     * the head of a single grafted list, which keeps its own delimiter, or the head of an application of several.
     */
    Datum graft(final Datum base, final boolean baseIsBracket, final List<Datum.List> grafts) {
        if (grafts.isEmpty()) {
            return base;
        }
        if (baseIsBracket && base instanceof Datum.List list) {
            final var children = new ArrayList<>(list.children());
            children.addAll(grafts);
            return new Datum.List(
                list.origin(), list.delimiter(), list.shape(), children, list.span().union(Datums.spanOf(grafts)));
        }
        if (grafts.size() == 1) {
            final var only = grafts.get(0);
            final var children = new ArrayList<Datum>(only.size() + 1);
            children.add(base);
            children.addAll(only.children());
            return list(ListOrigin.BRACKET, only.delimiter(), children, base.span().union(only.span()));
        }
        final var children = new ArrayList<Datum>(grafts.size() + 1);
        children.add(base);
        children.addAll(grafts);
        return application(children);
    }

    /**
     * Folds a run and collapses it into one datum: the sole remaining element, or an application of all of them.
     */
    Datum collapse(final List<RunElement> run) {
        final var folded = fold(run);
        return (folded.size() == 1) ? folded.get(0) : application(folded);
    }

    /**
     * Applies the infix fold, then the associative fold, to a run.
     * <p>
     * Infix symbols fold left to right without precedence: the earliest {@code x S y} triple becomes {@code (S x y)}
     * and scanning resumes at the new element. Associative symbols then split the run into segments, each collapsed
     * into one operand; maximal stretches of right-associative symbols nest to the right, and everything else nests
     * to the left. A run with an empty segment, such as one headed by a symbol, is left alone.
     */
    List<Datum> fold(final List<RunElement> run) {
        final var elements = foldInfix(run);
        final var operators = new ArrayList<RunElement>();
        final var segments = new ArrayList<List<RunElement>>();
        var segment = new ArrayList<RunElement>();
        for (final var element : elements) {
            final var symbol = element.operatorSymbol();
            if (symbol != null && configuration.associativityOf(symbol) != null) {
                operators.add(element);
                segments.add(segment);
                segment = new ArrayList<>();
            } else {
                segment.add(element);
            }
        }
        segments.add(segment);
        if (operators.isEmpty() || segments.stream().anyMatch(List::isEmpty)) {
            return data(elements);
        }

        final var operands = new ArrayList<Datum>(segments.size());
        for (final var part : segments) {
            final var data = data(part);
            operands.add((data.size() == 1) ? data.get(0) : application(data));
        }
        final var symbols = new ArrayList<Datum>(operators.size());
        for (final var operator : operators) {
            symbols.add(operator.datum());
        }

        var k = 0;
        while (k < symbols.size()) {
            if (!isRightAssociative(symbols.get(k))) {
                k += 1;
                continue;
            }
            var last = k;
            while (last + 1 < symbols.size() && isRightAssociative(symbols.get(last + 1))) {
                last += 1;
            }
            var accumulated = operands.get(last + 1);
            for (int j = last; j >= k; j -= 1) {
                accumulated = application(List.of(symbols.get(j), operands.get(j), accumulated));
            }
            operands.subList(k, last + 2).clear();
            operands.add(k, accumulated);
            symbols.subList(k, last + 1).clear();
        }

        var accumulated = operands.get(0);
        for (int j = 0; j < symbols.size(); j += 1) {
            accumulated = application(List.of(symbols.get(j), accumulated, operands.get(j + 1)));
        }
        return List.of(accumulated);
    }

    /**
     * Materializes the items of a closed section, structure or effect.
     * <p>
     * A single list item stands for itself; anything else is wrapped in the materializer delimiter. A trailing bare
     * tag is removed first, and tags the materialized remainder: {@code (tag remainder operand)}.
     */
    Datum materialize(final List<Datum> items, final Delimiter materializer, final ListOrigin origin) {
        assert !items.isEmpty() : "Cannot materialize an empty context";
        final var last = items.get(items.size() - 1);
        if (items.size() >= 2 && isBareTag(last)) {
            final var rest = wrap(items.subList(0, items.size() - 1), materializer, origin);
            return applyTag((Datum.List) last, rest);
        }
        return wrap(items, materializer, origin);
    }

    /**
     * Materializes a closed bracket list. Bracket lists never collapse, but a trailing bare tag still tags the rest.
     */
    Datum.List bracket(final Delimiter delimiter, final List<Datum> children, final SourceSpan span) {
        if (children.size() >= 2 && isBareTag(children.get(children.size() - 1))) {
            final var rest = list(ListOrigin.BRACKET, delimiter, children.subList(0, children.size() - 1), span);
            return applyTag((Datum.List) children.get(children.size() - 1), rest);
        }
        return list(ListOrigin.BRACKET, delimiter, children, span);
    }

    /**
     * Returns {@code true} iff {@code datum} is a bare type tag, {@code (tag operand)} written without a left side.
     */
    static boolean isBareTag(final Datum datum) {
        return datum instanceof Datum.List list && list.origin() == ListOrigin.TYPE_TAG && list.size() == 2;
    }

    private Datum wrap(final List<Datum> items, final Delimiter materializer, final ListOrigin origin) {
        if (items.size() == 1 && items.get(0) instanceof Datum.List) {
            return items.get(0);
        }
        return list(origin, materializer, items);
    }

    private Datum.List applyTag(final Datum.List tag, final Datum tagged) {
        return list(ListOrigin.TYPE_TAG, configuration.applicationDelimiter(), List.of(tag.get(0), tagged, tag.get(1)));
    }

    private List<RunElement> foldInfix(final List<RunElement> run) {
        final var elements = new ArrayList<>(run);
        var i = 1;
        while (i + 1 < elements.size()) {
            final var symbol = elements.get(i).operatorSymbol();
            final var left = elements.get(i - 1);
            final var right = elements.get(i + 1);
            if (symbol != null && configuration.isInfix(symbol) && !left.operator() && !right.operator()) {
                final var folded = application(List.of(elements.get(i).datum(), left.datum(), right.datum()));
                elements.subList(i - 1, i + 2).clear();
                elements.add(i - 1, new RunElement(folded, false));
            } else {
                i += 1;
            }
        }
        return elements;
    }

    private boolean isRightAssociative(final Datum symbol) {
        return symbol instanceof Datum.Atom atom && configuration.associativityOf(atom.text()) == Associativity.RIGHT;
    }

    private static List<Datum> data(final List<RunElement> elements) {
        final var data = new ArrayList<Datum>(elements.size());
        for (final var element : elements) {
            data.add(element.datum());
        }
        return data;
    }

    private final Configuration configuration;
}
