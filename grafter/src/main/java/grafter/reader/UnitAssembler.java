// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.util.ArrayList;
import java.util.List;
import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.ListOrigin;
import grafter.util.annotation.Nullable;

/**
 * Accumulates one glued unit: {@code prefix* operand (suffix prefix* operand)*}, where each operand is a primary
 * followed by any number of grafted bracket lists.
 * <p>
 * Suffix chains nest to the left, prefixes written after a suffix apply to its right operand only, and the leading
 * prefixes apply to the whole chain: {@code &a.b} is {@code (& (. a b))}.
 */
final class UnitAssembler {
    UnitAssembler(final TransformerResolver resolver) {
        this.resolver = resolver;
    }

    boolean isEmpty() {
        return base == null && left == null && pendingSuffix == null && outerPrefixes.isEmpty();
    }

    /**
     * Returns {@code true} iff the unit has an operand that glued tokens can extend.
     */
    boolean canExtend() {
        return base != null;
    }

    /**
     * Returns {@code true} iff a suffix glue symbol is still waiting for its right operand.
     */
    boolean awaitsSuffixOperand() {
        return pendingSuffix != null && base == null && danglingWord == null;
    }

    /**
     * Returns {@code true} iff a word made only of prefix glue symbols is waiting for a glued operand.
     */
    boolean awaitsDanglingOperand() {
        return danglingWord != null;
    }

    /**
     * Returns {@code true} iff a string glued to the unit would take its current primary as prefix.
     */
    boolean canPrefixString() {
        return base instanceof Datum.Atom atom && atom.kind() == AtomKind.SYMBOL && grafts.isEmpty();
    }

    void prefix(final Datum.Atom symbol, final ListOrigin origin) {
        danglingWord = null;
        activePrefixes().add(new PrefixMark(symbol, origin));
    }

    /**
     * Records a word made only of prefix glue symbols. If no glued operand follows, {@link #demoteDangling()} turns
     * the whole word back into a plain atom.
     */
    void dangling(final Datum.Atom word, final List<Datum.Atom> symbols) {
        for (final var symbol : symbols) {
            prefix(symbol, ListOrigin.APPLICATION);
        }
        danglingWord = word;
        danglingCount = symbols.size();
    }

    void demoteDangling() {
        final var word = danglingWord;
        assert word != null : "No dangling prefix to demote";
        final var prefixes = activePrefixes();
        prefixes.subList(prefixes.size() - danglingCount, prefixes.size()).clear();
        danglingWord = null;
        primary(word, false);
    }

    void primary(final Datum datum, final boolean bracket) {
        assert base == null : "Unit already has a primary";
        danglingWord = null;
        base = datum;
        baseIsBracket = bracket;
    }

    void graft(final Datum.List list) {
        assert base != null : "Nothing to graft onto";
        grafts.add(list);
    }

    void prefixString(final Datum.Atom string) {
        final var prefix = base;
        assert prefix instanceof Datum.Atom : "String prefix must be an atom";
        base = resolver.prefixedString((Datum.Atom) prefix, string);
        baseIsBracket = false;
    }

    void suffix(final Datum.Atom symbol) {
        final var operand = closeOperand();
        final var pending = pendingSuffix;
        final var leftSide = left;
        left = (pending != null && leftSide != null) ? resolver.suffix(pending, leftSide, operand) : operand;
        pendingSuffix = symbol;
    }

    /**
     * Starts the unit from an already built datum, which the following suffix symbol takes as its left operand.
     */
    void continueFrom(final Datum datum) {
        assert isEmpty() : "Continuation of a non-empty unit";
        base = datum;
        baseIsBracket = false;
    }

    /**
     * Finishes the unit, returning it, or {@code null} if nothing was accumulated.
     */
    @Nullable Datum seal() {
        if (isEmpty()) {
            return null;
        }
        assert !awaitsSuffixOperand() && danglingWord == null : "Sealing a unit with a missing operand";
        var result = closeOperand();
        final var pending = pendingSuffix;
        final var leftSide = left;
        if (pending != null && leftSide != null) {
            result = resolver.suffix(pending, leftSide, result);
        }
        for (int i = outerPrefixes.size() - 1; i >= 0; i -= 1) {
            final var mark = outerPrefixes.get(i);
            result = resolver.prefix(mark.symbol(), result, mark.origin());
        }
        outerPrefixes.clear();
        left = null;
        pendingSuffix = null;
        return result;
    }

    private Datum closeOperand() {
        final var primary = base;
        assert primary != null : "Operand without a primary";
        var operand = resolver.graft(primary, baseIsBracket, List.copyOf(grafts));
        grafts.clear();
        base = null;
        baseIsBracket = false;
        for (int i = innerPrefixes.size() - 1; i >= 0; i -= 1) {
            final var mark = innerPrefixes.get(i);
            operand = resolver.prefix(mark.symbol(), operand, mark.origin());
        }
        innerPrefixes.clear();
        return operand;
    }

    private List<PrefixMark> activePrefixes() {
        return (pendingSuffix != null) ? innerPrefixes : outerPrefixes;
    }

    private final TransformerResolver resolver;
    private final List<PrefixMark> outerPrefixes = new ArrayList<>();
    private final List<PrefixMark> innerPrefixes = new ArrayList<>();
    private final List<Datum.List> grafts = new ArrayList<>();
    private @Nullable Datum left = null;
    private Datum.@Nullable Atom pendingSuffix = null;
    private @Nullable Datum base = null;
    private boolean baseIsBracket = false;
    private Datum.@Nullable Atom danglingWord = null;
    private int danglingCount = 0;

    private record PrefixMark(Datum.Atom symbol, ListOrigin origin) {
    }
}
