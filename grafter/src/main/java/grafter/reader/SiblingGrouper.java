// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.util.ArrayList;
import java.util.List;
import grafter.config.Configuration;
import grafter.config.SiblingGroup;
import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.ListOrigin;
import grafter.util.annotation.Nullable;

/**
 * Combines adjacent clauses of one sibling keyword group, such as {@code if}, {@code elseif} and {@code else}.
 * <p>
 * An item headed by a group opener is held back. Each following item is checked once, by its head keyword only: it
 * joins the held clauses if the keyword belongs to the same group, is not the opener, and does not come before the
 * previous clause's keyword in declared order. Otherwise the held clauses are emitted and the item is treated anew.
 */
final class SiblingGrouper {
    SiblingGrouper(final Configuration configuration, final TransformerResolver resolver) {
        this.configuration = configuration;
        this.resolver = resolver;
    }

    /**
     * Offers the next item of a context; whatever is ready is appended to {@code out}.
     */
    void offer(final Datum item, final List<Datum> out) {
        final var keyword = headKeyword(item);
        final var currentGroup = group;
        if (currentGroup != null) {
            final var index = (keyword != null) ? currentGroup.indexOf(keyword) : -1;
            if (index > 0 && index >= lastIndex) {
                clauses.add(item);
                lastIndex = index;
                return;
            }
            flush(out);
        }
        final var opened = (keyword != null) ? configuration.siblingGroupOpenedBy(keyword) : null;
        if (opened != null) {
            group = opened;
            lastIndex = 0;
            clauses.add(item);
        } else {
            out.add(item);
        }
    }

    /**
     * Emits the held clauses, if any.
     */
    void flush(final List<Datum> out) {
        if (clauses.isEmpty()) {
            return;
        }
        out.add((clauses.size() == 1) ? clauses.get(0) : resolver.list(
            ListOrigin.SIBLING_GROUP, configuration.applicationDelimiter(), List.copyOf(clauses)));
        clauses.clear();
        group = null;
    }

    private static @Nullable String headKeyword(final Datum item) {
        var head = item;
        if (item instanceof Datum.List list) {
            if (list.origin() != ListOrigin.APPLICATION || list.isEmpty()) {
                return null;
            }
            head = list.get(0);
        }
        return (head instanceof Datum.Atom atom && atom.kind() == AtomKind.SYMBOL) ? atom.text() : null;
    }

    private final Configuration configuration;
    private final TransformerResolver resolver;
    private final List<Datum> clauses = new ArrayList<>();
    private @Nullable SiblingGroup group = null;
    private int lastIndex = 0;
}
