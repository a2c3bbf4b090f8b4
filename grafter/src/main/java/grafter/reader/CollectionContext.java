// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.util.ArrayList;
import java.util.List;
import grafter.config.Configuration;
import grafter.config.TriggerRule;
import grafter.datum.Datum;
import grafter.datum.Delimiter;
import grafter.datum.SourcePosition;
import grafter.util.annotation.Nullable;

/**
 * One entry of the reader's context stack: the items collected so far, the run being built, and the unit being
 * assembled at the end of that run.
 * <p>
 * The parent of a context is the entry below it on the stack; contexts hold no reference to each other.
 */
final class CollectionContext {
    private CollectionContext(
        final ContextKind kind,
        final Mode mode,
        final int lineIndent,
        final @Nullable TriggerRule trigger,
        final @Nullable Delimiter delimiter,
        final boolean graft,
        final SourcePosition start,
        final Configuration configuration,
        final TransformerResolver resolver
    ) {
        this.kind = kind;
        this.mode = mode;
        this.lineIndent = lineIndent;
        this.trigger = trigger;
        this.delimiter = delimiter;
        this.graft = graft;
        this.start = start;
        this.resolver = resolver;
        assembler = new UnitAssembler(resolver);
        grouper = (kind == ContextKind.DELIMITED) ? null : new SiblingGrouper(configuration, resolver);
    }

    static CollectionContext top(final Configuration configuration, final TransformerResolver resolver) {
        return new CollectionContext(
            ContextKind.TOP, Mode.BLOCK, -1, null, null, false, SourcePosition.START, configuration, resolver);
    }

    /**
     * Creates a context opened by a trigger symbol. Whether it is a block or an inline context is decided by the
     * token that follows the trigger.
     */
    static CollectionContext triggered(
        final TriggerRule trigger,
        final int lineIndent,
        final SourcePosition start,
        final Configuration configuration,
        final TransformerResolver resolver
    ) {
        final var kind = switch (trigger.kind()) {
            case SECTION -> ContextKind.SECTION;
            case STRUCTURE -> ContextKind.STRUCTURE;
            case EFFECT -> ContextKind.EFFECT;
        };
        return new CollectionContext(
            kind, Mode.PENDING, lineIndent, trigger, null, false, start, configuration, resolver);
    }

    static CollectionContext chainSection(
        final int lineIndent,
        final SourcePosition start,
        final Configuration configuration,
        final TransformerResolver resolver
    ) {
        return new CollectionContext(
            ContextKind.CHAIN_SECTION, Mode.BLOCK, lineIndent, null, null, false, start, configuration, resolver);
    }

    /**
     * Creates a bracket list context.
     *
     * @param graft Whether the list is glued to the unit before it, and so grafts onto it when closed.
     */
    static CollectionContext delimited(
        final Delimiter delimiter,
        final boolean graft,
        final SourcePosition start,
        final Configuration configuration,
        final TransformerResolver resolver
    ) {
        return new CollectionContext(
            ContextKind.DELIMITED, Mode.BLOCK, -1, null, delimiter, graft, start, configuration, resolver);
    }

    ContextKind kind() {
        return kind;
    }

    Mode mode() {
        return mode;
    }

    void setMode(final Mode mode) {
        assert this.mode == Mode.PENDING : "Context mode decided twice";
        this.mode = mode;
    }

    int lineIndent() {
        return lineIndent;
    }

    /**
     * Returns {@code true} iff this is an inline section, structure or effect.
     */
    boolean isInline() {
        return mode == Mode.INLINE;
    }

    /**
     * Returns {@code true} iff this context is closed by a line indented at most as deep as {@link #lineIndent()}.
     */
    boolean isIndentBlock() {
        return mode == Mode.BLOCK && kind != ContextKind.TOP && kind != ContextKind.DELIMITED;
    }

    @Nullable TriggerRule trigger() {
        return trigger;
    }

    @Nullable Delimiter delimiter() {
        return delimiter;
    }

    boolean isGraft() {
        return graft;
    }

    SourcePosition start() {
        return start;
    }

    UnitAssembler assembler() {
        return assembler;
    }

    List<Datum> items() {
        return items;
    }

    /**
     * Finishes the unit being assembled, appending it to the run.
     */
    void sealUnit() {
        final var unit = assembler.seal();
        if (unit != null) {
            run.add(new RunElement(unit, false));
        }
    }

    void appendElement(final Datum datum) {
        sealUnit();
        run.add(new RunElement(datum, false));
    }

    void appendOperator(final Datum.Atom symbol) {
        sealUnit();
        run.add(new RunElement(symbol, true));
    }

    boolean hasRun() {
        return !run.isEmpty();
    }

    boolean endsWithAssociativeOperator(final Configuration configuration) {
        if (run.isEmpty()) {
            return false;
        }
        final var symbol = run.get(run.size() - 1).operatorSymbol();
        return symbol != null && configuration.associativityOf(symbol) != null;
    }

    /**
     * Removes and returns the current run.
     */
    List<RunElement> takeRun() {
        final var taken = List.copyOf(run);
        run.clear();
        return taken;
    }

    /**
     * Ends the current run as an item. In a bracket list this also marks the list as separated, so that every run
     * becomes one child.
     */
    void endItem() {
        sealUnit();
        final var currentGrouper = grouper;
        if (currentGrouper == null) {
            sawBoundary = true;
            if (!run.isEmpty()) {
                items.add(resolver.collapse(takeRun()));
            }
        } else if (!run.isEmpty()) {
            currentGrouper.offer(resolver.collapse(takeRun()), items);
        }
    }

    /**
     * Ends the current run and releases any held sibling clauses, in preparation for materialization.
     */
    void finish() {
        endItemOrKeepRun();
        final var currentGrouper = grouper;
        if (currentGrouper != null) {
            currentGrouper.flush(items);
        }
    }

    /**
     * Returns the children of a closed bracket list: every separated run, or the elements of the only run.
     */
    List<Datum> bracketChildren() {
        assert kind == ContextKind.DELIMITED;
        if (sawBoundary) {
            return List.copyOf(items);
        }
        return resolver.fold(run);
    }

    private void endItemOrKeepRun() {
        sealUnit();
        if (kind == ContextKind.DELIMITED && !sawBoundary) {
            // Unseparated bracket lists keep their elements, see bracketChildren().
            return;
        }
        endItem();
    }

    private final ContextKind kind;
    private Mode mode;
    private final int lineIndent;
    private final @Nullable TriggerRule trigger;
    private final @Nullable Delimiter delimiter;
    private final boolean graft;
    private final SourcePosition start;
    private final TransformerResolver resolver;
    private final UnitAssembler assembler;
    private final @Nullable SiblingGrouper grouper;
    private final List<Datum> items = new ArrayList<>();
    private final List<RunElement> run = new ArrayList<>();
    private boolean sawBoundary = false;

    /**
     * How a context ends.
     */
    enum Mode {
        /** A trigger context whose form is decided by the next token. */
        PENDING,
        /** Ends at a sequence character, a line break, an enclosing closing delimiter or end of input. */
        INLINE,
        /** Ends at a dedent, a closing delimiter, or end of input, depending on the kind. */
        BLOCK
    }
}
