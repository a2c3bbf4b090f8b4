// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

import grafter.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A condition handler, registered for the extent of a try-with-resources block.
 * <p>
 * While registered, its procedure sees every condition signaled by the owning thread, unless a newer handler
 * transfers control first.
 */
public final class Handler implements AutoCloseable {
    /**
     * Registers a new handler running {@code procedure} in the calling thread's {@link ConditionContext}.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; referencing the resource silences unused-resource warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters this handler. Handlers must be closed in reverse order of registration, by the registering thread.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind unwind) {
            // Restart frames catch it further up the stack.
            throw SneakyThrow.doThrow(unwind);
        }
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext ownerContext;
}
