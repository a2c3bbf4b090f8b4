// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

import grafter.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps track of the handlers and restart points registered by the current thread.
 * <p>
 * Every thread has its own context, so independent parses running on different threads never observe each other's
 * handlers. The context itself is not exposed; the static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals a non-fatal condition.
     * <p>
     * Registered handlers run from the most recently installed to the oldest, until one of them transfers control. If
     * all of them return normally, so does this method.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().runHandlers(new SignaledCondition(condition, false));
    }

    /**
     * Signals a fatal condition.
     * <p>
     * Handlers run as with {@link #signal(Condition)}; if none of them transfers control, {@link UnhandledErrorError}
     * is thrown. The method never returns normally, and is declared to return {@link UnhandledErrorError} so that
     * call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().runHandlers(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a fresh restart point around it.
     *
     * @param restartName A user-readable name for the restart point.
     * @param callback    The code to run; receives the restart it can be unwound to.
     * @return The callback's result, or {@code null} if some handler unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void runHandlers(final @NotNull SignaledCondition condition) {
        // A condition signaled from inside a handler only reaches the handlers installed before that one.
        final var start = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
