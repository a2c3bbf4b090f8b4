// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control.
 * <p>
 * Callers that want to react to errors are expected to install a handler, so reaching this is a programming error.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition.detailedMessage());
        this.condition = condition;
    }

    /**
     * Retrieves the condition nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
