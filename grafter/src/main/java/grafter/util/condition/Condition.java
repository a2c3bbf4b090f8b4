// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

import grafter.auki.annotations.Open;
import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that went wrong, or is otherwise worth reporting, without deciding how to react to
 * it. Handlers run <em>before</em> the stack is unwound, so they can choose among the restart points that were
 * established below them.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the short, user-readable message of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable description of this condition, including any location information.
     */
    @Open
    public @NotNull String detailedMessage() {
        return message;
    }

    @Open
    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
