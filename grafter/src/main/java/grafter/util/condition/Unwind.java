// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable carrying control from {@link Restart#unwindTo()} to its {@link ConditionContext#withRestart} frame.
 * <p>
 * It extends {@link Throwable} directly so that neither {@code catch (Exception)} nor {@code catch (Error)} blocks
 * intercept it. Do not catch it yourself.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
