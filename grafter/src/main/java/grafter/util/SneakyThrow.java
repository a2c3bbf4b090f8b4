// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util;

import org.jetbrains.annotations.NotNull;

/**
 * Rethrows checked throwables without declaring them.
 * <p>
 * Reserved for {@link grafter.util.condition.Unwind}, which travels through code that cannot declare it, like
 * lambdas passed to {@link grafter.util.condition.ConditionContext#withRestart}.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} as if it were unchecked. Never returns; the declared return type lets call sites write
     * {@code throw SneakyThrow.doThrow(t)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>rethrow(throwable);
    }

    /**
     * Declares {@code E} as thrown without throwing anything, so that a sneakily thrown {@code E} can be caught.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // The cast to E is erased, so the JVM sees a plain athrow of the original object.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError rethrow(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
