// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A condition as seen by a handler.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff it was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
