// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when the parser reaches a state its own invariants rule out.
 * <p>
 * This is always a bug in grafter, never a problem with the input, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
