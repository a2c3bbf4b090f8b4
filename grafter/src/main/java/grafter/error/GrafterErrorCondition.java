// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.error;

import grafter.util.condition.Condition;

/**
 * The base type of every fatal condition signaled by grafter itself.
 */
public abstract class GrafterErrorCondition extends Condition {
    protected GrafterErrorCondition(final String message) {
        super(message);
    }

    /**
     * Retrieves which part of the taxonomy this error belongs to.
     */
    public abstract ErrorKind kind();
}
