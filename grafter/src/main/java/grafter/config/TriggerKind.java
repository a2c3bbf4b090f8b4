// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import grafter.datum.ListOrigin;

/**
 * The three kinds of trigger-opened collection contexts.
 */
public enum TriggerKind {
    SECTION(ListOrigin.SECTION),
    STRUCTURE(ListOrigin.STRUCTURE),
    EFFECT(ListOrigin.EFFECT);

    TriggerKind(final ListOrigin origin) {
        this.origin = origin;
    }

    /**
     * Retrieves the origin given to lists materialized from contexts of this kind.
     */
    public ListOrigin origin() {
        return origin;
    }

    private final ListOrigin origin;
}
