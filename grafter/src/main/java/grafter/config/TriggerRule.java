// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import grafter.datum.Delimiter;

/**
 * A trigger symbol and the delimiter its context materializes into.
 */
public record TriggerRule(TriggerKind kind, String symbol, Delimiter materializer) {
}
