// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The configuration table: which characters and symbols play which syntactic role.
 * <p>
 * A {@link grafter.config.Configuration} is validated once when built and is read-only afterwards, so one instance
 * can serve any number of parses on any number of threads.
 */
@NonNullByDefault
package grafter.config;

import grafter.util.annotation.NonNullByDefault;
