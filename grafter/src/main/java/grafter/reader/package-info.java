// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The mechanical reader: converts a character stream into a delimiter-preserving syntax tree, driven entirely by a
 * {@link grafter.config.Configuration}.
 * <p>
 * The entry point is {@link grafter.reader.Parser}.
 */
@NonNullByDefault
package grafter.reader;

import grafter.util.annotation.NonNullByDefault;
