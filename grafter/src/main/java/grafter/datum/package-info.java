// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The syntax tree produced by the reader: atoms, delimiter-tagged lists, and their source spans.
 */
@NonNullByDefault
package grafter.datum;

import grafter.util.annotation.NonNullByDefault;
