// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system in the spirit of Common Lisp, used for every error grafter reports.
 */
@NonNullByDefault
package grafter.util.condition;

import grafter.util.annotation.NonNullByDefault;
