// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The conditions grafter signals when a configuration or a source is rejected.
 */
@NonNullByDefault
package grafter.error;

import grafter.util.annotation.NonNullByDefault;
