// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

/**
 * The fold direction of an associative symbol.
 */
public enum Associativity {
    LEFT,
    RIGHT
}
