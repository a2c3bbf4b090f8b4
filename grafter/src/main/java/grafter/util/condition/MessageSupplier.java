// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util.condition;

/**
 * A lazily computed trace message.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
