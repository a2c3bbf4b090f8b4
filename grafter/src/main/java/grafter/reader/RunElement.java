// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import grafter.datum.Datum;
import grafter.util.annotation.Nullable;

/**
 * One element of an undelimited run.
 *
 * @param operator Whether the element is a standalone infix or associative symbol, written with whitespace before it.
 *                 Only such elements take part in folds.
 */
record RunElement(Datum datum, boolean operator) {
    /**
     * Returns the operator symbol text, or {@code null} if this element is not an operator.
     */
    @Nullable String operatorSymbol() {
        return (operator && datum instanceof Datum.Atom atom) ? atom.text() : null;
    }
}
