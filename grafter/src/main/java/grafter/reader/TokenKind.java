// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

enum TokenKind {
    /** A word still subject to glue recognition. */
    WORD,
    /** A finished atom: a string literal, a system path, a directive or a shebang. */
    ATOM,
    OPEN,
    CLOSE,
    SEPARATOR,
    SEQUENCE,
    END
}
