// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.util.function.Supplier;
import grafter.datum.SourcePosition;
import grafter.error.ErrorKind;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.UnhandledErrorError;

final class ErrorSignaler {
    ErrorSignaler(final String sourceName, final Supplier<ContextKind> activeContext) {
        this.sourceName = sourceName;
        this.activeContext = activeContext;
    }

    UnhandledErrorError lexical(final String message, final SourcePosition position) {
        throw signal(ErrorKind.LEXICAL, message, position);
    }

    UnhandledErrorError structural(final String message, final SourcePosition position) {
        throw signal(ErrorKind.STRUCTURAL, message, position);
    }

    private UnhandledErrorError signal(final ErrorKind kind, final String message, final SourcePosition position) {
        throw ConditionContext.error(new ParseErrorCondition(kind, message, sourceName, position, activeContext.get()));
    }

    private final String sourceName;
    private final Supplier<ContextKind> activeContext;
}
