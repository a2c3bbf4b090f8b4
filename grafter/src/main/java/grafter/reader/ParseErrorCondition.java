// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import grafter.datum.SourcePosition;
import grafter.error.ErrorKind;
import grafter.error.GrafterErrorCondition;

/**
 * A condition type indicating that the source could not be parsed.
 */
public final class ParseErrorCondition extends GrafterErrorCondition {
    ParseErrorCondition(
        final ErrorKind kind,
        final String rawMessage,
        final String sourceName,
        final SourcePosition position,
        final ContextKind contextKind
    ) {
        super(rawMessage);
        this.kind = kind;
        this.sourceName = sourceName;
        this.position = position;
        this.contextKind = contextKind;
    }

    @Override
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Retrieves the name of the source being parsed.
     */
    public String sourceName() {
        return sourceName;
    }

    /**
     * Retrieves the position the error was detected at.
     */
    public SourcePosition position() {
        return position;
    }

    /**
     * Retrieves the kind of the innermost collection context open when the error was detected.
     */
    public ContextKind contextKind() {
        return contextKind;
    }

    @Override
    public String detailedMessage() {
        return sourceName + ':' + position.line() + ':' + position.column() + ": "
            + kind.name().toLowerCase() + " error: " + message()
            + "\nAt offset " + position.offset() + ", within a " + contextKind.name().toLowerCase() + " context";
    }

    private final ErrorKind kind;
    private final String sourceName;
    private final SourcePosition position;
    private final ContextKind contextKind;
}
