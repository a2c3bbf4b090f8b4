// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.reader;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import grafter.config.Configuration;
import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.Delimiter;
import grafter.datum.ListOrigin;
import grafter.datum.SourcePosition;
import grafter.datum.SourceSpan;
import grafter.util.Trace;
import grafter.util.UnreachableCodeReachedError;
import grafter.util.annotation.Nullable;

/**
 * The reader: turns a character source into a tree of data, one top-level item at a time.
 * <p>
 * A parser instance belongs to one source and owns its cursor and context stack; the configuration is only read, so
 * any number of parsers may share it. Errors are fatal: a {@link ParseErrorCondition} is signaled through
 * {@link grafter.util.condition.ConditionContext#error}, and the parser must not be used after a handler unwinds out
 * of it.
 * <p>
 * If the character source throws an {@link java.io.IOException}, it is signaled as a fatal
 * {@link grafter.util.condition.exception.IOExceptionCondition}.
 */
public final class Parser {
    /**
     * Creates a parser of {@code source}.
     *
     * @param sourceName A user-readable name of the source, used in error messages and traces.
     */
    public Parser(final Reader source, final String sourceName, final Configuration configuration) {
        this.configuration = configuration;
        this.sourceName = sourceName;
        errors = new ErrorSignaler(sourceName, () -> top().kind());
        lexer = new Lexer(new CharStream(source), configuration, errors);
        resolver = new TransformerResolver(configuration);
        splitter = new WordSplitter(configuration);
        stack.add(CollectionContext.top(configuration, resolver));
    }

    /**
     * Parses a whole in-memory source.
     */
    public static Datum.List parse(final String source, final Configuration configuration) {
        return new Parser(new StringReader(source), "<string>", configuration).parse();
    }

    /**
     * Reads the whole remaining source, returning the root list of every top-level item not yet read.
     */
    public Datum.List parse() {
        try (final var trace = new Trace(() -> "Parsing " + sourceName)) {
            trace.use();
            final var items = new ArrayList<Datum>();
            while (true) {
                final var item = readTopLevelItem();
                if (item == null) {
                    break;
                }
                items.add(item);
            }
            logger.log(Level.FINE, "Parsed {0} top-level items from {1}", new Object[]{items.size(), sourceName});
            return new Datum.List(
                ListOrigin.TOP,
                configuration.sectionMaterializer(),
                configuration.shapeOf(configuration.sectionMaterializer()),
                items,
                new SourceSpan(SourcePosition.START, endPosition));
        }
    }

    /**
     * Reads the next top-level item, or returns {@code null} at end of input.
     * <p>
     * An item is complete once the next one has begun, so at most the first token of the following item has been
     * consumed when this method returns. Callers may stop pulling items at any point.
     */
    public @Nullable Datum readTopLevelItem() {
        final var top = stack.get(0);
        if (top.items().isEmpty() && !finished) {
            final var index = itemsRead + 1;
            try (final var trace = new Trace(() -> "Reading top-level item " + index + " of " + sourceName)) {
                trace.use();
                while (top.items().isEmpty() && !finished) {
                    step();
                }
            }
        }
        if (top.items().isEmpty()) {
            return null;
        }
        itemsRead += 1;
        return top.items().remove(0);
    }

    private void step() {
        final var token = lexer.next(pathTerminator());
        var frame = top();
        final var assembler = frame.assembler();

        if (assembler.awaitsDanglingOperand()) {
            if (token.glued() && token.startsOperand()) {
                feedOperand(token);
                return;
            }
            if (token.kind() == TokenKind.END && token.glued()) {
                throw errors.structural("Unexpected end of input right after prefix glue", token.start());
            }
            assembler.demoteDangling();
        } else if (assembler.awaitsSuffixOperand()) {
            if (token.kind() == TokenKind.END) {
                throw errors.structural("Unexpected end of input, expected the right operand of suffix glue",
                    token.start());
            }
            if (!token.startsOperand()) {
                throw errors.structural("Expected the right operand of suffix glue, found \"" + token.text() + '"',
                    token.start());
            }
            if (token.whitespace().newlineCount() > 0) {
                currentLineIndent = token.whitespace().indentColumns();
            }
            feedOperand(token);
            return;
        }

        final var glued = token.glued() && assembler.canExtend();
        final var extendsUnit = glued && (token.kind() == TokenKind.OPEN
            || (token.kind() == TokenKind.ATOM && token.isString() && assembler.canPrefixString())
            || (token.kind() == TokenKind.WORD && configuration.matchSuffixGlue(token.text(), 0) != null));
        if (!extendsUnit) {
            frame.sealUnit();
        }

        final var whitespace = token.whitespace();
        if (frame.mode() == CollectionContext.Mode.PENDING) {
            if (whitespace.newlineCount() > 0) {
                if (token.kind() == TokenKind.END || whitespace.indentColumns() <= frame.lineIndent()) {
                    throw errors.structural("Empty section, expected an indented block", token.start());
                }
                frame.setMode(CollectionContext.Mode.BLOCK);
                currentLineIndent = whitespace.indentColumns();
            } else {
                frame.setMode(CollectionContext.Mode.INLINE);
            }
        } else if (whitespace.newlineCount() > 0 && handleNewline(token)) {
            return;
        }

        frame = top();
        switch (token.kind()) {
            case END -> finish(token);
            case SEPARATOR -> frame.endItem();
            case SEQUENCE -> {
                closeInlineContexts(token.start());
                top().endItem();
            }
            case OPEN -> push(CollectionContext.delimited(
                delimiterOf(token), extendsUnit, token.start(), configuration, resolver));
            case CLOSE -> closeDelimited(token);
            case ATOM -> readAtom(token, extendsUnit);
            case WORD -> readWord(token, extendsUnit);
            default -> throw new UnreachableCodeReachedError("Unknown token kind " + token.kind());
        }
    }

    /**
     * Handles the line break before {@code token}: line continuations, associative chain sections, closing contexts
     * that end at this line, and the item boundary.
     *
     * @return {@code true} iff the token was consumed.
     */
    private boolean handleNewline(final Token token) {
        final var previousIndent = currentLineIndent;
        final var indent = token.whitespace().indentColumns();
        currentLineIndent = indent;
        final var frame = top();
        if (frame.kind() == ContextKind.DELIMITED) {
            return false;
        }

        if (token.kind() == TokenKind.WORD && frame.hasRun() && indent > frame.lineIndent()) {
            final var suffix = configuration.matchSuffixGlue(token.text(), 0);
            if (suffix != null && !suffix.equals(configuration.typeTagSymbol()) && !isOperatorSymbol(token.text())) {
                frame.assembler().continueFrom(resolver.collapse(frame.takeRun()));
                feedPieces(splitter.continuation(token, suffix));
                return true;
            }
        }

        if (token.kind() != TokenKind.END && frame.endsWithAssociativeOperator(configuration)
            && indent > previousIndent) {
            push(CollectionContext.chainSection(previousIndent, token.start(), configuration, resolver));
            return false;
        }

        while (true) {
            final var current = top();
            if (current.isInline() || (current.isIndentBlock() && current.lineIndent() >= indent)) {
                closeUndelimited(token.start());
            } else {
                break;
            }
        }
        if (top().kind() != ContextKind.DELIMITED) {
            top().endItem();
        }
        return false;
    }

    private void readAtom(final Token token, final boolean extendsUnit) {
        final var frame = top();
        if (extendsUnit) {
            frame.assembler().prefixString(token.toAtom());
        } else if (token.atomKind() == AtomKind.SHEBANG) {
            frame.appendElement(token.toAtom());
            frame.endItem();
        } else {
            frame.assembler().primary(token.toAtom(), false);
        }
    }

    private void readWord(final Token token, final boolean extendsUnit) {
        final var frame = top();
        final var text = token.text();
        if (extendsUnit) {
            final var suffix = configuration.matchSuffixGlue(text, 0);
            assert suffix != null;
            feedPieces(splitter.continuation(token, suffix));
            return;
        }

        final var glued = token.glued();
        final var trigger = configuration.triggerFor(text);
        if (trigger != null && !glued) {
            if (frame.hasRun()) {
                push(CollectionContext.triggered(trigger, currentLineIndent, token.start(), configuration, resolver));
            } else {
                frame.assembler().primary(token.toAtom(), false);
            }
            return;
        }
        if (!glued && (configuration.isInfix(text) || configuration.associativityOf(text) != null)) {
            frame.appendOperator(token.toAtom());
            return;
        }

        final var tag = configuration.typeTagSymbol();
        if (tag != null && !glued && text.startsWith(tag) && text.length() > tag.length()) {
            feedPieces(splitter.bareTag(token, tag));
        } else if (configuration.matchSuffixGlue(text, 0) != null) {
            frame.assembler().primary(token.toAtom(), false);
        } else {
            feedWordOperand(token);
        }
    }

    /**
     * Feeds the token that must supply the operand of a pending glue symbol.
     */
    private void feedOperand(final Token token) {
        switch (token.kind()) {
            case WORD -> feedWordOperand(token);
            case ATOM -> top().assembler().primary(token.toAtom(), false);
            case OPEN -> push(CollectionContext.delimited(
                delimiterOf(token), false, token.start(), configuration, resolver));
            default -> throw new UnreachableCodeReachedError("Token cannot start an operand: " + token.kind());
        }
    }

    private void feedWordOperand(final Token token) {
        if (splitter.isPrefixOnly(token.text())) {
            final var symbols = new ArrayList<Datum.Atom>();
            for (final var piece : splitter.prefixes(token)) {
                symbols.add(piece.atom());
            }
            top().assembler().dangling(token.toAtom(), symbols);
        } else {
            feedPieces(splitter.unit(token));
        }
    }

    private void feedPieces(final List<WordSplitter.Piece> pieces) {
        final var assembler = top().assembler();
        for (final var piece : pieces) {
            switch (piece.kind()) {
                case PREFIX -> assembler.prefix(piece.atom(), ListOrigin.APPLICATION);
                case TAG -> assembler.prefix(piece.atom(), ListOrigin.TYPE_TAG);
                case PRIMARY -> assembler.primary(piece.atom(), false);
                case SUFFIX -> assembler.suffix(piece.atom());
                default -> throw new UnreachableCodeReachedError("Unknown piece kind " + piece.kind());
            }
        }
    }

    private void closeInlineContexts(final SourcePosition position) {
        while (top().isInline()) {
            closeUndelimited(position);
        }
    }

    private void closeDelimited(final Token token) {
        while (top().kind() != ContextKind.DELIMITED && top().kind() != ContextKind.TOP) {
            closeUndelimited(token.start());
        }
        final var frame = top();
        final var closing = delimiterOf(token);
        if (frame.kind() == ContextKind.TOP) {
            throw errors.structural("Unexpected closing '" + closing.close() + "' with no open list", token.start());
        }
        final var open = frame.delimiter();
        assert open != null;
        if (!open.equals(closing)) {
            throw errors.structural(
                "Mismatched closing '" + closing.close() + "', expected '" + open.close() + "' to close the list"
                    + " opened at " + frame.start(),
                token.start());
        }

        frame.finish();
        final var list = resolver.bracket(
            open, frame.bracketChildren(), new SourceSpan(frame.start(), token.span().end()));
        pop();
        final var parent = top().assembler();
        if (frame.isGraft()) {
            parent.graft(list);
        } else {
            parent.primary(list, list.origin() == ListOrigin.BRACKET);
        }
    }

    /**
     * Closes the innermost context, a section, structure, effect or chain section, appending its materialized form to
     * the run of its parent.
     */
    private void closeUndelimited(final SourcePosition position) {
        final var frame = top();
        frame.finish();
        final var items = List.copyOf(frame.items());
        if (items.isEmpty()) {
            throw errors.structural("Empty section", position);
        }
        final Datum result;
        final var trigger = frame.trigger();
        if (trigger != null) {
            result = resolver.materialize(items, trigger.materializer(), trigger.kind().origin());
        } else if (items.size() == 1) {
            result = items.get(0);
        } else {
            result = resolver.materialize(items, configuration.sectionMaterializer(), ListOrigin.SECTION);
        }
        pop();
        top().appendElement(result);
    }

    private void finish(final Token token) {
        while (top().kind() != ContextKind.TOP) {
            final var frame = top();
            if (frame.kind() == ContextKind.DELIMITED) {
                final var open = frame.delimiter();
                assert open != null;
                throw errors.structural(
                    "Unexpected end of input, expected '" + open.close() + "' to close the list opened at "
                        + frame.start(),
                    token.start());
            }
            closeUndelimited(token.start());
        }
        top().finish();
        endPosition = token.span().end();
        finished = true;
    }

    private boolean isOperatorSymbol(final String text) {
        return configuration.triggerFor(text) != null || configuration.isInfix(text)
            || configuration.associativityOf(text) != null;
    }

    private int pathTerminator() {
        for (int i = stack.size() - 1; i >= 0; i -= 1) {
            final var delimiter = stack.get(i).delimiter();
            if (delimiter != null) {
                return delimiter.close();
            }
        }
        return CharStream.END;
    }

    private static Delimiter delimiterOf(final Token token) {
        final var delimiter = token.delimiter();
        assert delimiter != null : "Not a bracket token: " + token;
        return delimiter;
    }

    private CollectionContext top() {
        return stack.get(stack.size() - 1);
    }

    private void push(final CollectionContext context) {
        stack.add(context);
    }

    private void pop() {
        assert stack.size() > 1 : "Cannot pop the top-level context";
        stack.remove(stack.size() - 1);
    }

    private static final Logger logger = Logger.getLogger(Parser.class.getName());

    private final Configuration configuration;
    private final String sourceName;
    private final ErrorSignaler errors;
    private final Lexer lexer;
    private final TransformerResolver resolver;
    private final WordSplitter splitter;
    private final List<CollectionContext> stack = new ArrayList<>();
    private boolean finished = false;
    private int currentLineIndent = 0;
    private int itemsRead = 0;
    private SourcePosition endPosition = SourcePosition.START;
}
