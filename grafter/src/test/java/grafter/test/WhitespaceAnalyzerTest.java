// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.io.StringReader;
import grafter.datum.SourcePosition;
import grafter.error.ErrorKind;
import grafter.reader.CharStream;
import grafter.reader.ContextKind;
import grafter.reader.WhitespaceAnalyzer;
import grafter.reader.WhitespaceRun;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class WhitespaceAnalyzerTest {
    @Test
    void countsLineBreaksAndIndentation() {
        final var stream = stream("  \n   x");
        final var run = analyzer(stream).skip();
        assertThat(run).isEqualTo(new WhitespaceRun(1, 3, false, 6));
        assertThat(run.startsLine()).isTrue();
        assertThat(stream.peek()).isEqualTo('x');
    }

    @Test
    void skipsComments() {
        final var stream = stream("# note\n  y");
        final var run = analyzer(stream).skip();
        assertThat(run).isEqualTo(new WhitespaceRun(1, 2, true, 9));
        assertThat(stream.peek()).isEqualTo('y');
    }

    @Test
    void commentPrefixNeedsTrailingSpace() {
        final var stream = stream("#x");
        assertThat(analyzer(stream).skip().isEmpty()).isTrue();
        assertThat(stream.peek()).isEqualTo('#');
    }

    @Test
    void gluedTokensHaveEmptyRun() {
        final var stream = stream("ab");
        final var analyzer = analyzer(stream);
        assertThat(analyzer.skip().startsLine()).isTrue();
        stream.advance();
        final var run = analyzer.skip();
        assertThat(run.isEmpty()).isTrue();
        assertThat(run.startsLine()).isFalse();
    }

    @Test
    void inlineTabIsWhitespace() {
        final var stream = stream("a\tb");
        final var analyzer = analyzer(stream);
        analyzer.skip();
        stream.advance();
        assertThat(analyzer.skip()).isEqualTo(new WhitespaceRun(0, -1, false, 1));
    }

    @Test
    void carriageReturnsAreIgnored() {
        final var stream = stream("a\r\n  b");
        final var analyzer = analyzer(stream);
        analyzer.skip();
        stream.advance();
        assertThat(analyzer.skip()).isEqualTo(new WhitespaceRun(1, 2, false, 4));
    }

    @Test
    void tabInIndentationIsLexicalError() {
        final var error = Conditions.parseError(() -> analyzer(stream("\tx")).skip());
        assertThat(error.kind()).isEqualTo(ErrorKind.LEXICAL);
        assertThat(error.contextKind()).isEqualTo(ContextKind.TOP);
        assertThat(error.sourceName()).isEqualTo("<input>");
        assertThat(error.position()).isEqualTo(SourcePosition.START);
    }

    private static CharStream stream(final String text) {
        return new CharStream(new StringReader(text));
    }

    private static WhitespaceAnalyzer analyzer(final CharStream stream) {
        return new WhitespaceAnalyzer(stream, Trees.standard);
    }
}
