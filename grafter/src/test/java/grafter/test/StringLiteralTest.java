// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.error.ErrorKind;
import static grafter.test.Trees.read;
import static grafter.test.Trees.single;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class StringLiteralTest {
    @Test
    void escapedStringsDecodeEscapes() {
        assertThat(atom("\"a\\nb\\t\\\\\"")).isEqualTo(new Atom("a\nb\t\\", AtomKind.ESCAPED_STRING));
        assertThat(atom("\"say \\\"hi\\\"\"")).isEqualTo(new Atom("say \"hi\"", AtomKind.ESCAPED_STRING));
        assertThat(atom("\"\\r\\0\"")).isEqualTo(new Atom("\r\0", AtomKind.ESCAPED_STRING));
        assertThat(atom("\"\\u{41}\\u{1F600}\"")).isEqualTo(new Atom("A\uD83D\uDE00", AtomKind.ESCAPED_STRING));
        assertThat(atom("\"\"")).isEqualTo(new Atom("", AtomKind.ESCAPED_STRING));
    }

    @Test
    void rawStringsTakeContentLiterally() {
        assertThat(atom("'a\\nb'")).isEqualTo(new Atom("a\\nb", AtomKind.RAW_STRING));
        assertThat(atom("'it''s'")).isEqualTo(new Atom("it's", AtomKind.RAW_STRING));
        assertThat(atom("''''")).isEqualTo(new Atom("'", AtomKind.RAW_STRING));
    }

    @Test
    void binaryStringsKeepDigits() {
        assertThat(atom("`0101_1111 0000`")).isEqualTo(new Atom("0101_1111 0000", AtomKind.BINARY_STRING));
    }

    @Test
    void stringsMaySpanLines() {
        final var item = (Datum.Atom) single("\"one\ntwo\"");
        assertThat(item.text()).isEqualTo("one\ntwo");
        assertThat(item.span().end().line()).isEqualTo(2);
    }

    @Test
    void stringGluedToWordIsPrefixed() {
        assertThat(read("r\"x\"")).isEqualTo("(r \"x\")");
        assertThat(read("b`01`")).isEqualTo("(b `01`)");
        assertThat(read("f \"x\"")).isEqualTo("(f \"x\")");
        assertThat(read("\"a\"\"b\"")).isEqualTo("(\"a\" \"b\")");
        assertThat(read("(f)\"x\"")).isEqualTo("((f) \"x\")");
    }

    @Test
    void stringsBreakWords() {
        assertThat(read("a\"b\"c")).isEqualTo("((a \"b\") c)");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "\"abc",
        "'abc",
        "`01",
        "\"\\q\"",
        "\"\\u{}\"",
        "\"\\u{110000}\"",
        "\"\\u{1234567}\"",
        "\"\\u41\"",
        "`012`",
        "\"abc\\",
    })
    void malformedStringsAreLexicalErrors(final String source) {
        final var error = Conditions.parseError(() -> Trees.parse(source));
        assertThat(error.kind()).isEqualTo(ErrorKind.LEXICAL);
    }

    @Test
    void unterminatedStringIsReportedAtItsStart() {
        final var error = Conditions.parseError(() -> Trees.parse("x = \"abc\ndef"));
        assertThat(error.position().offset()).isEqualTo(4);
        assertThat(error.position().column()).isEqualTo(5);
    }

    @Test
    void printerEscapesWhatReaderDecodes() {
        assertThat(read("\"a\\nb\\t\\\"\\\\\"")).isEqualTo("\"a\\nb\\t\\\"\\\\\"");
        assertThat(read("\"\\u{7}\"")).isEqualTo("\"\\u{7}\"");
        assertThat(read("'it''s'")).isEqualTo("'it''s'");
        assertThat(read("`1 0`")).isEqualTo("`1 0`");
    }

    private static Atom atom(final String source) {
        final var datum = single(source);
        assertThat(datum).isInstanceOf(Datum.Atom.class);
        final var atom = (Datum.Atom) datum;
        return new Atom(atom.text(), atom.kind());
    }

    private record Atom(String text, AtomKind kind) {
    }
}
