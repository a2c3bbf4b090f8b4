// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class RoundTripTest {
    @ParameterizedTest
    @ValueSource(strings = {
        "a + b + c",
        "(a + b) * c",
        "f[x]{y}.g(&z) :int",
        "if a : x\nelseif b : y\nelse : z",
        "def f :\n  a\n  b\nc",
        "data >>\n  filter x\n  map y",
        "#!/bin/sh\n#include \"lib\"\ncat ./a/b.txt\n",
        "s = 'it''s' \"q\\\"\\n\" `01`",
        "point :: x, y; run :! a",
        "a -> b -> c >> d",
        "x:int, 1.5, ..., .5, a.b.c",
        "f : a, :int",
        "[a, :int]",
        "share&x & ~y",
        "(open ./data) ./other",
        "match v\ncase 1 : a\ncase 2 : b",
        "&# c\nx",
        "f a.# c\n  b",
        "x |\n  a\n  :T",
        "",
    })
    void printedFormReadsBackEqual(final String source) {
        final var root = Trees.parse(source);
        final var printed = Trees.printer.printRoot(root);
        assertThat(Trees.parse(printed)).isEqualTo(root);
    }

    @Test
    void printedRootSeparatesItems() {
        assertThat(Trees.printer.printRoot(Trees.parse("a b\nc"))).isEqualTo("(a b);\nc;\n");
        assertThat(Trees.printer.printRoot(Trees.parse("./x"))).isEqualTo("./x ;\n");
        assertThat(Trees.printer.printRoot(Trees.parse("#!/bin/sh\nx"))).isEqualTo("#!/bin/sh\nx;\n");
    }
}
