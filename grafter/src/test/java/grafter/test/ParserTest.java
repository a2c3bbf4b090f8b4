// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.util.List;
import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.Delimiter;
import grafter.datum.ListOrigin;
import grafter.datum.Shape;
import static grafter.test.Trees.read;
import static grafter.test.Trees.readAll;
import static grafter.test.Trees.single;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class ParserTest {
    @Test
    void emptyInputGivesEmptyRoot() {
        assertThat(Trees.parse("").children()).isEmpty();
        assertThat(Trees.parse("  \n\n  # only a comment\n").children()).isEmpty();
    }

    @Test
    void rootIsTopList() {
        final var root = Trees.parse("a\nb");
        assertThat(root.origin()).isEqualTo(ListOrigin.TOP);
        assertThat(root.delimiter()).isEqualTo(Delimiter.of("()"));
        assertThat(root.children()).hasSize(2);
    }

    @Test
    void singleAtomStaysAtom() {
        final var item = single("hello");
        assertThat(item).isInstanceOf(Datum.Atom.class);
        assertThat(((Datum.Atom) item).kind()).isEqualTo(AtomKind.SYMBOL);
        assertThat(((Datum.Atom) item).text()).isEqualTo("hello");
    }

    @Test
    void runOfSeveralUnitsBecomesApplication() {
        final var item = (Datum.List) single("print x y");
        assertThat(item.origin()).isEqualTo(ListOrigin.APPLICATION);
        assertThat(Trees.print(item)).isEqualTo("(print x y)");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "a + b + c            | (+ (+ a b) c)",
        "a * b + c            | (+ (* a b) c)",
        "a + b * c            | (* (+ a b) c)",
        "f a + b              | (f (+ a b))",
        "+ a b                | (+ a b)",
        "(a + b)              | ((+ a b))",
        "x == y               | (== x y)",
        "a + + b              | (a + + b)",
    })
    void infixFoldsLeftWithoutPrecedence(final String source, final String expected) {
        assertThat(read(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "x >> f >> g          | (>> (>> x f) g)",
        "a -> b -> c          | (-> a (-> b c))",
        "a >> b -> c          | (>> a (-> b c))",
        "a -> b >> c          | (>> (-> a b) c)",
        "x >> f y             | (>> x (f y))",
        "a + b >> f           | (>> (+ a b) f)",
        "-> a b               | (-> a b)",
    })
    void associativeSymbolsFoldOverSegments(final String source, final String expected) {
        assertThat(read(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "&data                | (& data)",
        "share&expensive      | (share& expensive)",
        "~x                   | (~ x)",
        "&~x                  | (& (~ x))",
        "!done                | (! done)",
        "@inline              | (@ inline)",
        "a.b.c                | (. (. a b) c)",
        "&a.b                 | (& (. a b))",
        "a.&b                 | (. a (& b))",
        "x:int                | (: x int)",
        "a. b                 | (. a b)",
        "&(a b)               | (& (a b))",
        "a & b                | (a & b)",
    })
    void glueSymbolsWrapTheirOperands(final String source, final String expected) {
        assertThat(read(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1.5",
        "-1.5",
        "...",
        ".5",
        ".foo",
    })
    void wordsThatDoNotSplit(final String source) {
        final var item = single(source);
        assertThat(item).isInstanceOf(Datum.Atom.class);
        assertThat(((Datum.Atom) item).text()).isEqualTo(source);
    }

    @Test
    void lonePrefixFollowedByWhitespaceIsAtom() {
        final var item = single("& ");
        assertThat(item).isEqualTo(new Datum.Atom("&", AtomKind.SYMBOL, item.span()));
    }

    @Test
    void headGraftKeepsListDelimiter() {
        final var item = (Datum.List) single("f[x]");
        assertThat(item.delimiter()).isEqualTo(Delimiter.of("[]"));
        assertThat(item.shape()).isEqualTo(Shape.STRUCT);
        assertThat(item.children()).extracting(Trees::print).containsExactly("f", "x");
    }

    @Test
    void applicationDelimiterHasNoShape() {
        final var item = (Datum.List) single("f(x)");
        assertThat(item.shape()).isNull();
        assertThat(Trees.print(item)).isEqualTo("(f x)");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "f(x, y)              | (f x y)",
        "f()                  | (f)",
        "f[x]{y}              | (f [x] {y})",
        "(a)[b]               | (a [b])",
        "f(x).g               | (. (f x) g)",
        "f(x).g(y)            | (. (f x) (g y))",
        "r\"raw\"             | (r \"raw\")",
        "f (x)                | (f (x))",
    })
    void gluedBracketListsGraft(final String source, final String expected) {
        assertThat(read(source)).isEqualTo(expected);
    }

    @Test
    void graftChainIsApplication() {
        final var item = (Datum.List) single("f[x]{y}");
        assertThat(item.origin()).isEqualTo(ListOrigin.APPLICATION);
        assertThat(item.delimiter()).isEqualTo(Delimiter.of("()"));
        assertThat(((Datum.List) item.get(2)).delimiter()).isEqualTo(Delimiter.of("{}"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "(a, b)               | (a b)",
        "(a b, c)             | ((a b) c)",
        "(a; b)               | (a b)",
        "()                   | ()",
        "[]                   | []",
        "((a))                | ((a))",
    })
    void delimitedListsSplitAtSeparators(final String source, final String expected) {
        assertThat(read(source)).isEqualTo(expected);
    }

    @Test
    void lineBreaksInsideDelimitedListsAreWhitespace() {
        assertThat(read("(a\n b)")).isEqualTo("(a b)");
        assertThat(read("(a\n    b,\n c)")).isEqualTo("((a b) c)");
    }

    @Test
    void itemBoundaries() {
        assertThat(readAll("a, b")).containsExactly("a", "b");
        assertThat(readAll("a b, c d")).containsExactly("(a b)", "(c d)");
        assertThat(readAll("a; b")).containsExactly("a", "b");
        assertThat(readAll("a\nb c\n\n(d)")).containsExactly("a", "(b c)", "(d)");
    }

    @Test
    void indentedLineAfterCompleteItemStartsNewItem() {
        assertThat(readAll("a\n  b")).containsExactly("a", "b");
        assertThat(readAll("a b\n    c d")).containsExactly("(a b)", "(c d)");
    }

    @Test
    void lineContinuationExtendsPreviousRun() {
        assertThat(read("builder\n  .add 1")).isEqualTo("((. builder add) 1)");
        assertThat(read("list\n  .map f\n  .filter g")).isEqualTo("((. ((. list map) f) filter) g)");
    }

    @Test
    void pathsAreSingleAtoms() {
        final var path = (Datum.Atom) single("./a:b.txt");
        assertThat(path.kind()).isEqualTo(AtomKind.PATH);
        assertThat(path.text()).isEqualTo("./a:b.txt");

        assertThat(((Datum.Atom) single("http://example.com/a.b")).kind()).isEqualTo(AtomKind.PATH);
        assertThat(read("cat ../x/y.txt")).isEqualTo("(cat ../x/y.txt)");

        final var list = (Datum.List) single("(open ~/data)");
        assertThat(((Datum.Atom) list.get(1)).text()).isEqualTo("~/data");

        final var enclosed = (Datum.List) single("(./x)");
        assertThat(((Datum.Atom) enclosed.get(0)).text()).isEqualTo("./x");
    }

    @Test
    void directivesAndShebang() {
        final var directive = (Datum.List) single("#include foo");
        assertThat(directive.get(0)).isEqualTo(new Datum.Atom("include", AtomKind.DIRECTIVE, directive.span()));
        assertThat(Trees.print(directive)).isEqualTo("(#include foo)");

        final var root = Trees.parse("#!/usr/bin/env grafter\nx");
        assertThat(root.children()).hasSize(2);
        final var shebang = (Datum.Atom) root.get(0);
        assertThat(shebang.kind()).isEqualTo(AtomKind.SHEBANG);
        assertThat(shebang.text()).isEqualTo("/usr/bin/env grafter");
    }

    @Test
    void commentsAreDiscarded() {
        assertThat(readAll("a # note\nb")).containsExactly("a", "b");
        assertThat(readAll("# heading\n(a #\n b)")).containsExactly("(a b)");
    }

    @Test
    void commentEndsGluedWord() {
        assertThat(readAll("&# c\nx")).containsExactly("&", "x");
        assertThat(readAll("a.# c\n  b")).containsExactly("(. a b)");
        assertThat(readAll("a#b")).containsExactly("a#b");
    }

    @Test
    void spansCoverSource() {
        final var item = (Datum.List) single("foo  bar");
        assertThat(item.span().start().offset()).isEqualTo(0);
        assertThat(item.span().end().offset()).isEqualTo(8);
        assertThat(item.get(1).span().start().column()).isEqualTo(6);

        final var graft = single("\n  f[x]");
        assertThat(graft.span().start().line()).isEqualTo(2);
        assertThat(graft.span().start().column()).isEqualTo(3);
        assertThat(graft.span().length()).isEqualTo(4);
    }

    @Test
    void equalityIgnoresSpansAndOrigins() {
        assertThat(single("f[x]")).isEqualTo(single("[f  x]"));
        assertThat(single("a + b")).isEqualTo(single("(+ a b)"));
        assertThat(single("a + b")).isNotEqualTo(single("[+ a b]"));
        assertThat(Trees.parse("a\nb").children()).isEqualTo(List.of(single("  a"), single("b")));
    }
}
