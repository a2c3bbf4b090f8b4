// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import grafter.datum.Datum;
import grafter.reader.Parser;
import grafter.util.Trace;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class StreamingTest {
    @Test
    void itemsArriveInOrder() {
        final var parser = parser("a\nb c\n(d)");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("a");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("(b c)");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("(d)");
        assertThat(parser.readTopLevelItem()).isNull();
        assertThat(parser.readTopLevelItem()).isNull();
    }

    @Test
    void parseReturnsRemainingItems() {
        final var parser = parser("a; b; c");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("a");
        final var rest = parser.parse();
        assertThat(rest.children()).extracting(Trees::print).containsExactly("b", "c");
    }

    @Test
    void siblingGroupIsOneItem() {
        final var parser = parser("if a : x\nelse : y\nz");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("((if a (x)) (else (y)))");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("z");
        assertThat(parser.readTopLevelItem()).isNull();
    }

    @Test
    void laterErrorDoesNotAffectEarlierItems() {
        final var parser = parser("a\nb\n(c");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("a");
        assertThat(print(parser.readTopLevelItem())).isEqualTo("b");
        Conditions.parseError(parser::readTopLevelItem);
    }

    @Test
    void errorHandlersSeeParseTraces() {
        final var traces = new ArrayList<String>();
        final var parser = parser("a\n(b");
        ConditionContext.withRestart("abort-parse", restart -> {
            try (final var handler = new Handler(signaled -> {
                Trace.activeTraces().forEach(traces::add);
                restart.unwindTo();
            })) {
                handler.use();
                parser.parse();
            }
            return null;
        });
        assertThat(traces).containsExactly("Reading top-level item 2 of stream.gr", "Parsing stream.gr");
    }

    @Test
    void independentParsersShareConfiguration() {
        final var first = parser("a b");
        final var second = parser("c d");
        assertThat(print(second.readTopLevelItem())).isEqualTo("(c d)");
        assertThat(print(first.readTopLevelItem())).isEqualTo("(a b)");
        assertThat(List.of(first.parse(), second.parse())).allSatisfy(root -> assertThat(root.children()).isEmpty());
    }

    @Test
    void deepNestingDoesNotUseTheCallStack() {
        final var depth = 20_000;
        final var source = "(".repeat(depth) + "x" + ")".repeat(depth);
        Datum current = Trees.single(source);
        var levels = 0;
        while (current instanceof Datum.List list) {
            assertThat(list.children()).hasSize(1);
            current = list.get(0);
            levels += 1;
        }
        assertThat(levels).isEqualTo(depth);
        assertThat(current).isEqualTo(Trees.single("x"));
    }

    @Test
    void parsersRunInParallel() throws InterruptedException, ExecutionException {
        final var executor = Executors.newFixedThreadPool(4);
        try {
            final var tasks = new ArrayList<Callable<String>>();
            for (int i = 0; i < 16; i += 1) {
                final var index = i;
                tasks.add(() -> Trees.printer.printRoot(Parser.parse("f x" + index + " : a, b\n", Trees.standard)));
            }
            final var results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i += 1) {
                assertThat(results.get(i).get()).isEqualTo("(f x" + i + " (a b));\n");
            }
        } finally {
            executor.shutdown();
        }
    }

    private static Parser parser(final String source) {
        return new Parser(new StringReader(source), "stream.gr", Trees.standard);
    }

    private static String print(final Datum datum) {
        assertThat(datum).isNotNull();
        return Trees.print(datum);
    }
}
