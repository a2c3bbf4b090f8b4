// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.util.ArrayList;
import grafter.util.Trace;
import grafter.util.condition.Condition;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.Handler;
import grafter.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void nonFatalSignalReturnsWhenDeclined() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> seen.add(signaled.condition().message()))) {
            handler.use();
            ConditionContext.signal(new Note("first"));
            ConditionContext.signal(new Note("second"));
        }
        assertThat(seen).containsExactly("first", "second");
    }

    @Test
    void handlersRunNewestFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(signaled -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new Note("x"));
            }
            ConditionContext.signal(new Note("y"));
        }
        assertThat(order).containsExactly("inner", "outer", "outer");
    }

    @Test
    void unwindingReachesTheChosenRestart() {
        final var result = ConditionContext.withRestart("outer", outer -> {
            final var inner = ConditionContext.withRestart("inner", restart -> {
                try (final var handler = new Handler(signaled -> outer.unwindTo())) {
                    handler.use();
                    throw ConditionContext.error(new Note("abort"));
                }
            });
            return "inner returned " + inner;
        });
        assertThat(result).isNull();
    }

    @Test
    void restartThatIsNotUnwoundReturnsCallbackResult() {
        final String name = ConditionContext.withRestart("plain", restart -> restart.name());
        assertThat(name).isEqualTo("plain");
    }

    @Test
    void declinedErrorIsThrown() {
        final var error = catchThrowableOfType(() -> {
            try (final var handler = new Handler(signaled -> assertThat(signaled.isFatal()).isTrue())) {
                handler.use();
                throw ConditionContext.error(new Note("nobody cares"));
            }
        }, UnhandledErrorError.class);
        assertThat(error.condition().message()).isEqualTo("nobody cares");
        assertThat(error).hasMessageContaining("nobody cares");
    }

    @Test
    void tracesNestAndUnwind() {
        try (final var outer = new Trace("Loading notation")) {
            outer.use();
            try (final var inner = new Trace(() -> "Reading item " + 3)) {
                inner.use();
                assertThat(Trace.activeTraces()).containsExactly("Reading item 3", "Loading notation");
            }
            assertThat(Trace.activeTraces()).containsExactly("Loading notation");
        }
        assertThat(Trace.activeTraces()).isEmpty();
    }

    private static final class Note extends Condition {
        private Note(final String message) {
            super(message);
        }
    }
}
