// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.util.concurrent.atomic.AtomicReference;
import grafter.config.ConfigurationErrorCondition;
import grafter.reader.ParseErrorCondition;
import grafter.util.condition.Condition;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import org.jetbrains.annotations.Nullable;

final class Conditions {
    private Conditions() {
    }

    /**
     * Runs {@code action}, returning the first fatal condition it signals, or {@code null} if it completes.
     */
    static @Nullable Condition captureFatal(final Runnable action) {
        final var captured = new AtomicReference<Condition>();
        ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    captured.set(signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                action.run();
            }
            return null;
        });
        return captured.get();
    }

    static ParseErrorCondition parseError(final Runnable action) {
        final var condition = captureFatal(action);
        assertThat(condition).isInstanceOf(ParseErrorCondition.class);
        return (ParseErrorCondition) condition;
    }

    static ConfigurationErrorCondition configurationError(final Runnable action) {
        final var condition = captureFatal(action);
        assertThat(condition).isInstanceOf(ConfigurationErrorCondition.class);
        return (ConfigurationErrorCondition) condition;
    }
}
