// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.test;

import java.util.ArrayList;
import gisp.util.Trace;
import gisp.util.condition.Condition;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.Handler;
import gisp.util.condition.Restart;
import gisp.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void handlerUnwindsToRestart() {
        final var result = ConditionContext.withRestart("outer", restart -> {
            try (final var handler = new Handler(signaled -> restart.unwindTo())) {
                handler.use();
                throw ConditionContext.error(new TestCondition("boom"));
            }
        });
        assertThat(result).isNull();
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void restartReturnsCallbackValueWhenNotUnwound() {
        final String value = ConditionContext.withRestart("outer", restart -> "value");
        assertThat(value).isEqualTo("value");
    }

    @Test
    void declinedSignalReturnsNormally() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> seen.add(signaled.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("first"));
            ConditionContext.signal(new TestCondition("second"));
        }
        assertThat(seen).containsExactly("first", "second");
    }

    @Test
    void unhandledErrorThrows() {
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> {
                throw ConditionContext.error(new TestCondition("nobody listens"));
            })
            .withMessageContaining("nobody listens");
    }

    @Test
    void handlersRunNewestFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(signaled -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new TestCondition("x"));
            }
        }
        assertThat(order).containsExactly("inner", "outer");
    }

    @Test
    void restartsAreListedNewestFirst() {
        final var names = ConditionContext.withRestart("outer", outer ->
            ConditionContext.withRestart("inner", inner -> {
                final var result = new ArrayList<String>();
                for (final Restart restart : ConditionContext.restarts()) {
                    result.add(restart.name());
                }
                return result;
            }));
        assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void traceSnapshotIsMostRecentFirst() {
        try (final var outer = new Trace("outer")) {
            outer.use();
            try (final var inner = new Trace(() -> "inner")) {
                inner.use();
                assertThat(Trace.snapshot()).containsExactly("inner", "outer");
            }
            assertThat(Trace.snapshot()).containsExactly("outer");
        }
        assertThat(Trace.snapshot()).isEmpty();
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
