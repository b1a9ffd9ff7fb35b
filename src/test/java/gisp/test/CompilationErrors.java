// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.test;

import java.util.concurrent.atomic.AtomicReference;
import gisp.diagnostic.CompilationErrorCondition;
import gisp.diagnostic.Diagnostic;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;

final class CompilationErrors {
    private CompilationErrors() {
    }

    /**
     * Runs the action, which is expected to signal a compilation error, and returns that error as a diagnostic.
     */
    static Diagnostic capture(final Runnable action) {
        final var captured = new AtomicReference<Diagnostic>();
        final var completed = ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.condition() instanceof final CompilationErrorCondition error) {
                    captured.set(error.toDiagnostic());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                action.run();
                return Boolean.TRUE;
            }
        });
        assertThat(completed).as("action completed without signaling an error").isNull();
        return captured.get();
    }
}
