// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.cli;

import gisp.util.Trace;
import gisp.util.condition.Condition;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.HandlerProcedure;
import gisp.util.condition.SignaledCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The handler of last resort: reports a fatal condition nobody else handled, then unwinds to the most recently
 * established restart, which is {@code return-to-repl} in the interactive loop and {@code abort-process} otherwise.
 * <p>
 * Malformed input never gets here, because the transpiler handles its own conditions; what's left is mostly I/O
 * errors.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final Streams streams) {
        this.streams = streams;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            return;
        }
        final var restarts = ConditionContext.restarts();
        if (restarts.isEmpty()) {
            throw new IllegalStateException("No restarts available");
        }
        final var restart = restarts.get(0);
        logger.warn("Unhandled {}, unwinding to {}", condition.condition().getClass().getSimpleName(), restart.name());
        try (final var acquired = streams.acquire()) {
            showCondition(acquired, condition.condition());
        }
        restart.unwindTo();
    }

    private static void showCondition(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.snapshot()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private final Streams streams;

    private static final Logger logger = LoggerFactory.getLogger(FallbackHandler.class);
}
