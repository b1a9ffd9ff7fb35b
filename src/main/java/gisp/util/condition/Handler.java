// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import gisp.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * An active condition handler. Construct it in a try-with-resources header: it's pushed onto the calling thread's
 * handler stack on construction and popped on {@link #close()}.
 */
public final class Handler implements AutoCloseable {
    public Handler(final @NotNull HandlerProcedure procedure) {
        this.procedure = procedure;
        context = ConditionContext.current();
        context.push(this);
    }

    /**
     * Does nothing. Referencing the resource keeps "unused variable" warnings away.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert context == ConditionContext.current() : "Handler closed by a different thread";
        context.pop(this);
    }

    void handle(final @NotNull SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
    }

    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext context;
}
