// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import gisp.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * A named point the stack can be unwound to, established by {@link ConditionContext#withRestart(String,
 * RestartCallback)}.
 * <p>
 * gisp uses three: {@code abort-transpilation} around each transpiler stage, {@code return-to-repl} around each
 * interactive line, and {@code abort-process} around the whole command line run.
 */
public final class Restart {
    Restart(final @NotNull String name, final @NotNull ConditionContext context) {
        this.name = name;
        this.context = context;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Unwinds the stack to this restart point. Never returns.
     *
     * @throws IllegalStateException If the restart point is no longer active.
     */
    public void unwindTo() {
        if (!context.isActive(this)) {
            throw new IllegalStateException("Restart " + name + " is no longer active");
        }
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    @Override
    public @NotNull String toString() {
        return "Restart[" + name + "]";
    }

    private final @NotNull String name;
    private final @NotNull ConditionContext context;
}
