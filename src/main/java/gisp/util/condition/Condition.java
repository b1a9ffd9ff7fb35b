// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for everything that can be signaled.
 * <p>
 * Handlers run before anything is unwound, so at that point the signaling code's traces and restart points are still
 * active.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * The short, one-line description shown in diagnostics.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * The description shown when the condition reaches the command line's handler of last resort. Defaults to
     * {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + "(" + message + ")";
    }

    private final @NotNull String message;
}
