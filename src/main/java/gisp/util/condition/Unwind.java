// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} to the matching
 * {@link ConditionContext#withRestart(String, RestartCallback)} frame.
 * <p>
 * Public only so that callbacks can declare it. Never catch it yourself.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private static final long serialVersionUID = 1L;

    private final transient @NotNull Restart target;
}
