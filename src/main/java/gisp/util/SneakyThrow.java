// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throws checked throwables without declaring them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} unchecked. Used for {@link gisp.util.condition.Unwind}, which would otherwise have to be
     * declared by every method between a handler and its restart. The return type lets call sites write
     * {@code throw SneakyThrow.doThrow(...)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is inferred as RuntimeException and erased, so the cast is a no-op.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
