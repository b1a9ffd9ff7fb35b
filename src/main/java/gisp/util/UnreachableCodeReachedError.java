// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown where control flow can't get to, such as after {@link SneakyThrow#doThrow(Throwable)} or when a restart was
 * unwound to without the state its handler should have recorded.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
