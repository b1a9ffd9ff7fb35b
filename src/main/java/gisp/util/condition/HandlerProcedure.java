// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body of a {@link Handler}. Returning normally declines the condition; unwinding with {@link Restart#unwindTo()}
 * accepts it.
 */
@FunctionalInterface
public interface HandlerProcedure {
    void handle(@NotNull SignaledCondition condition) throws Unwind;
}
