// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link HandlerProcedure} receives.
 *
 * @param condition The condition.
 * @param isFatal   Whether it was signaled with {@link ConditionContext#error(Condition)}, meaning the signaling code
 *                  can't continue if the handler declines.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
