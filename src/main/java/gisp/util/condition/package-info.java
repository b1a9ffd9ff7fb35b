// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Every stage of the transpiler reports malformed input by signaling a fatal condition; whoever drives the stage
 * decides, through a {@link gisp.util.condition.Handler}, which {@link gisp.util.condition.Restart} to unwind to.
 */
@NonNullByDefault
package gisp.util.condition;

import gisp.util.annotation.NonNullByDefault;
