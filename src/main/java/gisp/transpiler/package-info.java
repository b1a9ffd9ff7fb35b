// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The single entry point that drives the reader and the lowering engine over one input chunk and reports the outcome
 * as an ordinary value.
 */
@NonNullByDefault
package gisp.transpiler;

import gisp.util.annotation.NonNullByDefault;
