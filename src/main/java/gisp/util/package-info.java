// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Miscellaneous utilities shared by every stage of the transpiler.
 */
@NonNullByDefault
package gisp.util;

import gisp.util.annotation.NonNullByDefault;
