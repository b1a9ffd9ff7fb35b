// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The S-expression tree the reader produces and the lowering engine consumes.
 */
@NonNullByDefault
package gisp.sexp;

import gisp.util.annotation.NonNullByDefault;
