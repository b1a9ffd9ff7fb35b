// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The lowering engine: translation of S-expression trees into JavaParser syntax trees.
 * <p>
 * Lists whose head symbol names a registered {@link gisp.lowering.SpecialForm} are lowered by that form's rule,
 * everything else by the generic rules of {@link gisp.lowering.Lowerer}.
 */
@NonNullByDefault
package gisp.lowering;

import gisp.util.annotation.NonNullByDefault;
