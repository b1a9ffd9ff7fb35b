// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Rendering of lowered units into Java source text.
 */
@NonNullByDefault
package gisp.render;

import gisp.util.annotation.NonNullByDefault;
