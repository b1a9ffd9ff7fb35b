// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Structured reporting of malformed input, shared by the tokenizer, the reader and the lowering engine.
 */
@NonNullByDefault
package gisp.diagnostic;

import gisp.util.annotation.NonNullByDefault;
