// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line interface: file mode and the interactive loop.
 */
@NonNullByDefault
package gisp.cli;

import gisp.util.annotation.NonNullByDefault;
