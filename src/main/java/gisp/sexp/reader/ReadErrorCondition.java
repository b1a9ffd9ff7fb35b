// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

import gisp.diagnostic.CompilationErrorCondition;
import gisp.diagnostic.Stage;

/**
 * A condition type indicating that the token stream doesn't form well-nested S-expressions.
 */
public final class ReadErrorCondition extends CompilationErrorCondition {
    ReadErrorCondition(final String message, final int offset) {
        super(Stage.PARSE, offset, message);
    }
}
