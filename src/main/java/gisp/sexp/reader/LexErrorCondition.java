// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

import gisp.diagnostic.CompilationErrorCondition;
import gisp.diagnostic.Stage;

/**
 * A condition type indicating that the source text contains a malformed lexeme, such as an unterminated string.
 * <p>
 * Signaled by the {@link Reader} when it pulls an {@link TokenKind#ERROR} token.
 */
public final class LexErrorCondition extends CompilationErrorCondition {
    LexErrorCondition(final Token errorToken) {
        super(Stage.LEX, errorToken.position(), errorToken.text());
    }
}
