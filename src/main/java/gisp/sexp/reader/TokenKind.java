// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

/**
 * The closed set of token kinds produced by the {@link Lexer}.
 */
public enum TokenKind {
    LIST_OPEN,
    LIST_CLOSE,
    VECTOR_OPEN,
    VECTOR_CLOSE,
    QUOTE,
    QUASIQUOTE,
    UNQUOTE,
    UNQUOTE_SPLICE,
    IDENTIFIER,
    STRING,
    INTEGER,
    FLOAT,
    END_OF_INPUT,
    ERROR;

    /**
     * Returns {@code true} iff no token follows a token of this kind.
     */
    public boolean isTerminal() {
        return this == END_OF_INPUT || this == ERROR;
    }
}
