// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

/**
 * A single lexeme.
 *
 * @param kind     The kind of this token.
 * @param position The character offset into the source text where the lexeme starts.
 * @param text     The literal text of the lexeme; for {@link TokenKind#ERROR} tokens, the error message instead.
 */
public record Token(TokenKind kind, int position, String text) {
}
