// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.test;

import java.util.List;
import java.util.NoSuchElementException;
import gisp.sexp.reader.Lexer;
import gisp.sexp.reader.Token;
import gisp.sexp.reader.TokenKind;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class LexerTest {
    @Test
    void listOfIntegers() {
        final var tokens = Lexer.tokenize("(1 2 3)");
        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.LIST_OPEN,
            TokenKind.INTEGER,
            TokenKind.INTEGER,
            TokenKind.INTEGER,
            TokenKind.LIST_CLOSE,
            TokenKind.END_OF_INPUT);
        assertThat(tokens.subList(1, 4)).extracting(Token::text).containsExactly("1", "2", "3");
        assertThat(tokens).extracting(Token::position).containsExactly(0, 1, 3, 5, 6, 7);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "x", "(a (b [c d]) 'e)", "[1 [2 3]]", "; only a comment", "(\"s\" 1.5)\n"})
    void wellFormedInputEndsWithSingleEndOfInput(final String source) {
        final var tokens = Lexer.tokenize(source);
        assertThat(tokens).filteredOn(token -> token.kind().isTerminal()).hasSize(1);
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.END_OF_INPUT);

        var depth = 0;
        for (final var token : tokens) {
            switch (token.kind()) {
                case LIST_OPEN, VECTOR_OPEN -> depth += 1;
                case LIST_CLOSE, VECTOR_CLOSE -> depth -= 1;
                default -> {
                }
            }
            assertThat(depth).isNotNegative();
        }
        assertThat(depth).isZero();
    }

    @Test
    void noTokensAfterTerminal() {
        final var lexer = new Lexer("x");
        assertThat(lexer.next().kind()).isEqualTo(TokenKind.IDENTIFIER);
        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.next().kind()).isEqualTo(TokenKind.END_OF_INPUT);
        assertThat(lexer.hasNext()).isFalse();
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(lexer::next);
    }

    @Test
    void noTokensAfterError() {
        final var lexer = new Lexer("\"abc");
        assertThat(lexer.next().kind()).isEqualTo(TokenKind.ERROR);
        assertThat(lexer.hasNext()).isFalse();
    }

    @Test
    void nestedVectors() {
        assertThat(kinds("[1 [2 3]]")).containsExactly(
            TokenKind.VECTOR_OPEN,
            TokenKind.INTEGER,
            TokenKind.VECTOR_OPEN,
            TokenKind.INTEGER,
            TokenKind.INTEGER,
            TokenKind.VECTOR_CLOSE,
            TokenKind.VECTOR_CLOSE,
            TokenKind.END_OF_INPUT);
    }

    @Test
    void quotingPrefixes() {
        final var tokens = Lexer.tokenize("'a `b ,c ,@d");
        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.QUOTE,
            TokenKind.IDENTIFIER,
            TokenKind.QUASIQUOTE,
            TokenKind.IDENTIFIER,
            TokenKind.UNQUOTE,
            TokenKind.IDENTIFIER,
            TokenKind.UNQUOTE_SPLICE,
            TokenKind.IDENTIFIER,
            TokenKind.END_OF_INPUT);
        assertThat(tokens.get(6)).isEqualTo(new Token(TokenKind.UNQUOTE_SPLICE, 9, ",@"));
    }

    @Test
    void spacesAfterPrefixAreSkipped() {
        assertThat(Lexer.tokenize("'   (x)")).extracting(Token::kind).containsExactly(
            TokenKind.QUOTE,
            TokenKind.LIST_OPEN,
            TokenKind.IDENTIFIER,
            TokenKind.LIST_CLOSE,
            TokenKind.END_OF_INPUT);
    }

    @Test
    void commentsAreElided() {
        assertThat(kinds("(1 ;comment\n 2)")).isEqualTo(kinds("(1 2)"));
        assertThat(kinds("; whole line\nx ; trailing")).containsExactly(TokenKind.IDENTIFIER, TokenKind.END_OF_INPUT);
    }

    @Test
    void atomsKeepTheirText() {
        final var tokens = Lexer.tokenize("foo-bar? 42 1.5 2. \"a \\\" b\"");
        assertThat(tokens).extracting(Token::text)
            .containsExactly("foo-bar?", "42", "1.5", "2.", "\"a \\\" b\"", "");
        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.IDENTIFIER,
            TokenKind.INTEGER,
            TokenKind.FLOAT,
            TokenKind.FLOAT,
            TokenKind.STRING,
            TokenKind.END_OF_INPUT);
    }

    @Test
    void delimitersEndAtoms() {
        assertThat(Lexer.tokenize("(a)[1];c")).extracting(Token::text)
            .containsExactly("(", "a", ")", "[", "1", "]", "");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "\"abc|0|unterminated string",
        "(x \"abc\\|3|unterminated string",
        "12a|0|unexpected rune in integer literal: a",
        "1.5x|0|unexpected rune in float literal: x",
        "1.2.3|0|unexpected rune in float literal: .",
        ")|0|unexpected close paren",
        "(a))|3|unexpected close paren",
        "(]|1|unexpected close bracket",
        "[)|1|unexpected close paren",
        "(|0|unclosed paren",
        "[1 (2|3|unclosed paren",
        "[1 [2]|0|unclosed bracket",
    })
    void errors(final String source, final int position, final String message) {
        final var tokens = Lexer.tokenize(source);
        assertThat(tokens.get(tokens.size() - 1)).isEqualTo(new Token(TokenKind.ERROR, position, message));
        assertThat(tokens).filteredOn(token -> token.kind().isTerminal()).hasSize(1);
    }

    private static List<TokenKind> kinds(final String source) {
        return Lexer.tokenize(source).stream().map(Token::kind).toList();
    }
}
