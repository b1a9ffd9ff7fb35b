// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import gisp.util.annotation.Nullable;

/**
 * The tokenizer: a lazy, pull-based sequence of {@link Token}s over one input chunk.
 * <p>
 * The lexer is a state machine with no backtracking. Each call to {@link #next()} runs the machine until it emits
 * exactly one token. The sequence always ends with exactly one terminal token: either {@link TokenKind#END_OF_INPUT},
 * or an {@link TokenKind#ERROR} token carrying the message and the position of the malformed lexeme. After the
 * terminal token, {@link #hasNext()} returns {@code false}.
 * <p>
 * The lexer tracks bracket nesting itself, so an unbalanced close bracket or an unclosed bracket at the end of input
 * is reported as an error token.
 * <p>
 * Instances are single-use and not thread-safe.
 */
public final class Lexer implements Iterator<Token> {
    /**
     * Initializes a new lexer over the full text of one input chunk.
     */
    public Lexer(final String text) {
        stream = new CharStream(text);
    }

    /**
     * Tokenizes the whole text eagerly, including the terminal token.
     */
    public static List<Token> tokenize(final String text) {
        final var lexer = new Lexer(text);
        final var tokens = new ArrayList<Token>();
        while (lexer.hasNext()) {
            tokens.add(lexer.next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return state != State.DONE;
    }

    @Override
    public Token next() {
        if (state == State.DONE) {
            throw new NoSuchElementException("The token stream has already ended");
        }
        while (true) {
            final var token = switch (state) {
                case DISPATCH -> lexDispatch();
                case PREFIX -> lexPrefix();
                case STRING -> lexString();
                case INTEGER -> lexInteger();
                case FLOAT -> lexFloat();
                case SYMBOL -> lexSymbol();
                case COMMENT -> lexComment();
                case DONE -> throw new NoSuchElementException("The token stream has already ended");
            };
            if (token != null) {
                if (token.kind().isTerminal()) {
                    state = State.DONE;
                }
                return token;
            }
        }
    }

    private @Nullable Token lexDispatch() {
        while (!stream.reachedEnd() && isWhitespace(stream.peek())) {
            stream.discardPeek();
        }
        stream.markLexemeStart();
        if (stream.reachedEnd()) {
            return lexEndOfInput();
        }
        final var ch = stream.peek();
        switch (ch) {
            case '(' -> {
                return open(TokenKind.LIST_OPEN);
            }
            case '[' -> {
                return open(TokenKind.VECTOR_OPEN);
            }
            case ')' -> {
                return close(TokenKind.LIST_OPEN, TokenKind.LIST_CLOSE, "unexpected close paren");
            }
            case ']' -> {
                return close(TokenKind.VECTOR_OPEN, TokenKind.VECTOR_CLOSE, "unexpected close bracket");
            }
            case '\'', '`', ',' -> state = State.PREFIX;
            case '"' -> state = State.STRING;
            case ';' -> state = State.COMMENT;
            default -> state = isDigit(ch) ? State.INTEGER : State.SYMBOL;
        }
        return null;
    }

    private Token lexEndOfInput() {
        final var innermost = openBrackets.peek();
        if (innermost == null) {
            return emit(TokenKind.END_OF_INPUT);
        }
        final var message = (innermost.kind() == TokenKind.LIST_OPEN) ? "unclosed paren" : "unclosed bracket";
        return new Token(TokenKind.ERROR, innermost.position(), message);
    }

    private Token open(final TokenKind kind) {
        stream.discardPeek();
        final var token = emit(kind);
        openBrackets.push(token);
        return token;
    }

    private Token close(final TokenKind expectedOpen, final TokenKind kind, final String message) {
        final var innermost = openBrackets.peek();
        if (innermost == null || innermost.kind() != expectedOpen) {
            return error(message);
        }
        stream.discardPeek();
        openBrackets.pop();
        return emit(kind);
    }

    private Token lexPrefix() {
        final var ch = stream.peek();
        stream.discardPeek();
        final TokenKind kind;
        if (ch == '\'') {
            kind = TokenKind.QUOTE;
        } else if (ch == '`') {
            kind = TokenKind.QUASIQUOTE;
        } else if (!stream.reachedEnd() && stream.peek() == '@') {
            stream.discardPeek();
            kind = TokenKind.UNQUOTE_SPLICE;
        } else {
            kind = TokenKind.UNQUOTE;
        }
        final var token = emit(kind);
        while (!stream.reachedEnd() && stream.peek() == ' ') {
            stream.discardPeek();
        }
        state = State.DISPATCH;
        return token;
    }

    private Token lexString() {
        stream.discardPeek();
        while (true) {
            if (stream.reachedEnd()) {
                return error("unterminated string");
            }
            final var ch = stream.peek();
            stream.discardPeek();
            if (ch == '"') {
                state = State.DISPATCH;
                return emit(TokenKind.STRING);
            } else if (ch == '\\') {
                if (stream.reachedEnd()) {
                    return error("unterminated string");
                }
                stream.discardPeek();
            }
        }
    }

    private Token lexInteger() {
        skipDigits();
        if (atDelimiter()) {
            state = State.DISPATCH;
            return emit(TokenKind.INTEGER);
        }
        final var ch = stream.peek();
        if (ch == '.') {
            stream.discardPeek();
            state = State.FLOAT;
            return lexFloat();
        }
        return error("unexpected rune in integer literal: " + ch);
    }

    private Token lexFloat() {
        skipDigits();
        if (atDelimiter()) {
            state = State.DISPATCH;
            return emit(TokenKind.FLOAT);
        }
        return error("unexpected rune in float literal: " + stream.peek());
    }

    private Token lexSymbol() {
        while (!atDelimiter()) {
            stream.discardPeek();
        }
        state = State.DISPATCH;
        return emit(TokenKind.IDENTIFIER);
    }

    private @Nullable Token lexComment() {
        stream.skipToLineFeed();
        state = State.DISPATCH;
        return null;
    }

    private void skipDigits() {
        while (!stream.reachedEnd() && isDigit(stream.peek())) {
            stream.discardPeek();
        }
    }

    private boolean atDelimiter() {
        if (stream.reachedEnd()) {
            return true;
        }
        final var ch = stream.peek();
        return isWhitespace(ch) || ch == ')' || ch == ']' || ch == ';';
    }

    private Token emit(final TokenKind kind) {
        return new Token(kind, stream.lexemeStart(), stream.lexeme());
    }

    private Token error(final String message) {
        return new Token(TokenKind.ERROR, stream.lexemeStart(), message);
    }

    private static boolean isWhitespace(final char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r';
    }

    private static boolean isDigit(final char ch) {
        return ch >= '0' && ch <= '9';
    }

    private final CharStream stream;
    private final ArrayDeque<Token> openBrackets = new ArrayDeque<>();
    private State state = State.DISPATCH;

    private enum State {
        DISPATCH,
        PREFIX,
        STRING,
        INTEGER,
        FLOAT,
        SYMBOL,
        COMMENT,
        DONE,
    }
}
