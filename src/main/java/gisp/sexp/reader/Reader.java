// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import gisp.sexp.QuoteKind;
import gisp.sexp.Sexp;
import gisp.util.UnreachableCodeReachedError;
import gisp.util.annotation.Nullable;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.UnhandledErrorError;

/**
 * The S-expression reader: the primary means of converting a stream of {@link Token}s into {@link Sexp} objects.
 * <p>
 * The reader is a recursive descent parser with one token of lookahead. It pulls tokens from its source only when it
 * needs them and stops pulling as soon as it sees a terminal token or detects an error, so the token source never has
 * to produce anything past the point of failure.
 * <p>
 * Errors are reported as fatal conditions:
 * <ul>
 * <li>{@link LexErrorCondition} if the token source produced an {@link TokenKind#ERROR} token;
 * <li>{@link ReadErrorCondition} if the tokens don't form well-nested S-expressions, or if the nesting exceeds the
 * configured maximum depth.
 * </ul>
 */
public final class Reader {
    /**
     * Initializes a new reader over the given token source, refusing to nest forms deeper than {@code maxDepth}.
     * <p>
     * Depth counts enclosing lists, vectors and quoting prefixes: {@code x} has depth 0, {@code (x)} has depth 1.
     */
    public Reader(final Iterator<Token> tokens, final int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be positive, got " + maxDepth);
        }
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    /**
     * Reads every top-level form until the end of input, in source order.
     */
    public List<Sexp> readAll() {
        final var forms = new ArrayList<Sexp>();
        while (true) {
            final var form = readTopLevelForm();
            if (form == null) {
                return forms;
            }
            forms.add(form);
        }
    }

    /**
     * Attempts to read the next top-level S-expression.
     *
     * <ul>
     * <li>If an S-expression was correctly read, its object representation is returned.
     * <li>If the end of input is reached, {@code null} is returned, and so is every later call.
     * <li>On error, a fatal {@link LexErrorCondition} or {@link ReadErrorCondition} condition is signaled.
     * </ul>
     */
    public @Nullable Sexp readTopLevelForm() {
        if (reachedEnd) {
            return null;
        }
        final var token = pull();
        if (token.kind() == TokenKind.END_OF_INPUT) {
            reachedEnd = true;
            return null;
        }
        depth = 0;
        return readForm(token);
    }

    private Sexp readForm(final Token token) {
        final var text = token.text();
        final var position = token.position();
        return switch (token.kind()) {
            case IDENTIFIER -> new Sexp.Symbol(text, position);
            case INTEGER -> new Sexp.Integer(text, position);
            case FLOAT -> new Sexp.Float(text, position);
            case STRING -> new Sexp.String(text, position);
            case LIST_OPEN -> new Sexp.List(readElements(token, TokenKind.LIST_CLOSE), position);
            case VECTOR_OPEN -> new Sexp.Vector(readElements(token, TokenKind.VECTOR_CLOSE), position);
            case QUOTE -> readQuoted(token, QuoteKind.QUOTE);
            case QUASIQUOTE -> readQuoted(token, QuoteKind.QUASIQUOTE);
            case UNQUOTE -> readQuoted(token, QuoteKind.UNQUOTE);
            case UNQUOTE_SPLICE -> readQuoted(token, QuoteKind.UNQUOTE_SPLICE);
            case LIST_CLOSE -> throw signalReadError("unexpected close paren", position);
            case VECTOR_CLOSE -> throw signalReadError("unexpected close bracket", position);
            case END_OF_INPUT -> throw signalReadError("expected a form but found end of input", position);
            case ERROR -> throw new UnreachableCodeReachedError("Error tokens are signaled when pulled");
        };
    }

    private List<Sexp> readElements(final Token open, final TokenKind closeKind) {
        try {
            enterNesting(open);
            final var elements = new ArrayList<Sexp>();
            while (true) {
                final var token = pull();
                final var kind = token.kind();
                if (kind == closeKind) {
                    return elements;
                }
                if (kind == TokenKind.END_OF_INPUT) {
                    final var what = (closeKind == TokenKind.LIST_CLOSE) ? "unclosed paren" : "unclosed bracket";
                    throw signalReadError(what, open.position());
                }
                elements.add(readForm(token));
            }
        } finally {
            depth -= 1;
        }
    }

    private Sexp.Quoted readQuoted(final Token prefix, final QuoteKind kind) {
        try {
            enterNesting(prefix);
            final var token = pull();
            if (token.kind() == TokenKind.END_OF_INPUT) {
                throw signalReadError("expected a form after " + kind.prefix() + " but found end of input",
                    prefix.position());
            }
            if (token.kind() == TokenKind.LIST_CLOSE || token.kind() == TokenKind.VECTOR_CLOSE) {
                throw signalReadError("expected a form after " + kind.prefix() + " but found '" + token.text() + "'",
                    prefix.position());
            }
            return new Sexp.Quoted(kind, readForm(token), prefix.position());
        } finally {
            depth -= 1;
        }
    }

    private void enterNesting(final Token token) {
        depth += 1;
        if (depth > maxDepth) {
            throw signalReadError("nesting too deep, the maximum depth is " + maxDepth, token.position());
        }
    }

    private Token pull() {
        if (!tokens.hasNext()) {
            throw signalReadError("token stream ended without an end-of-input token", lastPosition);
        }
        final var token = tokens.next();
        lastPosition = token.position();
        if (token.kind() == TokenKind.ERROR) {
            throw ConditionContext.error(new LexErrorCondition(token));
        }
        return token;
    }

    private static UnhandledErrorError signalReadError(final String message, final int position) {
        throw ConditionContext.error(new ReadErrorCondition(message, position));
    }

    private final Iterator<Token> tokens;
    private final int maxDepth;
    private int depth = 0;
    private int lastPosition = 0;
    private boolean reachedEnd = false;
}
