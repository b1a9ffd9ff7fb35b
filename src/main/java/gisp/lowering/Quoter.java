// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.ArrayList;
import java.util.List;
import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import gisp.sexp.QuoteKind;
import gisp.sexp.Sexp;
import gisp.sexp.Sexps;
import gisp.util.Trace;
import gisp.util.UnreachableCodeReachedError;
import gisp.util.annotation.Nullable;

/**
 * Lowering of quoted data.
 * <p>
 * Quoted atoms become literals, with symbols turned into strings of their names. Quoted lists become
 * {@code java.util.Arrays.asList(...)} calls and quoted vectors become {@code Object[]} creations. Nested quoting
 * forms become two-element lists headed by the name of the quoting form, so {@code ''x} is the same data as
 * {@code '(quote x)}.
 * <p>
 * Quasiquotation tracks its nesting level: only unquotes at the level of the outermost quasiquote are evaluated, the
 * ones inside a nested quasiquote are data.
 */
final class Quoter {
    Quoter(final Lowerer lowerer) {
        this.lowerer = lowerer;
    }

    Expression quote(final Sexp datum) {
        final var quoting = Quoting.of(datum);
        if (quoting != null) {
            return quotingList(quoting.kind(), quote(quoting.inner()));
        } else if (datum instanceof Sexp.List list) {
            return list(quoteAll(list.elements()));
        } else if (datum instanceof Sexp.Vector vector) {
            return array(quoteAll(vector.elements()));
        } else {
            return atom((Sexp.Atom) datum);
        }
    }

    Expression quasiquote(final Sexp template) {
        try (final var trace = new Trace(() -> "Expanding quasiquote " + Sexps.print(template))) {
            trace.use();
            return quasiquote(template, 1);
        }
    }

    private Expression quasiquote(final Sexp template, final int level) {
        final var quoting = Quoting.of(template);
        if (quoting != null) {
            return switch (quoting.kind()) {
                case QUOTE -> quotingList(QuoteKind.QUOTE, quasiquote(quoting.inner(), level));
                case QUASIQUOTE -> quotingList(QuoteKind.QUASIQUOTE, quasiquote(quoting.inner(), level + 1));
                case UNQUOTE -> (level == 1)
                    ? lowerer.lowerExpression(quoting.inner())
                    : quotingList(QuoteKind.UNQUOTE, quasiquote(quoting.inner(), level - 1));
                case UNQUOTE_SPLICE -> {
                    if (level == 1) {
                        throw Lowerer.signalError("unquote-splice must appear inside a list or vector", template);
                    }
                    yield quotingList(QuoteKind.UNQUOTE_SPLICE, quasiquote(quoting.inner(), level - 1));
                }
            };
        } else if (template instanceof Sexp.List list) {
            return sequence(list.elements(), level, false);
        } else if (template instanceof Sexp.Vector vector) {
            return sequence(vector.elements(), level, true);
        } else {
            return atom((Sexp.Atom) template);
        }
    }

    private Expression sequence(final List<Sexp> elements, final int level, final boolean vector) {
        if (level != 1 || elements.stream().noneMatch(Quoter::isSplice)) {
            final var lowered = new ArrayList<Expression>();
            for (final var element : elements) {
                lowered.add(quasiquote(element, level));
            }
            return vector ? array(lowered) : list(lowered);
        }

        // Runs of ordinary elements become lists, splices become collections, and the stream concatenates them.
        final var segments = new ArrayList<Expression>();
        var run = new ArrayList<Expression>();
        for (final var element : elements) {
            final var quoting = Quoting.of(element);
            if (quoting != null && quoting.kind() == QuoteKind.UNQUOTE_SPLICE) {
                if (!run.isEmpty()) {
                    segments.add(list(run));
                    run = new ArrayList<>();
                }
                final var spliced = lowerer.lowerExpression(quoting.inner());
                segments.add(new CastExpr(JavaSyntax.type("java.util.Collection<?>"), JavaSyntax.operand(spliced)));
            } else {
                run.add(quasiquote(element, level));
            }
        }
        if (!run.isEmpty()) {
            segments.add(list(run));
        }
        final var stream = JavaSyntax.staticCall("java.util.stream.Stream.of", segments);
        final var collectionStream = new MethodReferenceExpr(
            new TypeExpr(JavaSyntax.type("java.util.Collection")), new NodeList<>(), "stream");
        final var flattened = new MethodCallExpr(stream, "flatMap", new NodeList<>(collectionStream));
        return new MethodCallExpr(flattened, vector ? "toArray" : "toList");
    }

    private List<Expression> quoteAll(final List<Sexp> elements) {
        final var result = new ArrayList<Expression>(elements.size());
        for (final var element : elements) {
            result.add(quote(element));
        }
        return result;
    }

    private static Expression atom(final Sexp.Atom atom) {
        if (atom instanceof Sexp.Integer integer) {
            return Literals.integer(integer);
        } else if (atom instanceof Sexp.Float floating) {
            return Literals.floating(floating);
        } else if (atom instanceof Sexp.String string) {
            return Literals.string(string);
        } else if (atom instanceof Sexp.Symbol symbol) {
            final var constant = Literals.constant(symbol);
            return (constant != null) ? constant : Literals.string(symbol.text());
        } else {
            throw new UnreachableCodeReachedError("Unknown atom type " + atom.getClass().getName());
        }
    }

    private static Expression quotingList(final QuoteKind kind, final Expression inner) {
        return list(List.of(Literals.string(kind.symbolName()), inner));
    }

    private static Expression list(final List<Expression> elements) {
        if (elements.isEmpty()) {
            return JavaSyntax.staticCall("java.util.List.of", List.of());
        }
        if (elements.size() == 1 && mayBeArrayOrNull(elements.get(0))) {
            // A lone Object[] or null argument would be taken as the varargs array itself.
            final var element = new CastExpr(JavaSyntax.type("Object"), JavaSyntax.operand(elements.get(0)));
            return JavaSyntax.staticCall("java.util.Arrays.asList", List.of(element));
        }
        return JavaSyntax.staticCall("java.util.Arrays.asList", elements);
    }

    private static boolean mayBeArrayOrNull(final Expression expression) {
        return !(expression instanceof LiteralExpr) || expression instanceof NullLiteralExpr;
    }

    static Expression array(final List<Expression> elements) {
        return new ArrayCreationExpr(
            JavaSyntax.type("Object"),
            new NodeList<>(new ArrayCreationLevel()),
            new ArrayInitializerExpr(new NodeList<>(elements)));
    }

    private static boolean isSplice(final Sexp sexp) {
        final var quoting = Quoting.of(sexp);
        return quoting != null && quoting.kind() == QuoteKind.UNQUOTE_SPLICE;
    }

    private final Lowerer lowerer;

    /**
     * A quoting form in either syntax: the prefix {@code 'x} or the longhand {@code (quote x)}.
     */
    private record Quoting(QuoteKind kind, Sexp inner) {
        static @Nullable Quoting of(final Sexp sexp) {
            if (sexp instanceof Sexp.Quoted quoted) {
                return new Quoting(quoted.kind(), quoted.inner());
            }
            if (sexp instanceof Sexp.List list && list.elements().size() == 2) {
                final var head = Sexps.headSymbol(list);
                final var kind = (head == null) ? null : QuoteKind.bySymbolName(head.text());
                if (kind != null) {
                    return new Quoting(kind, list.elements().get(1));
                }
            }
            return null;
        }
    }
}
