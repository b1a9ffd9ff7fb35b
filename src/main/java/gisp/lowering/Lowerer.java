// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.ArrayList;
import java.util.List;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import gisp.sexp.QuoteKind;
import gisp.sexp.Sexp;
import gisp.sexp.Sexps;
import gisp.util.Trace;
import gisp.util.UnreachableCodeReachedError;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.UnhandledErrorError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The lowering engine: translates S-expression trees into JavaParser nodes.
 * <p>
 * Translation is depth-first. A list whose head symbol names a registered {@link SpecialForm} is handed to that
 * form's rule after its arity is checked; any other list is a call. Errors are signaled as fatal
 * {@link LoweringErrorCondition}s, so a failure anywhere abandons the whole unit.
 * <p>
 * A lowerer holds the state of one {@link #lower(List)} call only, namely the counter for generated local names, so
 * its output is a function of its input alone. Instances are not thread-safe.
 */
public final class Lowerer {
    public Lowerer() {
        this(SpecialForms.standard());
    }

    public Lowerer(final SpecialForms specialForms) {
        this.specialForms = specialForms;
        quoter = new Quoter(this);
    }

    /**
     * Lowers a sequence of top-level forms into a unit with one lowered form per input form, in the same order.
     */
    public LoweredUnit lower(final List<Sexp> forms) {
        generatedNames = 0;
        final var lowered = new ArrayList<LoweredForm>(forms.size());
        for (final var form : forms) {
            lowered.add(lowerTopLevel(form));
        }
        logger.debug("Lowered {} top-level forms", lowered.size());
        return new LoweredUnit(lowered);
    }

    private LoweredForm lowerTopLevel(final Sexp form) {
        try (final var trace = new Trace(() -> "Lowering top-level form " + Sexps.print(form))) {
            trace.use();
            if (form instanceof Sexp.List list) {
                final var head = Sexps.headSymbol(list);
                final var specialForm = (head == null) ? null : specialForms.lookup(head.text());
                if (specialForm instanceof SpecialForm.DeclarationForm declaration) {
                    final var arguments = arguments(list, declaration);
                    return declaration.rule().lower(this, list, arguments);
                }
            }
            var value = lowerExpression(form);
            if (value instanceof NullLiteralExpr) {
                // println(null) is ambiguous between the String and char[] overloads.
                value = new CastExpr(JavaSyntax.type("Object"), value);
            }
            final var print = JavaSyntax.staticCall("System.out.println", List.of(value));
            return new LoweredForm.Member(new InitializerDeclaration(true, new BlockStmt(new NodeList<>(
                new ExpressionStmt(print)))));
        }
    }

    /**
     * Lowers a form in expression position.
     */
    public Expression lowerExpression(final Sexp form) {
        if (form instanceof Sexp.Symbol symbol) {
            final var constant = Literals.constant(symbol);
            return (constant != null) ? constant : Identifiers.reference(symbol.text());
        } else if (form instanceof Sexp.Integer integer) {
            return Literals.integer(integer);
        } else if (form instanceof Sexp.Float floating) {
            return Literals.floating(floating);
        } else if (form instanceof Sexp.String string) {
            return Literals.string(string);
        } else if (form instanceof Sexp.Vector vector) {
            return Quoter.array(lowerExpressions(vector.elements()));
        } else if (form instanceof Sexp.Quoted quoted) {
            return lowerQuoted(quoted.kind(), quoted.inner(), quoted);
        } else if (form instanceof Sexp.List list) {
            return lowerList(list);
        } else {
            throw new UnreachableCodeReachedError("Unknown S-expression type " + form.getClass().getName());
        }
    }

    /**
     * Lowers every form in expression position, preserving order.
     */
    public NodeList<Expression> lowerExpressions(final List<Sexp> forms) {
        final var result = new NodeList<Expression>();
        for (final var form : forms) {
            result.add(lowerExpression(form));
        }
        return result;
    }

    /**
     * Lowers a body: every form but the last is evaluated for effect, and the value of the last one is returned.
     * An empty body returns {@code null}.
     */
    public BlockStmt lowerBody(final List<Sexp> forms) {
        return block(new NodeList<>(), forms);
    }

    /**
     * Appends a lowered body to the given statements, as in {@link #lowerBody(List)}.
     */
    BlockStmt block(final NodeList<Statement> statements, final List<Sexp> forms) {
        for (int i = 0; i < forms.size(); i += 1) {
            final var value = lowerExpression(forms.get(i));
            if (i + 1 < forms.size()) {
                statements.add(JavaSyntax.statement(this, value));
            } else {
                statements.add(new ReturnStmt(value));
            }
        }
        if (forms.isEmpty()) {
            statements.add(new ReturnStmt(new NullLiteralExpr()));
        }
        return new BlockStmt(statements);
    }

    /**
     * Returns a new local variable name that can't clash with any mangled symbol, because mangling escapes
     * {@code $}.
     */
    String freshName(final String prefix) {
        generatedNames += 1;
        return prefix + "$" + generatedNames;
    }

    /**
     * Signals a fatal {@link LoweringErrorCondition} about the given form.
     */
    static UnhandledErrorError signalError(final String message, final Sexp form) {
        throw ConditionContext.error(new LoweringErrorCondition(message, form));
    }

    Expression lowerQuoted(final QuoteKind kind, final Sexp inner, final Sexp form) {
        return switch (kind) {
            case QUOTE -> quoter.quote(inner);
            case QUASIQUOTE -> quoter.quasiquote(inner);
            case UNQUOTE, UNQUOTE_SPLICE -> throw signalError(kind.symbolName() + " outside of a quasiquote", form);
        };
    }

    private Expression lowerList(final Sexp.List list) {
        final var elements = list.elements();
        if (elements.isEmpty()) {
            return JavaSyntax.staticCall("java.util.List.of", List.of());
        }
        final var head = Sexps.headSymbol(list);
        if (head == null) {
            return apply(lowerExpression(elements.get(0)), lowerExpressions(elements.subList(1, elements.size())));
        }
        final var specialForm = specialForms.lookup(head.text());
        if (specialForm instanceof SpecialForm.DeclarationForm) {
            throw signalError(head.text() + " is only allowed at top level", list);
        } else if (specialForm instanceof SpecialForm.ExpressionForm expressionForm) {
            final var arguments = arguments(list, expressionForm);
            try (final var trace = new Trace(() -> "Lowering special form " + head.text())) {
                trace.use();
                return expressionForm.rule().lower(this, list, arguments);
            }
        }
        return call(head, list);
    }

    private Expression call(final Sexp.Symbol head, final Sexp.List list) {
        final var name = head.text();
        final var elements = list.elements();
        final var rest = elements.subList(1, elements.size());
        if (name.length() > 1 && name.startsWith(".")) {
            // (.method target args...)
            if (rest.isEmpty()) {
                throw signalError("method call " + name + " needs a target", list);
            }
            final var target = JavaSyntax.operand(lowerExpression(rest.get(0)));
            return new MethodCallExpr(target, Identifiers.mangle(name.substring(1)),
                lowerExpressions(rest.subList(1, rest.size())));
        }
        if (name.length() > 1 && name.endsWith(".")) {
            // (ClassName. args...)
            final var type = JavaSyntax.type(typeName(name.substring(0, name.length() - 1), head));
            return new ObjectCreationExpr(null, type, lowerExpressions(rest));
        }
        final var segments = Identifiers.dottedSegments(name);
        if (segments != null) {
            final var scope = Identifiers.reference(segments.subList(0, segments.size() - 1));
            return new MethodCallExpr(scope, segments.get(segments.size() - 1), lowerExpressions(rest));
        }
        return new MethodCallExpr(null, Identifiers.mangle(name), lowerExpressions(rest));
    }

    /**
     * Applies a function value: {@code Supplier}s are invoked with {@code get()}, anything else with
     * {@code apply(...)}.
     */
    static Expression apply(final Expression function, final NodeList<Expression> arguments) {
        final var name = arguments.isEmpty() ? "get" : "apply";
        return new MethodCallExpr(JavaSyntax.operand(function), name, arguments);
    }

    /**
     * Validates a symbol used as a class name and returns its mangled, possibly qualified form.
     */
    static String typeName(final String name, final Sexp form) {
        final var segments = Identifiers.dottedSegments(name);
        if (segments != null) {
            return String.join(".", segments);
        }
        if (name.contains(".")) {
            throw signalError("malformed class name " + name, form);
        }
        return Identifiers.mangle(name);
    }

    private List<Sexp> arguments(final Sexp.List list, final SpecialForm form) {
        final var elements = list.elements();
        final var arguments = elements.subList(1, elements.size());
        if (!form.arity().accepts(arguments.size())) {
            throw signalError(
                form.name() + " expects " + form.arity() + " arguments but got " + arguments.size(), list);
        }
        return arguments;
    }

    private final SpecialForms specialForms;
    private final Quoter quoter;
    private int generatedNames = 0;

    private static final Logger logger = LoggerFactory.getLogger(Lowerer.class);
}
