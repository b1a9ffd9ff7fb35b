// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.List;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.UnknownType;
import gisp.sexp.QuoteKind;
import gisp.sexp.Sexp;
import gisp.sexp.Sexps;

/**
 * The special forms that produce expressions other than operators: quoting, conditionals, blocks, local bindings,
 * functions, assignment and Java interop.
 */
final class ControlForms {
    private ControlForms() {
    }

    static void register(final SpecialForms.Builder builder) {
        for (final var kind : QuoteKind.values()) {
            builder.expression(kind.symbolName(), Arity.exactly(1),
                (lowerer, form, arguments) -> lowerer.lowerQuoted(kind, arguments.get(0), form));
        }
        builder
            .expression("if", Arity.between(2, 3), ControlForms::conditional)
            .expression("do", Arity.atLeast(0), ControlForms::sequence)
            .expression("let", Arity.atLeast(1), ControlForms::let)
            .expression("fn", Arity.atLeast(1), ControlForms::function)
            .expression("set!", Arity.exactly(2), ControlForms::assign)
            .expression("new", Arity.atLeast(1), ControlForms::instantiate)
            .expression(".", Arity.atLeast(2), ControlForms::invoke);
    }

    private static Expression conditional(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var test = JavaSyntax.condition(lowerer.lowerExpression(arguments.get(0)));
        final var then = lowerer.lowerExpression(arguments.get(1));
        final Expression otherwise = (arguments.size() == 3)
            ? lowerer.lowerExpression(arguments.get(2))
            : new NullLiteralExpr();
        return new ConditionalExpr(JavaSyntax.operand(test), JavaSyntax.operand(then), JavaSyntax.operand(otherwise));
    }

    private static Expression sequence(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        if (arguments.isEmpty()) {
            return new NullLiteralExpr();
        } else if (arguments.size() == 1) {
            return lowerer.lowerExpression(arguments.get(0));
        }
        return JavaSyntax.invokeBlock(lowerer.lowerBody(arguments));
    }

    private static Expression let(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        if (!(arguments.get(0) instanceof Sexp.Vector bindingVector)) {
            throw Lowerer.signalError("let expects a binding vector", arguments.get(0));
        }
        final var bindings = bindingVector.elements();
        if (bindings.size() % 2 != 0) {
            throw Lowerer.signalError("let bindings must come in name and value pairs", bindingVector);
        }
        final var statements = new NodeList<Statement>();
        for (int i = 0; i < bindings.size(); i += 2) {
            final var name = DeclarationForms.name(bindings.get(i), "binding");
            final var value = lowerer.lowerExpression(bindings.get(i + 1));
            statements.add(new ExpressionStmt(JavaSyntax.local(name, value)));
        }
        return JavaSyntax.invokeBlock(lowerer.block(statements, arguments.subList(1, arguments.size())));
    }

    private static Expression function(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        if (!(arguments.get(0) instanceof Sexp.Vector parameterVector)) {
            throw Lowerer.signalError("fn expects a parameter vector", arguments.get(0));
        }
        final var parameters = new NodeList<Parameter>();
        for (final var element : parameterVector.elements()) {
            parameters.add(new Parameter(new UnknownType(), DeclarationForms.name(element, "parameter")));
        }
        final var type = switch (parameters.size()) {
            case 0 -> "java.util.function.Supplier<Object>";
            case 1 -> "java.util.function.Function<Object, Object>";
            case 2 -> "java.util.function.BiFunction<Object, Object, Object>";
            default -> throw Lowerer.signalError("fn supports at most 2 parameters", parameterVector);
        };
        final var body = arguments.subList(1, arguments.size());
        final Statement lambdaBody = (body.size() == 1)
            ? new ExpressionStmt(lowerer.lowerExpression(body.get(0)))
            : lowerer.lowerBody(body);
        final var lambda = new LambdaExpr(parameters, lambdaBody, true);
        return new CastExpr(JavaSyntax.type(type), lambda);
    }

    private static Expression assign(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var target = Sexps.asSymbol(arguments.get(0));
        if (target == null || Literals.constant(target) != null) {
            throw Lowerer.signalError("set! target must be a symbol", arguments.get(0));
        }
        final var value = lowerer.lowerExpression(arguments.get(1));
        return new AssignExpr(Identifiers.reference(target.text()), value, AssignExpr.Operator.ASSIGN);
    }

    private static Expression instantiate(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var className = Sexps.asSymbol(arguments.get(0));
        if (className == null) {
            throw Lowerer.signalError("new expects a class name", arguments.get(0));
        }
        final var type = JavaSyntax.type(Lowerer.typeName(className.text(), className));
        return new ObjectCreationExpr(null, type, lowerer.lowerExpressions(arguments.subList(1, arguments.size())));
    }

    private static Expression invoke(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var method = Sexps.asSymbol(arguments.get(1));
        if (method == null || method.text().contains(".")) {
            throw Lowerer.signalError(". expects a method name", arguments.get(1));
        }
        final var target = JavaSyntax.operand(lowerer.lowerExpression(arguments.get(0)));
        return new MethodCallExpr(target, Identifiers.mangle(method.text()),
            lowerer.lowerExpressions(arguments.subList(2, arguments.size())));
    }
}
