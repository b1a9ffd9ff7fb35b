// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.List;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import gisp.sexp.Sexp;

/**
 * The operator special forms. Variadic operators fold to the left, so {@code (- a b c)} is {@code (a - b) - c}.
 */
final class OperatorForms {
    private OperatorForms() {
    }

    static void register(final SpecialForms.Builder builder) {
        builder
            .expression("+", Arity.atLeast(1), fold(BinaryExpr.Operator.PLUS))
            .expression("*", Arity.atLeast(1), fold(BinaryExpr.Operator.MULTIPLY))
            .expression("-", Arity.atLeast(1), OperatorForms::subtract)
            .expression("/", Arity.atLeast(2), fold(BinaryExpr.Operator.DIVIDE))
            .expression("mod", Arity.exactly(2), fold(BinaryExpr.Operator.REMAINDER))
            .expression("<", Arity.exactly(2), fold(BinaryExpr.Operator.LESS))
            .expression(">", Arity.exactly(2), fold(BinaryExpr.Operator.GREATER))
            .expression("<=", Arity.exactly(2), fold(BinaryExpr.Operator.LESS_EQUALS))
            .expression(">=", Arity.exactly(2), fold(BinaryExpr.Operator.GREATER_EQUALS))
            .expression("=", Arity.exactly(2), OperatorForms::equal)
            .expression("not=", Arity.exactly(2), OperatorForms::notEqual)
            .expression("and", Arity.atLeast(1), logical(BinaryExpr.Operator.AND))
            .expression("or", Arity.atLeast(1), logical(BinaryExpr.Operator.OR))
            .expression("not", Arity.exactly(1), OperatorForms::not)
            .expression("str", Arity.atLeast(0), OperatorForms::concatenate);
    }

    private static SpecialForm.ExpressionRule fold(final BinaryExpr.Operator operator) {
        return (lowerer, form, arguments) -> fold(operator, lowerer.lowerExpressions(arguments));
    }

    private static SpecialForm.ExpressionRule logical(final BinaryExpr.Operator operator) {
        return (lowerer, form, arguments) -> {
            final var operands = lowerer.lowerExpressions(arguments).stream().map(JavaSyntax::condition).toList();
            return fold(operator, operands);
        };
    }

    private static Expression fold(final BinaryExpr.Operator operator, final List<Expression> operands) {
        var result = JavaSyntax.operand(operands.get(0));
        for (final var operand : operands.subList(1, operands.size())) {
            // Java's binary operators associate to the left, so the fold so far needs no parentheses.
            result = new BinaryExpr(result, JavaSyntax.operand(operand), operator);
        }
        return result;
    }

    private static Expression subtract(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var operands = lowerer.lowerExpressions(arguments);
        if (operands.size() == 1) {
            return new UnaryExpr(JavaSyntax.operand(operands.get(0)), UnaryExpr.Operator.MINUS);
        }
        return fold(BinaryExpr.Operator.MINUS, operands);
    }

    private static Expression equal(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        return JavaSyntax.staticCall("java.util.Objects.equals", lowerer.lowerExpressions(arguments));
    }

    private static Expression notEqual(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        return new UnaryExpr(equal(lowerer, form, arguments), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
    }

    private static Expression not(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var operand = JavaSyntax.condition(lowerer.lowerExpression(arguments.get(0)));
        return new UnaryExpr(JavaSyntax.operand(operand), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
    }

    private static Expression concatenate(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        Expression result = new StringLiteralExpr("");
        for (final var operand : lowerer.lowerExpressions(arguments)) {
            result = new BinaryExpr(result, JavaSyntax.operand(operand), BinaryExpr.Operator.PLUS);
        }
        return result;
    }
}
