// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.List;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VarType;

/**
 * Small builders for the Java constructs lowering rules share.
 * <p>
 * JavaParser's printer emits the tree as is and never inserts parentheses, so rules that nest expressions go through
 * {@link #operand(Expression)}.
 */
final class JavaSyntax {
    private JavaSyntax() {
    }

    /**
     * Wraps the expression in parentheses unless it binds tighter than any operator.
     */
    static Expression operand(final Expression expression) {
        if (expression.isLiteralExpr()
            || expression.isNameExpr()
            || expression.isFieldAccessExpr()
            || expression.isMethodCallExpr()
            || expression.isObjectCreationExpr()
            || expression.isArrayCreationExpr()
            || expression.isEnclosedExpr()) {
            return expression;
        }
        return new EnclosedExpr(expression);
    }

    /**
     * Coerces the expression to a boolean condition, with a cast unless it's evidently boolean already.
     */
    static Expression condition(final Expression expression) {
        if (isBoolean(expression)) {
            return expression;
        }
        return new CastExpr(type("Boolean"), operand(expression));
    }

    static boolean isBoolean(final Expression expression) {
        if (expression instanceof BooleanLiteralExpr) {
            return true;
        } else if (expression instanceof UnaryExpr unary) {
            return unary.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT;
        } else if (expression instanceof BinaryExpr binary) {
            return switch (binary.getOperator()) {
                case AND, OR, LESS, GREATER, LESS_EQUALS, GREATER_EQUALS, EQUALS, NOT_EQUALS -> true;
                default -> false;
            };
        } else if (expression instanceof EnclosedExpr enclosed) {
            return isBoolean(enclosed.getInner());
        } else if (expression instanceof MethodCallExpr call) {
            return call.getNameAsString().equals("equals") && call.getScope().map(OBJECTS::equals).orElse(false);
        } else {
            return false;
        }
    }

    /**
     * Makes a statement out of an expression.
     * <p>
     * Java only allows some expressions as statements; the value of any other kind is bound to a fresh local.
     */
    static Statement statement(final Lowerer lowerer, final Expression expression) {
        if (expression.isMethodCallExpr() || expression.isAssignExpr() || expression.isObjectCreationExpr()) {
            return new ExpressionStmt(expression);
        }
        return new ExpressionStmt(local(lowerer.freshName("ignored"), expression));
    }

    /**
     * Declares a local variable with an inferred type, falling back to {@code Object} for {@code null}, which
     * {@code var} can't infer from.
     */
    static VariableDeclarationExpr local(final String name, final Expression initializer) {
        final Type localType = initializer.isNullLiteralExpr() ? type("Object") : new VarType();
        return new VariableDeclarationExpr(new VariableDeclarator(localType, name, initializer));
    }

    /**
     * Builds {@code ((java.util.function.Supplier<Object>) () -> { body }).get()}, the expression form of a block.
     */
    static Expression invokeBlock(final BlockStmt body) {
        final var lambda = new LambdaExpr(new NodeList<>(), body, true);
        final var supplier = new CastExpr(type("java.util.function.Supplier<Object>"), lambda);
        return new MethodCallExpr(new EnclosedExpr(supplier), "get");
    }

    /**
     * Builds a call of a static method given by its fully qualified name, such as {@code java.util.Objects.equals}.
     */
    static MethodCallExpr staticCall(final String qualifiedMethod, final List<Expression> arguments) {
        final var lastDot = qualifiedMethod.lastIndexOf('.');
        final var owner = List.of(qualifiedMethod.substring(0, lastDot).split("\\."));
        final var scope = Identifiers.reference(owner);
        return new MethodCallExpr(scope, qualifiedMethod.substring(lastDot + 1), new NodeList<>(arguments));
    }

    static ClassOrInterfaceType type(final String source) {
        return StaticJavaParser.parseClassOrInterfaceType(source);
    }

    private static final Expression OBJECTS = Identifiers.reference(List.of("java", "util", "Objects"));
}
