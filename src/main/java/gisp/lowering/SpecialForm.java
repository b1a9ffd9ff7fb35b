// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.List;
import com.github.javaparser.ast.expr.Expression;
import gisp.sexp.Sexp;

/**
 * A lowering rule for lists whose head is a particular symbol.
 * <p>
 * The arity is checked by the {@link Lowerer} before the rule runs, so rules can index their arguments freely.
 */
public sealed interface SpecialForm {
    /**
     * Retrieves the head symbol name that triggers this form.
     */
    String name();

    /**
     * Retrieves the accepted number of arguments.
     */
    Arity arity();

    /**
     * A form that produces a top-level declaration and is rejected anywhere else.
     */
    record DeclarationForm(String name, Arity arity, DeclarationRule rule) implements SpecialForm {
    }

    /**
     * A form that produces an expression.
     */
    record ExpressionForm(String name, Arity arity, ExpressionRule rule) implements SpecialForm {
    }

    @FunctionalInterface
    interface DeclarationRule {
        LoweredForm lower(Lowerer lowerer, Sexp.List form, List<Sexp> arguments);
    }

    @FunctionalInterface
    interface ExpressionRule {
        Expression lower(Lowerer lowerer, Sexp.List form, List<Sexp> arguments);
    }
}
