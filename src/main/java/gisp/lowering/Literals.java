// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.utils.StringEscapeUtils;
import gisp.sexp.Sexp;
import gisp.util.annotation.Nullable;

/**
 * Conversion of atom text into Java literal nodes.
 * <p>
 * Atoms keep their source text until this point; this is where numerals are parsed and validated.
 */
final class Literals {
    private Literals() {
    }

    static Expression integer(final Sexp.Integer atom) {
        final long value;
        try {
            value = Long.parseLong(atom.text());
        } catch (final NumberFormatException e) {
            throw Lowerer.signalError("integer literal out of range: " + atom.text(), atom);
        }
        // Re-printed from the value, because a leading zero would make Java read the literal as octal.
        return new LongLiteralExpr(value + "L");
    }

    static Expression floating(final Sexp.Float atom) {
        final double value;
        try {
            value = Double.parseDouble(atom.text());
        } catch (final NumberFormatException e) {
            throw Lowerer.signalError("malformed float literal: " + atom.text(), atom);
        }
        if (!Double.isFinite(value)) {
            throw Lowerer.signalError("float literal out of range: " + atom.text(), atom);
        }
        return new DoubleLiteralExpr(Double.toString(value));
    }

    static StringLiteralExpr string(final Sexp.String atom) {
        final var text = atom.text();
        return string(unescape(text.substring(1, text.length() - 1)));
    }

    static StringLiteralExpr string(final String value) {
        return new StringLiteralExpr(StringEscapeUtils.escapeJava(value));
    }

    /**
     * Returns the literal named by one of the constant symbols {@code nil}, {@code true} and {@code false}, or
     * {@code null} if the symbol is something else.
     */
    static @Nullable Expression constant(final Sexp.Symbol symbol) {
        return switch (symbol.text()) {
            case "nil" -> new NullLiteralExpr();
            case "true" -> new BooleanLiteralExpr(true);
            case "false" -> new BooleanLiteralExpr(false);
            default -> null;
        };
    }

    static String unescape(final String text) {
        final var builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i += 1) {
            final var ch = text.charAt(i);
            if (ch != '\\' || i + 1 == text.length()) {
                builder.append(ch);
                continue;
            }
            i += 1;
            final var escaped = text.charAt(i);
            switch (escaped) {
                case 'n' -> builder.append('\n');
                case 't' -> builder.append('\t');
                case 'r' -> builder.append('\r');
                default -> builder.append(escaped);
            }
        }
        return builder.toString();
    }
}
