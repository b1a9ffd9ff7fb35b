// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp;

import java.util.List;
import gisp.util.UnreachableCodeReachedError;
import gisp.util.annotation.Nullable;

/**
 * A utility class containing common operations on S-expressions.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the symbol the given {@code sexp} represents, or {@code null} if it isn't a symbol.
     */
    public static @Nullable Sexp.Symbol asSymbol(final Sexp sexp) {
        return (sexp instanceof Sexp.Symbol symbol) ? symbol : null;
    }

    /**
     * Returns the symbol at the head of the given list, or {@code null} if the list is empty or starts with something
     * other than a symbol.
     */
    public static @Nullable Sexp.Symbol headSymbol(final Sexp.List list) {
        final var elements = list.elements();
        return elements.isEmpty() ? null : asSymbol(elements.get(0));
    }

    /**
     * Returns {@code true} iff both trees have the same shape and the same atom texts, disregarding source positions.
     */
    public static boolean sameShape(final Sexp left, final Sexp right) {
        if (left instanceof Sexp.Atom leftAtom) {
            return left.getClass() == right.getClass() && leftAtom.text().equals(((Sexp.Atom) right).text());
        } else if (left instanceof Sexp.List leftList) {
            return right instanceof Sexp.List rightList && sameShape(leftList.elements(), rightList.elements());
        } else if (left instanceof Sexp.Vector leftVector) {
            return right instanceof Sexp.Vector rightVector && sameShape(leftVector.elements(), rightVector.elements());
        } else if (left instanceof Sexp.Quoted leftQuoted) {
            return right instanceof Sexp.Quoted rightQuoted
                && leftQuoted.kind() == rightQuoted.kind()
                && sameShape(leftQuoted.inner(), rightQuoted.inner());
        } else {
            throw new UnreachableCodeReachedError("Unknown S-expression type " + left.getClass().getName());
        }
    }

    /**
     * Returns {@code true} iff both sequences contain pairwise {@link #sameShape(Sexp, Sexp) same-shaped} trees.
     */
    public static boolean sameShape(final List<Sexp> left, final List<Sexp> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i += 1) {
            if (!sameShape(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Prints the given S-expression on a single line, in the surface syntax it was read from.
     * <p>
     * Comments and the original whitespace are lost; used for diagnostics.
     */
    public static String print(final Sexp sexp) {
        final var builder = new StringBuilder();
        append(builder, sexp);
        return builder.toString();
    }

    private static void append(final StringBuilder builder, final Sexp sexp) {
        if (sexp instanceof Sexp.Atom atom) {
            builder.append(atom.text());
        } else if (sexp instanceof Sexp.List list) {
            appendSequence(builder, '(', list.elements(), ')');
        } else if (sexp instanceof Sexp.Vector vector) {
            appendSequence(builder, '[', vector.elements(), ']');
        } else if (sexp instanceof Sexp.Quoted quoted) {
            builder.append(quoted.kind().prefix());
            append(builder, quoted.inner());
        } else {
            throw new UnreachableCodeReachedError("Unknown S-expression type " + sexp.getClass().getName());
        }
    }

    private static void appendSequence(
        final StringBuilder builder,
        final char open,
        final List<Sexp> elements,
        final char close
    ) {
        builder.append(open);
        var first = true;
        for (final var element : elements) {
            if (!first) {
                builder.append(' ');
            }
            first = false;
            append(builder, element);
        }
        builder.append(close);
    }
}
