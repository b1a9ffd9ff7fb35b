// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import javax.lang.model.SourceVersion;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import gisp.util.annotation.Nullable;

/**
 * Mapping of symbol names onto Java identifiers.
 * <p>
 * A hyphen before a lowercase letter becomes camel case, so {@code foo-bar} names the Java member {@code fooBar}. Any
 * other hyphen, and other punctuation, becomes a named escape such as {@code _MINUS_} or {@code _QMARK_}; this keeps
 * {@code foo-Bar} apart from {@code foo-bar}. Java keywords get a trailing underscore.
 * <p>
 * The camel case rule makes {@code foo-bar} and {@code fooBar} the same identifier. That's intended: either spelling
 * can call a Java method such as {@code toUpperCase}.
 */
final class Identifiers {
    private Identifiers() {
    }

    static String mangle(final String name) {
        final var builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i += 1) {
            final var ch = name.charAt(i);
            if (ch == '-' && i > 0 && i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))) {
                i += 1;
                builder.append(Character.toUpperCase(name.charAt(i)));
            } else if (ch == '_' || (Character.isLetterOrDigit(ch) && Character.isJavaIdentifierPart(ch))) {
                builder.append(ch);
            } else {
                final var escape = ESCAPES.get(ch);
                builder.append(escape != null ? escape : String.format("_U%04X_", (int) ch));
            }
        }
        if (builder.length() == 0 || !Character.isJavaIdentifierStart(builder.charAt(0))) {
            builder.insert(0, '_');
        }
        final var result = builder.toString();
        return (SourceVersion.isKeyword(result) || result.equals("_")) ? result + "_" : result;
    }

    /**
     * Splits a dotted symbol such as {@code System.out.println} into its mangled segments, or returns {@code null} if
     * the name isn't a well-formed dotted name.
     */
    static @Nullable List<String> dottedSegments(final String name) {
        if (name.indexOf('.') < 0) {
            return null;
        }
        final var parts = name.split("\\.", -1);
        for (final var part : parts) {
            if (part.isEmpty()) {
                return null;
            }
        }
        return Arrays.stream(parts).map(Identifiers::mangle).toList();
    }

    /**
     * Returns a reference expression for the given symbol name: a simple name, or a chain of field accesses for a
     * dotted name.
     */
    static Expression reference(final String name) {
        final var segments = dottedSegments(name);
        return (segments == null) ? new NameExpr(mangle(name)) : reference(segments);
    }

    static Expression reference(final List<String> segments) {
        Expression result = new NameExpr(segments.get(0));
        for (final var segment : segments.subList(1, segments.size())) {
            result = new FieldAccessExpr(result, segment);
        }
        return result;
    }

    /**
     * Builds a qualified name, as used by package and import declarations.
     */
    static Name qualifiedName(final List<String> segments) {
        Name result = new Name(segments.get(0));
        for (final var segment : segments.subList(1, segments.size())) {
            result = new Name(result, segment);
        }
        return result;
    }

    private static final Map<Character, String> ESCAPES = Map.ofEntries(
        Map.entry('-', "_MINUS_"),
        Map.entry('?', "_QMARK_"),
        Map.entry('!', "_BANG_"),
        Map.entry('*', "_STAR_"),
        Map.entry('+', "_PLUS_"),
        Map.entry('/', "_SLASH_"),
        Map.entry('<', "_LT_"),
        Map.entry('>', "_GT_"),
        Map.entry('=', "_EQ_"),
        Map.entry('&', "_AMP_"),
        Map.entry('%', "_PERCENT_"),
        Map.entry('\'', "_SQUOTE_"),
        Map.entry(':', "_COLON_"),
        Map.entry('.', "_DOT_"),
        Map.entry('$', "_DOLLAR_"),
        Map.entry('#', "_SHARP_"),
        Map.entry('@', "_AT_"),
        Map.entry('~', "_TILDE_"),
        Map.entry('^', "_CARET_"),
        Map.entry('|', "_BAR_")
    );
}
