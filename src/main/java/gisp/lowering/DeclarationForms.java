// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.List;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import gisp.sexp.Sexp;
import gisp.sexp.Sexps;

/**
 * The top-level special forms: {@code ns}, {@code import}, {@code def} and {@code defn}.
 */
final class DeclarationForms {
    private DeclarationForms() {
    }

    static void register(final SpecialForms.Builder builder) {
        builder
            .declaration("ns", Arity.exactly(1), DeclarationForms::namespace)
            .declaration("import", Arity.exactly(1), DeclarationForms::importClass)
            .declaration("def", Arity.exactly(2), DeclarationForms::define)
            .declaration("defn", Arity.atLeast(2), DeclarationForms::defineFunction);
    }

    private static LoweredForm namespace(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var segments = qualifiedName(arguments.get(0), "package");
        return new LoweredForm.Package(new PackageDeclaration(Identifiers.qualifiedName(segments)));
    }

    private static LoweredForm importClass(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var segments = qualifiedName(arguments.get(0), "import");
        final var last = segments.size() - 1;
        // Mangling turned the trailing * of an on-demand import into _STAR_.
        if (segments.get(last).equals("_STAR_")) {
            if (last == 0) {
                throw Lowerer.signalError("malformed import name", arguments.get(0));
            }
            final var name = Identifiers.qualifiedName(segments.subList(0, last));
            return new LoweredForm.Import(new ImportDeclaration(name, false, true));
        }
        return new LoweredForm.Import(new ImportDeclaration(Identifiers.qualifiedName(segments), false, false));
    }

    private static LoweredForm define(final Lowerer lowerer, final Sexp.List form, final List<Sexp> arguments) {
        final var name = name(arguments.get(0), "def");
        final var value = lowerer.lowerExpression(arguments.get(1));
        final var field = new FieldDeclaration(
            Modifier.createModifierList(Modifier.Keyword.STATIC),
            new VariableDeclarator(fieldType(value), name, value));
        return new LoweredForm.Member(field);
    }

    private static LoweredForm defineFunction(
        final Lowerer lowerer,
        final Sexp.List form,
        final List<Sexp> arguments
    ) {
        final var name = name(arguments.get(0), "defn");
        final var method = new MethodDeclaration(
            Modifier.createModifierList(Modifier.Keyword.STATIC),
            JavaSyntax.type("Object"),
            name);
        method.setParameters(parameters(arguments.get(1)));
        method.setBody(lowerer.lowerBody(arguments.subList(2, arguments.size())));
        return new LoweredForm.Member(method);
    }

    /**
     * Lowers a parameter vector. An {@code &} before the last parameter makes it a variadic {@code Object...}.
     */
    private static NodeList<Parameter> parameters(final Sexp vector) {
        if (!(vector instanceof Sexp.Vector parameterVector)) {
            throw Lowerer.signalError("defn expects a parameter vector", vector);
        }
        final var elements = parameterVector.elements();
        final var result = new NodeList<Parameter>();
        for (int i = 0; i < elements.size(); i += 1) {
            final var element = elements.get(i);
            if (element instanceof Sexp.Symbol symbol && symbol.is("&")) {
                if (i + 2 != elements.size()) {
                    throw Lowerer.signalError("& must be followed by exactly one parameter", vector);
                }
                final var rest = new Parameter(JavaSyntax.type("Object"), name(elements.get(i + 1), "parameter"));
                rest.setVarArgs(true);
                result.add(rest);
                break;
            }
            result.add(new Parameter(JavaSyntax.type("Object"), name(element, "parameter")));
        }
        return result;
    }

    private static Type fieldType(final Expression value) {
        if (value.isLongLiteralExpr()) {
            return PrimitiveType.longType();
        } else if (value.isDoubleLiteralExpr()) {
            return PrimitiveType.doubleType();
        } else if (value.isBooleanLiteralExpr()) {
            return PrimitiveType.booleanType();
        } else if (value.isStringLiteralExpr()) {
            return JavaSyntax.type("String");
        } else {
            return JavaSyntax.type("Object");
        }
    }

    static String name(final Sexp sexp, final String what) {
        final var symbol = Sexps.asSymbol(sexp);
        if (symbol == null || Literals.constant(symbol) != null || symbol.text().contains(".")) {
            throw Lowerer.signalError(what + " name must be a plain symbol", sexp);
        }
        return Identifiers.mangle(symbol.text());
    }

    private static List<String> qualifiedName(final Sexp sexp, final String what) {
        final var symbol = Sexps.asSymbol(sexp);
        if (symbol == null) {
            throw Lowerer.signalError(what + " name must be a symbol", sexp);
        }
        final var segments = Identifiers.dottedSegments(symbol.text());
        if (segments != null) {
            return segments;
        }
        if (symbol.text().contains(".")) {
            throw Lowerer.signalError("malformed " + what + " name", sexp);
        }
        return List.of(Identifiers.mangle(symbol.text()));
    }
}
