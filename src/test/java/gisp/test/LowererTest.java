// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.test;

import gisp.diagnostic.Diagnostic;
import gisp.diagnostic.Stage;
import gisp.lowering.LoweredForm;
import gisp.lowering.LoweredUnit;
import gisp.lowering.Lowerer;
import gisp.transpiler.Result;
import gisp.transpiler.Transpiler;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class LowererTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "42|42L",
        "007|7L",
        "9223372036854775807|9223372036854775807L",
        "1.5|1.5",
        "2.|2.0",
        "\"plain\"|\"plain\"",
        "\"a\\\"b\\n\"|\"a\\\"b\\n\"",
        "\"\\q\"|\"q\"",
        "true|true",
        "false|false",
        "nil|(Object) null",
    })
    void atoms(final String source, final String expected) {
        assertThat(expression(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "foo|foo",
        "foo-bar-baz|fooBarBaz",
        "foo-Bar|foo_MINUS_Bar",
        "a-1|a_MINUS_1",
        "-x|_MINUS_x",
        "empty?|empty_QMARK_",
        "*out*|_STAR_out_STAR_",
        "class|class_",
        "System.out|System.out",
        "a.b-c.d|a.bC.d",
    })
    void symbols(final String source, final String expected) {
        assertThat(expression(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "(+ 1 2 3)|1L + 2L + 3L",
        "(* (+ 1 2) 3)|(1L + 2L) * 3L",
        "(- 1 (- 2 3))|1L - (2L - 3L)",
        "(- x)|-x",
        "(/ 1 2 3)|1L / 2L / 3L",
        "(mod 7 2)|7L % 2L",
        "(< a b)|a < b",
        "(>= a 1.5)|a >= 1.5",
        "(= a 1)|java.util.Objects.equals(a, 1L)",
        "(not= a 1)|!java.util.Objects.equals(a, 1L)",
        "(and (< a b) c)|(a < b) && ((Boolean) c)",
        "(or a false)|~((Boolean) a) || false~",
        "(not x)|!((Boolean) x)",
        "(str \"n=\" n)|\"\" + \"n=\" + n",
        "(str)|\"\"",
    })
    void operators(final String source, final String expected) {
        assertThat(expression(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "(if (< a b) a b)|(a < b) ? a : b",
        "(if x 1)|((Boolean) x) ? 1L : null",
        "(do)|(Object) null",
        "(do 5)|5L",
        "(set! counter 5)|counter = 5L",
        "(foo-bar 1 \"x\")|fooBar(1L, \"x\")",
        "(System.out.println \"hi\")|System.out.println(\"hi\")",
        "(.toUpperCase s)|s.toUpperCase()",
        "(.append (StringBuilder.) \"x\")|new StringBuilder().append(\"x\")",
        "(StringBuilder. \"x\")|new StringBuilder(\"x\")",
        "(new java.util.ArrayList 10)|new java.util.ArrayList(10L)",
        "(. s length)|s.length()",
        "(. (f) length)|f().length()",
        "((fn [x] x) 1)|((java.util.function.Function<Object, Object>) (x) -> x).apply(1L)",
        "((fn [] 1))|((java.util.function.Supplier<Object>) () -> 1L).get()",
        "(fn [a b] (+ a b))|(java.util.function.BiFunction<Object, Object, Object>) (a, b) -> a + b",
        "[1 \"a\" [x]]|new Object[] { 1L, \"a\", new Object[] { x } }",
        "()|java.util.List.of()",
    })
    void expressionForms(final String source, final String expected) {
        assertThat(expression(source)).isEqualTo(expected);
    }

    @Test
    void blocksBecomeImmediatelyInvokedSuppliers() {
        final var block = expression("(do (f) 1 2)");
        assertThat(block)
            .startsWith("((java.util.function.Supplier<Object>) () -> {")
            .contains("f();", "var ignored$1 = 1L;", "return 2L;")
            .endsWith("}).get()");

        final var let = expression("(let [x 1 y nil] (g x y) y)");
        assertThat(let)
            .startsWith("((java.util.function.Supplier<Object>) () -> {")
            .contains("var x = 1L;", "Object y = null;", "g(x, y);", "return y;");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "'x|\"x\"",
        "'nil|(Object) null",
        "'42|42L",
        "'(1 \"a\" b)|java.util.Arrays.asList(1L, \"a\", \"b\")",
        "'()|java.util.List.of()",
        "'[a (b)]|new Object[] { \"a\", java.util.Arrays.asList(\"b\") }",
        "''x|java.util.Arrays.asList(\"quote\", \"x\")",
        "'(f ,x)|java.util.Arrays.asList(\"f\", java.util.Arrays.asList(\"unquote\", \"x\"))",
        "`x|\"x\"",
        "`(1 ,x)|java.util.Arrays.asList(1L, x)",
        "`(1 ,(+ x 1))|java.util.Arrays.asList(1L, x + 1L)",
        "`[a ,b]|new Object[] { \"a\", b }",
        "'([1 2])|java.util.Arrays.asList((Object) new Object[] { 1L, 2L })",
        "'(nil)|java.util.Arrays.asList((Object) null)",
        "`(,x)|java.util.Arrays.asList((Object) x)",
    })
    void quotedData(final String source, final String expected) {
        assertThat(expression(source)).isEqualTo(expected);
    }

    @Test
    void splicing() {
        assertThat(expression("`(1 ,@xs 2)")).isEqualTo(
            "java.util.stream.Stream.of(java.util.Arrays.asList(1L), (java.util.Collection<?>) xs, "
                + "java.util.Arrays.asList(2L)).flatMap(java.util.Collection::stream).toList()");
        assertThat(expression("`[,@(f)]")).isEqualTo(
            "java.util.stream.Stream.of((java.util.Collection<?>) f()).flatMap(java.util.Collection::stream)"
                + ".toArray()");
    }

    @Test
    void nestedQuasiquotesOnlyEvaluateOutermostUnquotes() {
        assertThat(expression("`(a `(b ,x))")).isEqualTo(
            "java.util.Arrays.asList(\"a\", java.util.Arrays.asList(\"quasiquote\", "
                + "java.util.Arrays.asList(\"b\", java.util.Arrays.asList(\"unquote\", \"x\"))))");
        assertThat(expression("`(a `(b ,,x))")).isEqualTo(
            "java.util.Arrays.asList(\"a\", java.util.Arrays.asList(\"quasiquote\", "
                + "java.util.Arrays.asList(\"b\", java.util.Arrays.asList(\"unquote\", x))))");
    }

    @Test
    void longhandQuotingMatchesPrefixes() {
        assertThat(transpile("'(1 2)")).isEqualTo(transpile("(quote (1 2))"));
        assertThat(transpile("`(1 ,x ,@y)")).isEqualTo(transpile("(quasiquote (1 (unquote x) (unquote-splice y)))"));
        assertThat(transpile("''x")).isEqualTo(transpile("'(quote x)"));
        assertThat(transpile("'(1 2)")).isNotEqualTo(transpile("'(1 3)"));
    }

    @Test
    void loweringIsDeterministic() {
        final var source = "(ns demo) (defn f [x & more] (do (g x) more)) (f 1 `(a ,@b)) (let [y 2] y)";
        final var forms = new Transpiler().read(source).value();
        final LoweredUnit first = new Lowerer().lower(forms);
        final LoweredUnit second = new Lowerer().lower(new Transpiler().read(source).value());
        assertThat(first).isEqualTo(second);
        assertThat(first.forms()).hasSize(4);

        final var lowerer = new Lowerer();
        assertThat(lowerer.lower(forms)).isEqualTo(lowerer.lower(forms));
    }

    @Test
    void declarations() {
        final var unit = transpile("(ns demo.app) (import java.util.*) (def answer 42) (def greeting \"hi\") "
            + "(def anything (f)) (defn add [a b] (+ a b)) (defn log [fmt & args] (g fmt args)) (defn nothing [])");
        assertThat(unit.forms()).extracting(form -> form.getClass().getSimpleName()).containsExactly(
            "Package", "Import", "Member", "Member", "Member", "Member", "Member", "Member");
        assertThat(unit.forms().get(0).node().toString().strip()).isEqualTo("package demo.app;");
        assertThat(unit.forms().get(1).node().toString().strip()).isEqualTo("import java.util.*;");
        assertThat(member(unit, 2, FieldDeclaration.class).toString()).isEqualTo("static long answer = 42L;");
        assertThat(member(unit, 3, FieldDeclaration.class).toString()).isEqualTo("static String greeting = \"hi\";");
        assertThat(member(unit, 4, FieldDeclaration.class).toString()).isEqualTo("static Object anything = f();");

        final var add = member(unit, 5, MethodDeclaration.class);
        assertThat(add.getDeclarationAsString().strip()).isEqualTo("static Object add(Object a, Object b)");
        assertThat(add.getBody().orElseThrow().getStatements()).extracting(Object::toString)
            .containsExactly("return a + b;");

        final var log = member(unit, 6, MethodDeclaration.class);
        assertThat(log.getDeclarationAsString().strip()).isEqualTo("static Object log(Object fmt, Object... args)");

        final var nothing = member(unit, 7, MethodDeclaration.class);
        assertThat(nothing.getBody().orElseThrow().getStatements()).extracting(Object::toString)
            .containsExactly("return null;");
    }

    @Test
    void topLevelExpressionsPrintTheirValue() {
        final var unit = transpile("(f 1)");
        final var initializer = member(unit, 0, InitializerDeclaration.class);
        assertThat(initializer.isStatic()).isTrue();
        assertThat(initializer.getBody().getStatements()).extracting(Object::toString)
            .containsExactly("System.out.println(f(1L));");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "(if 1)|0|(if 1)|if expects 2 to 3 arguments but got 1",
        "(not= 1)|0|(not= 1)|not= expects exactly 2 arguments but got 1",
        "(+)|0|(+)|+ expects at least 1 arguments but got 0",
        "(defn f)|0|(defn f)|defn expects at least 2 arguments but got 1",
        "(f (def x 1))|3|(def x 1)|def is only allowed at top level",
        "(g (ns a))|3|(ns a)|ns is only allowed at top level",
        ",x|0|,x|unquote outside of a quasiquote",
        "(f (unquote x))|3|(unquote x)|unquote outside of a quasiquote",
        "(f ,@x)|3|,@x|unquote-splice outside of a quasiquote",
        "`,@x|1|,@x|unquote-splice must appear inside a list or vector",
        "9223372036854775808|0|9223372036854775808|integer literal out of range: 9223372036854775808",
        "(fn [a b c] 1)|4|[a b c]|fn supports at most 2 parameters",
        "(fn x 1)|4|x|fn expects a parameter vector",
        "(let [x] x)|5|[x]|let bindings must come in name and value pairs",
        "(let [1 2] 3)|6|1|binding name must be a plain symbol",
        "(defn f x)|8|x|defn expects a parameter vector",
        "(defn f [& a b])|8|[& a b]|& must be followed by exactly one parameter",
        "(def 1 2)|5|1|def name must be a plain symbol",
        "(set! nil 1)|6|nil|set! target must be a symbol",
        "(. x 1)|5|1|. expects a method name",
        "(.foo)|0|(.foo)|method call .foo needs a target",
        "(import java..util)|8|java..util|malformed import name",
    })
    void loweringErrors(final String source, final int offset, final String form, final String message) {
        final var diagnostic = failure(source);
        assertThat(diagnostic.stage()).isEqualTo(Stage.LOWER);
        assertThat(diagnostic.offset()).isEqualTo(offset);
        assertThat(diagnostic.form()).isEqualTo(form);
        assertThat(diagnostic.message()).isEqualTo(message);
    }

    @Test
    void nonFiniteFloatIsAnError() {
        final var diagnostic = failure("1" + "0".repeat(400) + ".");
        assertThat(diagnostic.message()).startsWith("float literal out of range: 1000");
    }

    @Test
    void errorAbortsWholeUnit() {
        final var result = new Transpiler().transpile("(def a 1) (f a) (if)");
        assertThat(result).isInstanceOf(Result.Failure.class);
        assertThat(((Result.Failure<?>) result).diagnostic().trace())
            .contains("Lowering top-level form (if)", "Lowering 3 top-level forms");
    }

    @Test
    void errorTraceNamesTheSpecialForm() {
        final var diagnostic = failure("(do (fn [a b c] 1))");
        assertThat(diagnostic.trace()).containsSubsequence(
            "Lowering special form fn",
            "Lowering special form do",
            "Lowering top-level form (do (fn [a b c] 1))");
    }

    private static LoweredUnit transpile(final String source) {
        return new Transpiler().transpile(source).value();
    }

    private static Diagnostic failure(final String source) {
        final var result = new Transpiler().transpile(source);
        assertThat(result).isInstanceOf(Result.Failure.class);
        return ((Result.Failure<?>) result).diagnostic();
    }

    private static <T> T member(final LoweredUnit unit, final int index, final Class<T> type) {
        final var form = unit.forms().get(index);
        assertThat(form).isInstanceOf(LoweredForm.Member.class);
        return type.cast(form.node());
    }

    /**
     * Lowers a single top-level expression and returns the rendering of the printed expression.
     */
    private static String expression(final String source) {
        final var unit = transpile(source);
        assertThat(unit.forms()).hasSize(1);
        final var initializer = member(unit, 0, InitializerDeclaration.class);
        final var print = initializer.getBody().getStatement(0).asExpressionStmt().getExpression().asMethodCallExpr();
        assertThat(print.getNameAsString()).isEqualTo("println");
        return print.getArgument(0).toString();
    }
}
