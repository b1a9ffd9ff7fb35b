// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.test;

import gisp.lowering.LoweredUnit;
import gisp.render.Renderer;
import gisp.transpiler.Transpiler;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class RendererTest {
    @Test
    void wholeUnit() {
        final var source = new Renderer().render(
            transpile("(def answer 42) (ns demo.app) (import java.util.List) (defn f [] answer) (f)"), "Main");
        assertThat(source)
            .contains("package demo.app;", "import java.util.List;", "public final class Main {",
                "static long answer = 42L;", "static Object f() {", "return answer;", "System.out.println(f());");
        assertThat(source.indexOf("package")).isLessThan(source.indexOf("import"));
        assertThat(source.indexOf("import")).isLessThan(source.indexOf("class"));
        assertThat(source.indexOf("answer = 42L")).isLessThan(source.indexOf("f()"));
    }

    @Test
    void customClassName() {
        assertThat(new Renderer().render(transpile("(def x 1)"), "Demo"))
            .contains("public final class Demo {")
            .doesNotContain("package");
    }

    @Test
    void renderingDoesNotModifyTheUnit() {
        final var unit = transpile("(ns a) (def x 1)");
        final var renderer = new Renderer();
        assertThat(renderer.render(unit, "First")).isEqualTo(renderer.render(unit, "First"));
        assertThat(renderer.render(unit, "Second")).contains("class Second");
        assertThat(renderer.renderForms(unit)).containsExactly("package a;", "static long x = 1L;");
    }

    @Test
    void formsRenderSeparately() {
        final var forms = new Renderer().renderForms(transpile("(def x 1) (import java.util.*) (+ x 2)"));
        assertThat(forms).hasSize(3);
        assertThat(forms.get(0)).isEqualTo("static long x = 1L;");
        assertThat(forms.get(1)).isEqualTo("import java.util.*;");
        assertThat(forms.get(2)).startsWith("static {").contains("System.out.println(x + 2L);").endsWith("}");
    }

    private static LoweredUnit transpile(final String source) {
        return new Transpiler().transpile(source).value();
    }
}
