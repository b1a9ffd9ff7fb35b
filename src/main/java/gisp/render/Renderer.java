// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.render;

import java.util.List;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import gisp.lowering.LoweredUnit;

/**
 * Turns lowered units into Java source text with JavaParser's pretty printer.
 * <p>
 * Rendering is total: every lowered unit has a textual form.
 */
public final class Renderer {
    public Renderer() {
        printer = new DefaultPrettyPrinter();
    }

    /**
     * Renders the whole unit as a compilation unit declaring a single class with the given name.
     */
    public String render(final LoweredUnit unit, final String className) {
        return printer.print(unit.toCompilationUnit(className));
    }

    /**
     * Renders each lowered form on its own, in source order, as the interactive mode shows them.
     */
    public List<String> renderForms(final LoweredUnit unit) {
        return unit.forms().stream().map(form -> printer.print(form.node()).stripTrailing()).toList();
    }

    private final DefaultPrettyPrinter printer;
}
