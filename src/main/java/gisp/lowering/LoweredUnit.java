// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.List;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The result of lowering one input chunk: one {@link LoweredForm} per top-level S-expression, in source order.
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "JavaParser nodes are handed to the renderer as is")
public record LoweredUnit(List<LoweredForm> forms) {
    public LoweredUnit {
        forms = List.copyOf(forms);
    }

    /**
     * Assembles the forms into a compilation unit declaring a single {@code public final} class with the given name.
     * <p>
     * Members keep their source order. The package declaration and the imports go where Java requires them; if there
     * are several {@code ns} forms, the last one wins. The forms of this unit are not modified: the compilation unit
     * is built from copies.
     */
    public CompilationUnit toCompilationUnit(final String className) {
        final var unit = new CompilationUnit();
        final var type = unit.addClass(className, Modifier.Keyword.PUBLIC, Modifier.Keyword.FINAL);
        for (final var form : forms) {
            if (form instanceof LoweredForm.Package packageForm) {
                unit.setPackageDeclaration(packageForm.node().clone());
            } else if (form instanceof LoweredForm.Import importForm) {
                unit.addImport(importForm.node().clone());
            } else if (form instanceof LoweredForm.Member member) {
                type.addMember(member.node().clone());
            }
        }
        return unit;
    }
}
