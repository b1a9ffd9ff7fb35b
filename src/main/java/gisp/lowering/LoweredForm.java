// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;

/**
 * The lowered counterpart of one top-level form.
 */
public sealed interface LoweredForm {
    /**
     * Retrieves the JavaParser node this form lowered into.
     */
    Node node();

    /**
     * A package declaration, from {@code ns}.
     */
    record Package(PackageDeclaration node) implements LoweredForm {
    }

    /**
     * An import declaration, from {@code import}.
     */
    record Import(ImportDeclaration node) implements LoweredForm {
    }

    /**
     * A member of the generated class: a field, a method, or a static initializer.
     */
    record Member(BodyDeclaration<?> node) implements LoweredForm {
    }
}
