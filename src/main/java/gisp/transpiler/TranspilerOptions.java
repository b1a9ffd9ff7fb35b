// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.transpiler;

import javax.lang.model.SourceVersion;

/**
 * Settings of a {@link Transpiler}.
 *
 * @param maxNestingDepth The deepest nesting of lists, vectors and quoting prefixes the reader accepts.
 * @param className       The name of the class the rendered compilation unit declares.
 */
public record TranspilerOptions(int maxNestingDepth, String className) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 150;
    public static final String DEFAULT_CLASS_NAME = "Main";

    public TranspilerOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be positive, got " + maxNestingDepth);
        }
        if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
            throw new IllegalArgumentException("Not a valid Java class name: " + className);
        }
    }

    public static TranspilerOptions defaults() {
        return new TranspilerOptions(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_CLASS_NAME);
    }

    public TranspilerOptions withMaxNestingDepth(final int newMaxNestingDepth) {
        return new TranspilerOptions(newMaxNestingDepth, className);
    }

    public TranspilerOptions withClassName(final String newClassName) {
        return new TranspilerOptions(maxNestingDepth, newClassName);
    }
}
