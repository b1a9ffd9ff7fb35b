// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.cli;

import java.nio.file.Path;
import java.util.List;
import gisp.transpiler.TranspilerOptions;
import gisp.util.annotation.Nullable;

/**
 * Parsed command line arguments.
 *
 * @param options The transpiler settings.
 * @param file    The source file to transpile, or {@code null} to start the interactive loop.
 */
public record Arguments(TranspilerOptions options, @Nullable Path file) {
    public static final String USAGE = "Usage: gisp [--max-depth=N] [--class-name=Name] [file]";

    /**
     * Parses the given arguments. Options must come before the file name.
     *
     * @throws UsageException If an option is unknown or malformed, or if more than one file is given.
     */
    public static Arguments parse(final List<String> args) throws UsageException {
        var options = TranspilerOptions.defaults();
        Path file = null;
        for (final var arg : args) {
            if (file != null) {
                throw new UsageException("At most one file argument expected, got another: " + arg);
            }
            if (arg.startsWith(MAX_DEPTH)) {
                options = options.withMaxNestingDepth(parseDepth(arg.substring(MAX_DEPTH.length())));
            } else if (arg.startsWith(CLASS_NAME)) {
                final var name = arg.substring(CLASS_NAME.length());
                try {
                    options = options.withClassName(name);
                } catch (final IllegalArgumentException e) {
                    throw new UsageException("Invalid class name: " + name);
                }
            } else if (arg.startsWith("--")) {
                throw new UsageException("Unknown option: " + arg);
            } else {
                file = Path.of(arg);
            }
        }
        return new Arguments(options, file);
    }

    private static int parseDepth(final String text) throws UsageException {
        try {
            final var depth = Integer.parseInt(text);
            if (depth >= 1) {
                return depth;
            }
        } catch (final NumberFormatException e) {
            throw new UsageException("Maximum depth is not an integer: " + text);
        }
        throw new UsageException("Maximum depth must be positive: " + text);
    }

    private static final String MAX_DEPTH = "--max-depth=";
    private static final String CLASS_NAME = "--class-name=";
}
