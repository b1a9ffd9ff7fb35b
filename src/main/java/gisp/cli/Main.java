// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import gisp.render.Renderer;
import gisp.transpiler.Result;
import gisp.transpiler.Transpiler;
import gisp.util.Trace;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.Handler;
import gisp.util.condition.exception.IOExceptionCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The program entry point.
 */
public final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(run(List.of(args), Streams.standard()));
    }

    /**
     * Runs the command line interface over the given streams instead of the process's standard ones. Input is decoded
     * as UTF-8.
     *
     * @return The exit code: 0 on success, 1 if the input couldn't be read or transpiled, 64 on a usage error.
     */
    public static int run(
        final List<String> args,
        final InputStream in,
        final PrintStream out,
        final PrintStream err
    ) {
        return run(args, new Streams(in, StandardCharsets.UTF_8, out, err));
    }

    private static int run(final List<String> args, final Streams streams) {
        return runImpl(args, streams).value;
    }

    private static ExitCode runImpl(final List<String> args, final Streams streams) {
        final Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (final UsageException e) {
            try (final var acquired = streams.acquire()) {
                acquired.err().println(e.getMessage());
                acquired.err().println(Arguments.USAGE);
                return ExitCode.USAGE;
            }
        }

        final var transpiler = new Transpiler(arguments.options());
        final var renderer = new Renderer();
        try (final var handler = new Handler(new FallbackHandler(streams))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                final var file = arguments.file();
                if (file == null) {
                    new Repl(transpiler, renderer, streams).run();
                    return ExitCode.SUCCESS;
                }
                return transpileFile(transpiler, renderer, streams, file);
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode transpileFile(
        final Transpiler transpiler,
        final Renderer renderer,
        final Streams streams,
        final Path file
    ) {
        final var source = readFile(file);
        final var result = transpiler.transpile(source);
        try (final var acquired = streams.acquire()) {
            if (result instanceof final Result.Failure<?> failure) {
                logger.warn("Transpiling {} failed", file);
                acquired.err().println(file + ": " + failure.diagnostic().format(source));
                return ExitCode.ERROR;
            }
            acquired.out().print(renderer.render(result.value(), transpiler.options().className()));
            return ExitCode.SUCCESS;
        }
    }

    private static String readFile(final Path file) {
        try (final var trace = new Trace(() -> "Reading source file " + file)) {
            trace.use();
            try {
                return Files.readString(file);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
