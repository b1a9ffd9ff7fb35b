// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.cli;

import java.io.IOException;
import gisp.render.Renderer;
import gisp.transpiler.Result;
import gisp.transpiler.Transpiler;
import gisp.util.Trace;
import gisp.util.annotation.Nullable;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.Unwind;
import gisp.util.condition.exception.IOExceptionCondition;

/**
 * The interactive loop: each line is transpiled on its own, and the declaration of each of its forms is printed.
 */
final class Repl {
    Repl(final Transpiler transpiler, final Renderer renderer, final Streams streams) {
        this.transpiler = transpiler;
        this.renderer = renderer;
        this.streams = streams;
    }

    void run() throws Unwind {
        while (true) {
            final var line = readLine();
            if (line == null) {
                return;
            }
            switch (line.trim()) {
                case "" -> {
                }
                case "exit", "q", "quit" -> {
                    return;
                }
                default -> evaluate(line);
            }
        }
    }

    private void evaluate(final String line) throws Unwind {
        ConditionContext.withRestart("return-to-repl", restart -> {
            final var result = transpiler.transpile(line);
            try (final var acquired = streams.acquire()) {
                if (result instanceof final Result.Failure<?> failure) {
                    acquired.err().println(failure.diagnostic().format(line));
                } else {
                    for (final var rendered : renderer.renderForms(result.value())) {
                        acquired.out().println(rendered);
                    }
                }
            }
            return this;
        });
    }

    private @Nullable String readLine() throws Unwind {
        try (final var trace = new Trace("Reading a line of input")) {
            trace.use();
            try (final var acquired = streams.acquire()) {
                acquired.out().print(PROMPT);
                acquired.out().flush();
                try {
                    return acquired.in().readLine();
                } catch (final IOException e) {
                    throw ConditionContext.error(new IOExceptionCondition(e));
                }
            }
        }
    }

    private static final String PROMPT = ">> ";

    private final Transpiler transpiler;
    private final Renderer renderer;
    private final Streams streams;
}
