// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.transpiler;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import gisp.diagnostic.CompilationErrorCondition;
import gisp.diagnostic.Diagnostic;
import gisp.lowering.LoweredUnit;
import gisp.lowering.Lowerer;
import gisp.lowering.SpecialForms;
import gisp.sexp.Sexp;
import gisp.sexp.reader.Lexer;
import gisp.sexp.reader.Reader;
import gisp.util.Trace;
import gisp.util.UnreachableCodeReachedError;
import gisp.util.condition.ConditionContext;
import gisp.util.condition.Handler;
import gisp.util.condition.MessageSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The transpiler: runs the tokenizer, the reader and the lowering engine over one input chunk.
 * <p>
 * Every stage signals malformed input as a fatal {@link CompilationErrorCondition}. The transpiler handles those by
 * unwinding to an {@code abort-transpilation} restart established around each call, and reports them as a
 * {@link Result.Failure}, so no error about the input escapes to the caller. Conditions of any other type are left to
 * handlers established by the caller.
 * <p>
 * No state is retained between calls: each chunk gets a fresh lexer, reader and lowerer. Instances are thread-safe.
 */
public final class Transpiler {
    public Transpiler() {
        this(TranspilerOptions.defaults());
    }

    public Transpiler(final TranspilerOptions options) {
        this(options, SpecialForms.standard());
    }

    public Transpiler(final TranspilerOptions options, final SpecialForms specialForms) {
        this.options = options;
        this.specialForms = specialForms;
    }

    public TranspilerOptions options() {
        return options;
    }

    /**
     * Reads every top-level S-expression of the given source text.
     */
    public Result<List<Sexp>> read(final String source) {
        return attempt(() -> "Reading " + source.length() + " characters of input", () -> {
            final var forms = new Reader(new Lexer(source), options.maxNestingDepth()).readAll();
            logger.debug("Read {} top-level forms", forms.size());
            return forms;
        });
    }

    /**
     * Lowers the given top-level forms into a unit. A failure in any form fails the whole unit.
     */
    public Result<LoweredUnit> lower(final List<Sexp> forms) {
        return attempt(() -> "Lowering " + forms.size() + " top-level forms",
            () -> new Lowerer(specialForms).lower(forms));
    }

    /**
     * Reads and lowers the given source text.
     */
    public Result<LoweredUnit> transpile(final String source) {
        return read(source).then(this::lower);
    }

    private static <T> Result<T> attempt(final MessageSupplier description, final Supplier<T> stage) {
        final var failure = new AtomicReference<Diagnostic>();
        final var result = ConditionContext.<Result<T>>withRestart("abort-transpilation", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal() && signaled.condition() instanceof final CompilationErrorCondition error) {
                    failure.set(error.toDiagnostic());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                try (final var trace = new Trace(description)) {
                    trace.use();
                    return new Result.Success<>(stage.get());
                }
            }
        });
        if (result != null) {
            return result;
        }
        final var diagnostic = failure.get();
        if (diagnostic == null) {
            throw new UnreachableCodeReachedError("Unwound to abort-transpilation without a diagnostic");
        }
        logger.debug("Transpilation failed at {} stage: {}", diagnostic.stage().displayName(), diagnostic.message());
        return new Result.Failure<>(diagnostic);
    }

    private final TranspilerOptions options;
    private final SpecialForms specialForms;

    private static final Logger logger = LoggerFactory.getLogger(Transpiler.class);
}
