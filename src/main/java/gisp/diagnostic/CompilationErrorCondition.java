// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.diagnostic;

import java.util.List;
import gisp.util.Trace;
import gisp.util.annotation.Nullable;
import gisp.util.condition.Condition;

/**
 * The base type of conditions signaled when the input text is malformed.
 * <p>
 * Each stage signals its own subtype as a fatal condition; whoever drives the stages converts it into a
 * {@link Diagnostic} and unwinds.
 */
public abstract class CompilationErrorCondition extends Condition {
    protected CompilationErrorCondition(final Stage stage, final int offset, final String message) {
        super(message);
        this.stage = stage;
        this.offset = offset;
        this.trace = Trace.snapshot();
    }

    public final Stage stage() {
        return stage;
    }

    public final int offset() {
        return offset;
    }

    /**
     * Retrieves the textual representation of the offending form, or {@code null} if the error isn't about a form.
     */
    public @Nullable String form() {
        return null;
    }

    /**
     * Converts this condition into a diagnostic, including the trace that was active when it was created.
     */
    public final Diagnostic toDiagnostic() {
        return new Diagnostic(stage, offset, message(), form(), trace);
    }

    @Override
    public String detailedMessage() {
        return stage.displayName() + " error at offset " + offset + ": " + message();
    }

    private final Stage stage;
    private final int offset;
    private final List<String> trace;
}
