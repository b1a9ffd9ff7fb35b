// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.diagnostic;

import java.util.List;
import gisp.util.annotation.Nullable;

/**
 * A structured description of why an input chunk could not be transpiled.
 *
 * @param stage    The stage that rejected the input.
 * @param offset   The character offset into the input where the offending lexeme or form starts.
 * @param message  The user-readable message.
 * @param form     The textual representation of the offending form, if the error concerns a whole form.
 * @param trace    The operation trace active when the error was detected, most recent first.
 */
public record Diagnostic(Stage stage, int offset, String message, @Nullable String form, List<String> trace) {
    public Diagnostic {
        trace = List.copyOf(trace);
    }

    /**
     * Formats this diagnostic for display, resolving the offset into a line and column of the given source text.
     */
    public String format(final String source) {
        final var builder = new StringBuilder();
        builder.append(stage.displayName())
            .append(" error at ")
            .append(SourcePosition.of(source, offset))
            .append(": ")
            .append(message);
        if (form != null) {
            builder.append("\n  in form: ").append(form);
        }
        for (final var traceMessage : trace) {
            builder.append("\n  - ").append(traceMessage);
        }
        return builder.toString();
    }
}
