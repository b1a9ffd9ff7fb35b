// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.diagnostic;

/**
 * A human-oriented location in the source text: 1-based line and column numbers.
 */
public record SourcePosition(int line, int column) {
    /**
     * Computes the line and column of the given character offset into {@code source}.
     * <p>
     * Offsets past the end of the text are clamped to the end.
     */
    public static SourcePosition of(final String source, final int offset) {
        final var end = Math.min(Math.max(offset, 0), source.length());
        var line = 1;
        var lineStart = 0;
        for (int i = 0; i < end; i += 1) {
            if (source.charAt(i) == '\n') {
                line += 1;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(line, end - lineStart + 1);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
