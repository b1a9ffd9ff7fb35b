// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp.reader;

/**
 * A stream of characters over one input chunk with single-character lookahead.
 * <p>
 * This class provides the lookahead necessary for the {@link Lexer} to work, and remembers where the lexeme being
 * scanned started.
 */
final class CharStream {
    CharStream(final String text) {
        this.text = text;
    }

    /**
     * Returns {@code true} iff this stream has reached the end.
     * <p>
     * If {@code false} is returned, it becomes safe to peek at the current character by calling {@link #peek()} and
     * to discard it by calling {@link #discardPeek()}.
     */
    boolean reachedEnd() {
        return position >= text.length();
    }

    /**
     * Returns the current character of this stream, without advancing the current position.
     * <p>
     * Calling this method without checking if the stream is at the end by calling {@link #reachedEnd()} first is
     * an error. This is only checked by assertions.
     */
    char peek() {
        assert position < text.length();
        return text.charAt(position);
    }

    /**
     * Discards the current character, advancing to the next one.
     */
    void discardPeek() {
        assert position < text.length();
        position += 1;
    }

    /**
     * Discards characters up to, but not including, the next line feed, or up to the end of input if there is none.
     */
    void skipToLineFeed() {
        final var lineFeedPosition = text.indexOf('\n', position);
        position = (lineFeedPosition == -1) ? text.length() : lineFeedPosition;
    }

    /**
     * Marks the current position as the start of the next lexeme.
     */
    void markLexemeStart() {
        lexemeStart = position;
    }

    int lexemeStart() {
        return lexemeStart;
    }

    /**
     * Returns the text of the lexeme scanned since the last call to {@link #markLexemeStart()}.
     */
    String lexeme() {
        return text.substring(lexemeStart, position);
    }

    private final String text;
    private int position = 0;
    private int lexemeStart = 0;
}
