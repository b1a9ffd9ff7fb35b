// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp;

import gisp.util.annotation.Nullable;

/**
 * The quoting prefixes, together with their longhand symbol names.
 */
public enum QuoteKind {
    QUOTE("quote", "'"),
    QUASIQUOTE("quasiquote", "`"),
    UNQUOTE("unquote", ","),
    UNQUOTE_SPLICE("unquote-splice", ",@");

    QuoteKind(final String symbolName, final String prefix) {
        this.symbolName = symbolName;
        this.prefix = prefix;
    }

    /**
     * Retrieves the name of the symbol that introduces the longhand form, as in {@code (quote x)}.
     */
    public String symbolName() {
        return symbolName;
    }

    /**
     * Retrieves the prefix characters, as in {@code 'x}.
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Returns the quoting kind whose longhand symbol has the given name, or {@code null} if there's none.
     */
    public static @Nullable QuoteKind bySymbolName(final String name) {
        for (final var kind : values()) {
            if (kind.symbolName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    private final String symbolName;
    private final String prefix;
}
