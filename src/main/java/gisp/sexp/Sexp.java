// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.sexp;

/**
 * Base type of S-expression objects.
 * <p>
 * S-expression objects are immutable. Every object remembers the character offset into the source text where it
 * starts, for diagnostics only: two trees that differ only in positions are considered the same tree by
 * {@link Sexps#sameShape(Sexp, Sexp)}.
 */
public sealed interface Sexp {
    /**
     * Retrieves the character offset into the source text where this S-expression starts.
     */
    int position();

    /**
     * Base interface for leaf S-expressions.
     * <p>
     * Atoms keep their literal source text; no numeric parsing or unescaping happens while reading.
     */
    sealed interface Atom extends Sexp {
        /**
         * Retrieves the literal source text of this atom.
         */
        java.lang.String text();
    }

    /**
     * A symbol, such as {@code defn}, {@code foo-bar} or {@code System.out.println}.
     */
    record Symbol(java.lang.String text, int position) implements Atom {
        /**
         * Returns {@code true} iff this symbol has the given name.
         */
        public boolean is(final java.lang.String name) {
            return text.equals(name);
        }
    }

    /**
     * An integer literal: an unsigned run of decimal digits.
     */
    record Integer(java.lang.String text, int position) implements Atom {
    }

    /**
     * A floating point literal: a run of decimal digits, a dot, and a possibly empty run of decimal digits.
     */
    record Float(java.lang.String text, int position) implements Atom {
    }

    /**
     * A string literal. The text includes the surrounding quotes, and escape sequences are kept verbatim.
     */
    record String(java.lang.String text, int position) implements Atom {
    }

    /**
     * An S-expression list object, read from {@code (...)}.
     */
    record List(java.util.List<Sexp> elements, int position) implements Sexp {
        public List {
            elements = java.util.List.copyOf(elements);
        }
    }

    /**
     * An S-expression vector object, read from {@code [...]}.
     * <p>
     * Structurally identical to {@link List}; the distinction only matters to lowering.
     */
    record Vector(java.util.List<Sexp> elements, int position) implements Sexp {
        public Vector {
            elements = java.util.List.copyOf(elements);
        }
    }

    /**
     * A form preceded by one of the quoting prefixes.
     */
    record Quoted(QuoteKind kind, Sexp inner, int position) implements Sexp {
    }
}
