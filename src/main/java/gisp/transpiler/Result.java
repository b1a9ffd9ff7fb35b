// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.transpiler;

import java.util.NoSuchElementException;
import java.util.function.Function;
import gisp.diagnostic.Diagnostic;

/**
 * The outcome of running a transpiler stage: either a value or a {@link Diagnostic} explaining why there's none.
 */
public sealed interface Result<T> {
    /**
     * Returns {@code true} iff this is a {@link Success}.
     */
    boolean isSuccess();

    /**
     * Retrieves the value of a successful result.
     *
     * @throws NoSuchElementException If this is a {@link Failure}.
     */
    T value();

    /**
     * Applies the given stage to the value of a successful result; failures are passed through unchanged.
     */
    <U> Result<U> then(Function<? super T, Result<U>> next);

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Result<U> then(final Function<? super T, Result<U>> next) {
            return next.apply(value);
        }
    }

    record Failure<T>(Diagnostic diagnostic) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new NoSuchElementException("Failed result has no value: " + diagnostic.message());
        }

        @Override
        public <U> Result<U> then(final Function<? super T, Result<U>> next) {
            return new Failure<>(diagnostic);
        }
    }
}
