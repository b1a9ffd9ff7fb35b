// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

/**
 * The number of arguments a special form accepts, not counting the head symbol.
 *
 * @param min The minimum number of arguments.
 * @param max The maximum number of arguments, or {@link #UNBOUNDED} if there's no maximum.
 */
public record Arity(int min, int max) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public Arity {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid arity bounds " + min + ".." + max);
        }
    }

    public static Arity exactly(final int count) {
        return new Arity(count, count);
    }

    public static Arity atLeast(final int min) {
        return new Arity(min, UNBOUNDED);
    }

    public static Arity between(final int min, final int max) {
        return new Arity(min, max);
    }

    /**
     * Returns {@code true} iff a form with the given number of arguments is acceptable.
     */
    public boolean accepts(final int count) {
        return count >= min && count <= max;
    }

    @Override
    public String toString() {
        if (min == max) {
            return "exactly " + min;
        } else if (max == UNBOUNDED) {
            return "at least " + min;
        } else {
            return min + " to " + max;
        }
    }
}
