// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.cli;

/**
 * Thrown when the command line arguments can't be understood.
 */
public final class UsageException extends Exception {
    public UsageException(final String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
