// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition.exception;

import java.io.IOException;
import gisp.util.condition.Condition;

/**
 * Signaled when reading a source file or standard input fails.
 */
public final class IOExceptionCondition extends Condition {
    public IOExceptionCondition(final IOException exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    public IOException exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        return exception.getClass().getName() + ": " + message();
    }

    private final IOException exception;
}
