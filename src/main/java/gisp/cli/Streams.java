// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.cli;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.concurrent.locks.ReentrantLock;
import gisp.util.annotation.Nullable;

/**
 * The input and output streams of one command line run, with exclusive access so that a prompt, its input and the
 * output it produces aren't interleaved with diagnostics printed by condition handlers.
 * <p>
 * Use {@link #acquire()} in a try-with-resources header; the streams may only be touched while acquired.
 */
final class Streams implements AutoCloseable {
    Streams(final InputStream input, final Charset inputCharset, final PrintStream out, final PrintStream err) {
        this.input = input;
        this.inputCharset = inputCharset;
        this.out = out;
        this.err = err;
    }

    /**
     * Returns the process's standard streams. Standard input is decoded with the console's charset, if there's a
     * console.
     */
    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    static Streams standard() {
        final var console = System.console();
        final var charset = (console == null) ? Charset.defaultCharset() : console.charset();
        return new Streams(System.in, charset, System.out, System.err);
    }

    // The corresponding unlock is in close().
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    Streams acquire() {
        lock.lock();
        return this;
    }

    @Override
    public void close() {
        lock.unlock();
    }

    PrintStream out() {
        return out;
    }

    PrintStream err() {
        return err;
    }

    /**
     * Returns the reader over the input stream. It's created on first use, so file mode never wraps standard input.
     */
    BufferedReader in() {
        assert lock.isHeldByCurrentThread() : "Streams used without acquiring them";
        var result = reader;
        if (result == null) {
            result = new BufferedReader(new InputStreamReader(input, inputCharset));
            reader = result;
        }
        return result;
    }

    private final InputStream input;
    private final Charset inputCharset;
    private final PrintStream out;
    private final PrintStream err;
    private final ReentrantLock lock = new ReentrantLock();
    private @Nullable BufferedReader reader = null;
}
