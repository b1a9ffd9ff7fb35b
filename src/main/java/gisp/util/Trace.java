// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util;

import java.util.ArrayList;
import java.util.List;
import gisp.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable note on what the transpiler is doing, such as "Lowering special form defn". Construct it in a
 * try-with-resources header: it's pushed onto the calling thread's trace stack on construction and popped on
 * {@link #close()}.
 * <p>
 * When a stage signals an error, the messages of the active traces become part of the diagnostic. They describe the
 * input being processed, not the Java call stack.
 */
public final class Trace implements AutoCloseable {
    /**
     * Creates a trace whose message is computed only if somebody asks for it, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this(null, supplier);
    }

    public Trace(final String message) {
        this(message, null);
    }

    private Trace(final @Nullable String message, final @Nullable MessageSupplier supplier) {
        this.message = message;
        this.supplier = supplier;
        stack = threadStack.get();
        stack.add(this);
    }

    /**
     * Returns the messages of the calling thread's active traces, most recent first. The list is a copy, so it stays
     * valid after the traces are closed.
     */
    public static List<String> snapshot() {
        final var stack = threadStack.get();
        final var result = new ArrayList<String>(stack.size());
        for (int i = stack.size() - 1; i >= 0; i -= 1) {
            result.add(stack.get(i).message());
        }
        return List.copyOf(result);
    }

    /**
     * Does nothing. Referencing the resource keeps "unused variable" warnings away.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert stack == threadStack.get() : "Trace closed by a different thread";
        assert !stack.isEmpty() && stack.get(stack.size() - 1) == this : "Trace stack corrupt";
        stack.remove(stack.size() - 1);
    }

    private String message() {
        var result = message;
        if (result == null) {
            assert supplier != null : "Trace with neither a message nor a supplier";
            result = supplier.get();
            message = result;
        }
        return result;
    }

    private @MonotonicNonNull String message;
    private final @Nullable MessageSupplier supplier;
    private final List<Trace> stack;

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<List<Trace>> threadStack = ThreadLocal.withInitial(ArrayList::new);
}
