// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

import java.util.ArrayList;
import java.util.List;
import gisp.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of active condition handlers and restart points.
 * <p>
 * Handlers and restarts form two stacks owned by the current thread. Both are established and torn down in strict
 * LIFO order through try-with-resources and {@link #withRestart(String, RestartCallback)}, so the static methods here
 * always operate on the calling thread's stacks.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the given condition to the active handlers, newest first.
     * <p>
     * A handler accepts a condition by unwinding to a restart, which skips all older handlers. If every handler
     * returns normally, so does this method.
     */
    public static void signal(final @NotNull Condition condition) {
        current().dispatch(new SignaledCondition(condition, false));
    }

    /**
     * Offers the given condition to the active handlers as a fatal error.
     * <p>
     * Unlike {@link #signal(Condition)}, this never returns: if no handler unwinds, {@link UnhandledErrorError} is
     * thrown. The return type lets call sites write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        current().dispatch(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a new restart point named {@code restartName} on top of the restart stack.
     *
     * @return The callback's result, or {@code null} if a handler unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var context = current();
        final var restart = new Restart(restartName, context);
        context.restarts.add(restart);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            context.pop(context.restarts, restart);
        }
    }

    /**
     * Returns a snapshot of the active restart points, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var restarts = current().restarts;
        final var result = new ArrayList<Restart>(restarts.size());
        for (int i = restarts.size() - 1; i >= 0; i -= 1) {
            result.add(restarts.get(i));
        }
        return List.copyOf(result);
    }

    static @NotNull ConditionContext current() {
        return threadContext.get();
    }

    void push(final @NotNull Handler handler) {
        handlers.add(handler);
    }

    void pop(final @NotNull Handler handler) {
        pop(handlers, handler);
    }

    boolean isActive(final @NotNull Restart restart) {
        return restarts.contains(restart);
    }

    private void dispatch(final @NotNull SignaledCondition condition) {
        // A running handler only sees handlers older than itself, so a handler that signals can't recurse into itself.
        final var savedCeiling = ceiling;
        try {
            for (int i = Math.min(ceiling, handlers.size()) - 1; i >= 0; i -= 1) {
                ceiling = i;
                handlers.get(i).handle(condition);
            }
        } finally {
            ceiling = savedCeiling;
        }
    }

    private static <E> void pop(final @NotNull List<E> stack, final @NotNull E expected) {
        assert !stack.isEmpty() && stack.get(stack.size() - 1) == expected : "Condition context stack corrupt";
        stack.remove(stack.size() - 1);
    }

    private final @NotNull List<@NotNull Handler> handlers = new ArrayList<>();
    private final @NotNull List<@NotNull Restart> restarts = new ArrayList<>();
    private int ceiling = Integer.MAX_VALUE;

    private static final ThreadLocal<@NotNull ConditionContext> threadContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
