// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import orgmark.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of installed handlers and restart points.
 * <p>
 * Every thread has its own context, so independent parses on different threads never see each other's handlers.
 * The context itself is not exposed; the static methods operate on the calling thread's one.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as a non-fatal one.
     * <p>
     * Handlers run from the newest to the oldest, until one transfers control elsewhere. If all of them decline, this
     * method returns normally. A handler may unwind to a restart, in which case this method throws {@link Unwind}.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is thrown.
     * Never returns normally; the declared return type lets call sites write
     * {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the given callback with a restart point named {@code restartName} established around it.
     *
     * @return The callback's result, or {@code null} if a handler unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's active restart points, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var result = new ArrayList<@NotNull Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the newest active restart point with the given name, or {@code null} if there is none.
     */
    public static @Nullable Restart findRestart(final @NotNull String restartName) {
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            if (restart.name().equals(restartName)) {
                return restart;
            }
        }
        return null;
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from within a handler only reaches the handlers installed before that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
