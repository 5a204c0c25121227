// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util.condition;

import java.util.ArrayList;
import java.util.List;
import bookbinder.util.SneakyThrow;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of established handlers and restart points.
 * <p>
 * Instances are never exposed; the static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition.
     * <p>
     * Established handlers run from the newest to the oldest. If all of them return normally, so does this method,
     * which makes it the way to report a diagnostic that shouldn't stop the caller. A handler may still unwind to a
     * restart point, in which case {@link Unwind} propagates from here.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler returns normally,
     * {@link UnhandledErrorError} is thrown. The declared return type lets call sites write
     * {@code throw ConditionContext.error(...)} to help control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given callback with a restart point around it.
     *
     * @param restartName The user-readable name of the restart point.
     * @param callback    The function to execute, receiving the restart object.
     * @return The value returned by {@code callback} if it returned normally. If a handler unwound to this restart
     * point, the value it unwound with, or {@code null} if there was none.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<T> callback) {
        final var restart = new Restart<T>(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return restart.valueOf(unwind);
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the established restart points, newest first.
     */
    public static List<Restart<?>> restarts() {
        final var result = new ArrayList<Restart<?>>();
        for (Restart<?> restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                // Callers of signal and error don't declare it, withRestart catches it.
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from inside a handler is only offered to the handlers older than that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart<?> firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
