// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util.condition;

import java.util.ArrayList;
import java.util.List;
import sexpedit.util.SneakyThrow;
import sexpedit.util.annotation.Nullable;

/**
 * Keeps track of the installed handlers and restart points of a thread.
 * <p>
 * Every thread has its own context. Instances are not accessible directly; the static methods operate on the
 * calling thread's context.
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
     * Installed handlers run from the newest to the oldest. If all of them return normally, so does this method.
     * Since a handler may unwind to a restart point, this method may throw {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler declines, an {@link UnhandledErrorError}
     * is thrown. A condition signaled this way is called <dfn>fatal</dfn>.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnhandledErrorError} that can be
     * "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given function with a restart point around it.
     *
     * @param restartName The user-readable name of this restart point.
     * @param callback    The function to execute with a restart around it. The restart object is passed as an argument.
     * @return If {@code callback} did not unwind to this restart point, the value it returned. Otherwise
     * {@code null}.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
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
     * Returns the active restart points, ordered from the newest one to the oldest.
     */
    public static List<Restart> restarts() {
        final var result = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    /**
     * Returns the newest active restart point with the given name, or {@code null} if there is none.
     */
    public static @Nullable Restart findRestart(final String name) {
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            if (restart.name().equals(name)) {
                return restart;
            }
        }
        return null;
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
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from within a handler is only seen by the handlers installed before that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
