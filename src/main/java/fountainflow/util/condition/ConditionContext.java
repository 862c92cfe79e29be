// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import fountainflow.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition context keeps track of currently registered handlers and restart points.
 * <p>
 * Each thread has its own context, so parsing or generating scripts on several threads at once never mixes up their
 * diagnostics. Instances are not accessible directly: static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Currently registered handlers are invoked from the newest one to the oldest. If all of them return normally,
     * this method returns normally as well, which is what the parsers and generators rely on: with no handler
     * installed, a diagnostic costs nothing.
     * <p>
     * Since handlers are allowed to unwind to a restart point, this method may throw {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if all handlers decline, {@link UnhandledErrorError} is
     * thrown. Since this method never returns normally, it's declared to return {@link UnhandledErrorError} that can be
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
     * @param callback    The function to execute; the restart object is passed as an argument.
     * @return The value returned by {@code callback}, or {@code null} if a handler unwound to this restart point.
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
     * Returns an iterable containing all active restart points, ordered from the newest one to the oldest.
     */
    public static Iterable<Restart> restarts() {
        return localContext().new RestartIterable();
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
        // A condition signaled from inside a handler only reaches the handlers established before that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    private final class RestartIterable implements Iterable<Restart> {
        @Override
        public Iterator<Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
