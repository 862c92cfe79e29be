// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.cli;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;
import fountainflow.util.SneakyThrow;

/**
 * Exclusive access to the console, so that a diagnostic and its operation trace are never interleaved with other
 * output.
 */
final class Streams implements AutoCloseable {
    // The corresponding unlock is in close(), so this is fine.
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    static Streams acquire() {
        return new Streams();
    }

    @Override
    public void close() {
        lock.unlock();
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    PrintStream out() {
        return System.out;
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    PrintStream err() {
        return System.err;
    }

    private static final ReentrantLock lock = new ReentrantLock();
}
