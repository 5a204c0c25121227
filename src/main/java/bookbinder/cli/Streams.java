// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.cli;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;
import bookbinder.util.SneakyThrow;

/**
 * Exclusive access to the standard streams, so that multi-line reports don't interleave.
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
