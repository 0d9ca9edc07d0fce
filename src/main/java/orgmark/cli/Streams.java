// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.concurrent.locks.ReentrantLock;
import orgmark.util.SneakyThrow;

/**
 * The input and output streams of one run, with exclusive access so that diagnostics and output lines never
 * interleave.
 */
final class Streams {
    Streams(final BufferedReader in, final PrintStream out, final PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    static Streams standard() {
        final var console = System.console();
        final var inputCharset = (console == null) ? Charset.defaultCharset() : console.charset();
        return new Streams(new BufferedReader(new InputStreamReader(System.in, inputCharset)), System.out, System.err);
    }

    Access acquire() {
        return new Access();
    }

    final class Access implements AutoCloseable {
        // The corresponding unlock is in close(), so this is fine.
        @SuppressWarnings("LockAcquiredButNotSafelyReleased")
        private Access() {
            try {
                lock.lockInterruptibly();
            } catch (final InterruptedException e) {
                throw SneakyThrow.doThrow(e);
            }
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

        BufferedReader in() {
            return in;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
}
