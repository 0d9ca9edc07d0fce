// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import orgmark.codec.TreeWriter;
import orgmark.inline.ParseSession;
import orgmark.util.Trace;
import orgmark.util.annotation.Nullable;
import orgmark.util.condition.ConditionContext;
import orgmark.util.condition.Handler;

/**
 * Parses every line of standard input as inline markup, in one shared session, and prints each line's serialized
 * inline tree on its own line of standard output.
 */
public final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(run(args, Streams.standard()).value);
    }

    /**
     * Runs the program with the given arguments and streams instead of the process-wide ones.
     *
     * @return The process exit code: 0 on success, 1 if a fatal condition aborted the run, 64 if any arguments were
     * given.
     */
    public static int run(final String[] args, final BufferedReader in, final PrintStream out, final PrintStream err) {
        return run(args, new Streams(in, out, err)).value;
    }

    private static ExitCode run(final String[] args, final Streams streams) {
        if (args.length != 0) {
            try (final var access = streams.acquire()) {
                access.err().println("No arguments expected; inline markup is read from standard input");
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(new FallbackHandler(streams))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                processLines(streams, ParseSession.withDefaults());
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static void processLines(final Streams streams, final ParseSession session) {
        int lineNumber = 1;
        while (true) {
            final var line = readLine(streams);
            if (line == null) {
                return;
            }
            final var currentLine = lineNumber;
            try (final var trace = new Trace(() -> "Parsing input line #" + currentLine)) {
                trace.use();
                final var serialized = TreeWriter.write(session.parse(line));
                try (final var access = streams.acquire()) {
                    access.out().println(serialized);
                }
            }
            lineNumber += 1;
        }
    }

    private static @Nullable String readLine(final Streams streams) {
        try (final var access = streams.acquire()) {
            return access.in().readLine();
        } catch (final IOException e) {
            throw ConditionContext.error(new InputErrorCondition(e));
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
