// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.cli;

import orgmark.inline.UnknownEntityCondition;
import orgmark.util.Trace;
import orgmark.util.condition.Condition;
import orgmark.util.condition.ConditionContext;
import orgmark.util.condition.HandlerProcedure;
import orgmark.util.condition.SignaledCondition;

/**
 * The outermost handler: reports unknown entities as warnings, and reports fatal conditions before unwinding to the
 * {@code abort-process} restart.
 * <p>
 * Standard input carries the markup being parsed, so unlike an interactive debugger this handler never asks which
 * restart to pick.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final Streams streams) {
        this.streams = streams;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            if (condition.condition() instanceof final UnknownEntityCondition c) {
                try (final var access = streams.acquire()) {
                    access.err().println("Warning: " + c.message());
                }
            }
            return;
        }
        try (final var access = streams.acquire()) {
            showCondition(access, condition.condition());
        }
        final var restart = ConditionContext.findRestart(abortRestartName);
        if (restart == null) {
            throw new IllegalStateException("No " + abortRestartName + " restart available");
        }
        restart.unwindTo();
    }

    private static void showCondition(final Streams.Access access, final Condition condition) {
        final var err = access.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static final String abortRestartName = "abort-process";

    private final Streams streams;
}
