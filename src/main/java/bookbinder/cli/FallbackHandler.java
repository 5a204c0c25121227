// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.cli;

import bookbinder.util.Trace;
import bookbinder.util.condition.Condition;
import bookbinder.util.condition.ConditionContext;
import bookbinder.util.condition.HandlerProcedure;
import bookbinder.util.condition.SignaledCondition;

/**
 * The handler of last resort: reports every condition on standard error.
 * <p>
 * Non-fatal conditions are reported as warnings and processing continues. A fatal condition nobody else handled is
 * reported and control unwinds to the oldest restart, since there's nobody to ask for a better choice.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            try (final var streams = Streams.acquire()) {
                showWarning(streams, condition.condition());
            }
            return;
        }
        final var restarts = ConditionContext.restarts();
        try (final var streams = Streams.acquire()) {
            showFatalCondition(streams, condition.condition());
        }
        if (restarts.isEmpty()) {
            throw new RuntimeException("No restarts available");
        }
        final var oldest = restarts.get(restarts.size() - 1);
        oldest.unwindTo();
    }

    private static void showWarning(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("Warning (" + condition.getClass().getSimpleName() + "): " + condition.message());
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
    }

    private static void showFatalCondition(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
