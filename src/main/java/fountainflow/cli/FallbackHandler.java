// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.cli;

import fountainflow.util.Trace;
import fountainflow.util.condition.Condition;
import fountainflow.util.condition.ConditionContext;
import fountainflow.util.condition.HandlerProcedure;
import fountainflow.util.condition.Restart;
import fountainflow.util.condition.SignaledCondition;

/**
 * The outermost condition handler of the command line program.
 * <p>
 * Non-fatal conditions are printed as warnings and the conversion carries on. Fatal conditions are printed, then the
 * handler unwinds to the {@value Main#abortRestartName} restart; the program is non-interactive, so there is no restart
 * to choose from.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        try (final var streams = Streams.acquire()) {
            if (!condition.isFatal()) {
                showCondition(streams, condition.condition(), "Warning");
                return;
            }
            showCondition(streams, condition.condition(), "Error");
        }
        findAbortRestart().unwindTo();
    }

    private static void showCondition(final Streams streams, final Condition condition, final String prefix) {
        final var err = streams.err();
        err.println(prefix + ": " + condition.message());
        final var details = condition.detailedMessage().stripTrailing();
        if (!details.equals(condition.message())) {
            err.println(details);
        }
        final var traces = Trace.activeTraces().iterator();
        if (traces.hasNext()) {
            err.println("Operation trace:");
            while (traces.hasNext()) {
                err.println(" - " + traces.next());
            }
        }
        err.println();
    }

    private static Restart findAbortRestart() {
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(Main.abortRestartName)) {
                return restart;
            }
        }
        throw new IllegalStateException("No " + Main.abortRestartName + " restart available");
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
