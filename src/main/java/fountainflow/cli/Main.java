// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.cli;

import fountainflow.convert.ConversionPlan;
import fountainflow.convert.Converter;
import fountainflow.convert.UsageErrorCondition;
import fountainflow.util.condition.Condition;
import fountainflow.util.condition.ConditionContext;
import fountainflow.util.condition.Handler;
import fountainflow.util.condition.SignaledCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        final var failure = new FatalConditionRecorder();
        try (
            final var fallbackHandler = new Handler(FallbackHandler.instance());
            final var recordingHandler = new Handler(failure::record)
        ) {
            fallbackHandler.use();
            recordingHandler.use();
            final var exitCode = ConditionContext.withRestart(abortRestartName, restart -> {
                convert(args);
                return ExitCode.SUCCESS;
            });
            if (exitCode != null) {
                return exitCode;
            }
            return (failure.condition instanceof UsageErrorCondition) ? ExitCode.USAGE : ExitCode.ERROR;
        }
    }

    private static void convert(final String[] args) {
        final var arguments = Arguments.parse(args);
        final var plan = ConversionPlan.resolve(arguments.input(), arguments.target(), arguments.output());
        final var result = Converter.convert(plan);
        try (final var streams = Streams.acquire()) {
            final var out = streams.out();
            out.println("Parsed " + result.script().size() + " nodes from " + plan.source().commandLineName()
                + " source.");
            out.println("Written to " + result.output());
        }
    }

    static final String abortRestartName = "abort-conversion";

    // Installed inside the fallback handler, so it sees fatal conditions before the fallback unwinds.
    private static final class FatalConditionRecorder {
        void record(final SignaledCondition signaled) {
            if (signaled.isFatal()) {
                condition = signaled.condition();
            }
        }

        private @Nullable Condition condition = null;
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
