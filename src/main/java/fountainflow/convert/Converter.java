// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.convert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import fountainflow.script.Script;
import fountainflow.util.Trace;
import fountainflow.util.condition.ConditionContext;
import fountainflow.util.condition.exception.IOExceptionCondition;

/**
 * Carries out {@link ConversionPlan}s: reads the input, parses it, generates the output and writes it.
 * <p>
 * Files are read and written as UTF-8. The output file's parent directories are created as needed, and an existing
 * output file is overwritten.
 */
public final class Converter {
    private Converter(final ConversionPlan plan) {
        this.plan = plan;
    }

    /**
     * Carries out the given plan.
     * <p>
     * Signals {@link InputNotFoundCondition} if the input file doesn't exist, {@link IOExceptionCondition} if reading
     * or writing fails, plus whatever the parser and generator signal.
     */
    public static Result convert(final ConversionPlan plan) {
        return new Converter(plan).convert();
    }

    private Result convert() {
        try (final var trace = new Trace(() -> "Converting " + plan.input() + " to " + plan.target().displayName())) {
            trace.use();
            final var script = parse(read());
            write(plan.target().generate(script));
            return new Result(script, plan.output());
        }
    }

    private String read() {
        final var input = plan.input();
        if (!Files.isRegularFile(input)) {
            throw ConditionContext.error(new InputNotFoundCondition(input));
        }
        try (final var trace = new Trace(() -> "Reading " + input)) {
            trace.use();
            try {
                return Files.readString(input, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private Script parse(final String text) {
        return plan.source().parse(text);
    }

    private void write(final String text) {
        final var output = plan.output();
        try (final var trace = new Trace(() -> "Writing " + output)) {
            trace.use();
            try {
                final var parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(output, text, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private final ConversionPlan plan;

    /**
     * The outcome of a successful conversion.
     *
     * @param script The parsed script.
     * @param output The file the output was written to.
     */
    public record Result(Script script, Path output) {
    }
}
