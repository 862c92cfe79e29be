// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.cli;

import java.nio.file.Path;
import fountainflow.convert.Format;
import fountainflow.convert.UsageErrorCondition;
import fountainflow.util.condition.ConditionContext;
import fountainflow.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parsed command line arguments: {@code <input> [--to twee|renpy|fflow] [--out <path>]}.
 *
 * @param input  The input file.
 * @param target The requested target format, {@code null} if not given.
 * @param output The requested output file, {@code null} if not given.
 */
public record Arguments(Path input, @Nullable Format target, @Nullable Path output) {
    /**
     * Parses the given command line. Signals {@link UsageErrorCondition} if it's malformed.
     */
    public static Arguments parse(final String[] args) {
        @Nullable Path input = null;
        @Nullable Format target = null;
        @Nullable Path output = null;
        for (int i = 0; i < args.length; i += 1) {
            final var argument = args[i];
            switch (argument) {
                case "--to" -> {
                    final var name = optionValue(args, i);
                    target = Format.fromCommandLineName(name);
                    if (target == null) {
                        throw usageError("Unknown target format '" + name + "'");
                    }
                    i += 1;
                }
                case "--out" -> {
                    output = Path.of(optionValue(args, i));
                    i += 1;
                }
                default -> {
                    if (argument.startsWith("--")) {
                        throw usageError("Unknown option '" + argument + "'");
                    }
                    if (input != null) {
                        throw usageError("Exactly one input file expected");
                    }
                    input = Path.of(argument);
                }
            }
        }
        if (input == null) {
            throw usageError("No input file given");
        }
        return new Arguments(input, target, output);
    }

    private static String optionValue(final String[] args, final int optionIndex) {
        if (optionIndex + 1 >= args.length) {
            throw usageError("Option " + args[optionIndex] + " requires a value");
        }
        return args[optionIndex + 1];
    }

    private static UnhandledErrorError usageError(final String message) {
        return ConditionContext.error(new UsageErrorCondition(message + "\n" + usage));
    }

    static final String usage = "Usage: fountainflow <input file> [--to twee|renpy|fflow] [--out <output file>]";
}
