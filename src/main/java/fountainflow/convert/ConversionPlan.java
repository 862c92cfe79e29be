// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.convert;

import java.nio.file.Path;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import fountainflow.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A fully resolved conversion request: what to read, how to parse it, how to generate the output and where to write
 * it.
 *
 * @param input  The input file.
 * @param source The format of the input file.
 * @param target The format to generate.
 * @param output The output file.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record ConversionPlan(Path input, Format source, Format target, Path output) {
    /**
     * Resolves a conversion request.
     * <p>
     * The source format is given by the extension of the input file. Without an explicit target, anything but FFlow
     * is converted to FFlow; FFlow input requires an explicit target. Without an explicit output path, the output goes
     * to the {@code output} directory, under the input's base name with the target format's extension.
     * <p>
     * This method does not touch the file system. It signals {@link UsageErrorCondition} if the input format is
     * unknown, or if the input is FFlow and no target was given.
     */
    public static ConversionPlan resolve(
        final Path input,
        final @Nullable Format target,
        final @Nullable Path output
    ) {
        final var source = Format.ofPath(input);
        if (source == null) {
            throw ConditionContext.error(new UsageErrorCondition(
                "Unknown input format '" + Format.extensionOf(input) + "'. Supported: .fflow, .twee, .tw, .rpy"
            ));
        }
        final var resolvedTarget = resolveTarget(source, target);
        final var resolvedOutput = (output != null)
            ? output
            : defaultOutputDirectory.resolve(Format.baseNameOf(input) + resolvedTarget.outputExtension());
        return new ConversionPlan(input, source, resolvedTarget, resolvedOutput);
    }

    private static Format resolveTarget(final Format source, final @Nullable Format target) {
        if (target != null) {
            return target;
        }
        if (source == Format.FFLOW) {
            throw ConditionContext.error(new UsageErrorCondition("Please specify --to [twee|renpy]"));
        }
        return Format.FFLOW;
    }

    private static final Path defaultOutputDirectory = Path.of("output");
}
