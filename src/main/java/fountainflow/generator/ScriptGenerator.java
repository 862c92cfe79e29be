// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import java.util.ArrayList;
import java.util.List;
import fountainflow.script.Node;
import fountainflow.script.Script;
import fountainflow.util.Trace;
import fountainflow.util.condition.ConditionContext;

/**
 * The common generation loop shared by all generators.
 * <p>
 * Every node is generated by a {@link Node.Visitor} method that receives the formatting state left by the previous
 * node and returns its output together with the state for the next one. States are immutable values, so a generator
 * has no mutable fields, and one instance can serve any number of threads.
 * <p>
 * Node outputs are joined with line breaks, empty outputs are dropped. Each node is generated under a {@link Trace}
 * naming it, so any diagnostic signaled along the way can be traced back to the offending node.
 *
 * @param <S> The type of the formatting state.
 */
public abstract class ScriptGenerator<S> implements Node.Visitor<S, Emission<S>> {
    /**
     * Initializes a new generator producing the format with the given user-readable name.
     */
    protected ScriptGenerator(final String formatName) {
        this.formatName = formatName;
    }

    /**
     * Generates the source text of the given script.
     * <p>
     * This method never fails. It may signal {@link UnbalancedBlockCondition} and
     * {@link UnsupportedConstructCondition}.
     */
    public final String run(final Script script) {
        try (final var trace = new Trace(() -> "Generating " + formatName + " output")) {
            trace.use();
            var state = initialState();
            final var outputs = new ArrayList<String>(script.size() + 1);
            for (int i = 0; i < script.size(); i += 1) {
                final var node = script.get(i);
                final var position = i + 1;
                try (final var nodeTrace = new Trace(() -> "Generating node #" + position + ": " + node)) {
                    nodeTrace.use();
                    final var emission = node.accept(this, state);
                    outputs.add(emission.output());
                    state = emission.state();
                }
            }
            try (final var finishTrace = new Trace("Generating the end of the script")) {
                finishTrace.use();
                outputs.add(finish(state));
            }
            return trimBlankLines(joinNonEmpty(outputs));
        }
    }

    /**
     * Returns the formatting state the first node is generated in.
     */
    protected abstract S initialState();

    /**
     * Returns the output that closes the script, given the state left by the last node.
     */
    protected String finish(final S state) {
        return "";
    }

    /**
     * Signals that the given logic node has none of its role flags set, so nothing is written for it.
     */
    protected static void reportRoleless(final Node.Logic node) {
        final var message = "Logic node with no condition, else or end flag";
        ConditionContext.signal(new UnsupportedConstructCondition(message, node));
    }

    /**
     * Joins the given lines with line breaks, skipping empty ones.
     */
    protected static String lines(final String... lines) {
        return joinNonEmpty(List.of(lines));
    }

    private static String joinNonEmpty(final List<String> outputs) {
        final var builder = new StringBuilder();
        for (final var output : outputs) {
            if (output.isEmpty()) {
                continue;
            }
            if (builder.length() != 0) {
                builder.append('\n');
            }
            builder.append(output);
        }
        return builder.toString();
    }

    // Blank lines separating blocks never pile up at either end; non-empty output ends with exactly one line break.
    private static String trimBlankLines(final String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '\n') {
            start += 1;
        }
        while (end > start && text.charAt(end - 1) == '\n') {
            end -= 1;
        }
        return (start == end) ? "" : text.substring(start, end) + '\n';
    }

    private final String formatName;
}
