// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import java.util.ArrayList;
import java.util.Locale;
import java.util.regex.Pattern;
import fountainflow.script.Node;
import fountainflow.script.Script;

/**
 * The FFlow generator: the direct inverse of {@link fountainflow.parser.FFlowParser}.
 * <p>
 * Headings, dialogue and decisions are set apart by blank lines, and character names are upper-cased, so that parsing
 * the output again yields the same sequence of node types. Anchors and targets only allow word characters in FFlow, so
 * both go through {@link Node.SectionHeading#anchorOf(String)} and links keep pointing at their sections.
 */
public final class FFlowGenerator extends ScriptGenerator<FFlowGenerator.Spacing> {
    private FFlowGenerator() {
        super("FFlow");
    }

    /**
     * Generates FFlow source text from the given script. This method never fails.
     */
    public static String generate(final Script script) {
        return instance.run(script);
    }

    @Override
    protected Spacing initialState() {
        return Spacing.START;
    }

    @Override
    public Emission<Spacing> visitFrontmatter(final Node.Frontmatter node, final Spacing state) {
        final var lines = new ArrayList<String>();
        node.variables().forEach((name, value) -> lines.add("$ " + name + ": " + value));
        if (lines.isEmpty()) {
            lines.add("$");
        }
        lines.add(frontmatterTerminator);
        return block(String.join("\n", lines), state);
    }

    @Override
    public Emission<Spacing> visitSceneHeading(final Node.SceneHeading node, final Spacing state) {
        return block(node.text(), state);
    }

    @Override
    public Emission<Spacing> visitSectionHeading(final Node.SectionHeading node, final Spacing state) {
        return block("# " + Node.SectionHeading.anchorOf(node.anchor()), state);
    }

    @Override
    public Emission<Spacing> visitAction(final Node.Action node, final Spacing state) {
        // An uppercase line followed by text would read back as a character cue.
        if (characterCue.matcher(node.text()).matches()) {
            return new Emission<>(node.text() + '\n', Spacing.AFTER_BLANK);
        }
        return line(node.text());
    }

    @Override
    public Emission<Spacing> visitDialogue(final Node.Dialogue node, final Spacing state) {
        final var parenthetical = node.parenthetical();
        return block(
            lines(node.character().toUpperCase(Locale.ROOT), (parenthetical != null) ? parenthetical : "", node.text()),
            state
        );
    }

    @Override
    public Emission<Spacing> visitAsset(final Node.Asset node, final Spacing state) {
        return line("! " + node.kind() + ": " + node.data());
    }

    @Override
    public Emission<Spacing> visitStateChange(final Node.StateChange node, final Spacing state) {
        return line("~ " + node.expression());
    }

    @Override
    public Emission<Spacing> visitLogic(final Node.Logic node, final Spacing state) {
        return switch (node.role()) {
            case IF -> line("(IF: " + node.condition() + ")");
            case ELSE -> line("(ELSE)");
            case END -> line("(END)");
            case NONE -> {
                reportRoleless(node);
                yield new Emission<>("", state);
            }
        };
    }

    @Override
    public Emission<Spacing> visitDecision(final Node.Decision node, final Spacing state) {
        return block("? " + node.prompt(), state);
    }

    @Override
    public Emission<Spacing> visitChoice(final Node.Choice node, final Spacing state) {
        final var builder = new StringBuilder("+ [").append(node.label()).append(']');
        if (!node.text().isEmpty()) {
            builder.append(' ').append(node.text());
        }
        if (node.hasTarget()) {
            builder.append(" -> #").append(Node.SectionHeading.anchorOf(node.target()));
        }
        return line(builder.toString());
    }

    @Override
    public Emission<Spacing> visitJump(final Node.Jump node, final Spacing state) {
        return line("-> #" + Node.SectionHeading.anchorOf(node.target()));
    }

    private static Emission<Spacing> block(final String text, final Spacing state) {
        final var separator = (state == Spacing.AFTER_TEXT) ? "\n" : "";
        return new Emission<>(separator + text + '\n', Spacing.AFTER_BLANK);
    }

    private static Emission<Spacing> line(final String text) {
        return new Emission<>(text, Spacing.AFTER_TEXT);
    }

    private static final String frontmatterTerminator = "===";
    private static final Pattern characterCue = Pattern.compile("^[A-Z0-9 ]*[A-Z0-9]+(?:\\s*\\(.*\\))?$");

    private static final FFlowGenerator instance = new FFlowGenerator();

    /**
     * What the output written so far ends with, which decides whether a block needs a blank line in front of it.
     */
    public enum Spacing {
        START,
        AFTER_BLANK,
        AFTER_TEXT,
    }
}
