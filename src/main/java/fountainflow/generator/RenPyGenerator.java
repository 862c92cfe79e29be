// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import java.util.ArrayList;
import java.util.Locale;
import fountainflow.generator.BlockStack.Block;
import fountainflow.generator.UnbalancedBlockCondition.Reason;
import fountainflow.script.Node;
import fountainflow.script.Script;
import fountainflow.util.condition.ConditionContext;

/**
 * The Ren'Py generator: writes Ren'Py script statements, indented by four spaces per block.
 * <p>
 * Indentation follows the open blocks: the label, conditional blocks and menus. Since the block stack is an immutable
 * part of the state, a conditional end with nothing open is reported and skipped instead of dedenting past the label.
 * A menu stays open for as long as choices follow it.
 */
public final class RenPyGenerator extends ScriptGenerator<RenPyGenerator.State> {
    private RenPyGenerator() {
        super("Ren'Py");
    }

    /**
     * Generates Ren'Py source text from the given script. This method never fails.
     */
    public static String generate(final Script script) {
        return instance.run(script);
    }

    @Override
    protected State initialState() {
        return new State(BlockStack.empty(), false);
    }

    @Override
    protected String finish(final State state) {
        reportOpenBlocks(state.blocks(), Reason.UNCLOSED_AT_END);
        return "";
    }

    @Override
    public Emission<State> visitFrontmatter(final Node.Frontmatter node, final State state) {
        reportOpenBlocks(state.blocks(), Reason.UNCLOSED_AT_BOUNDARY);
        final var lines = new ArrayList<String>();
        lines.add("label " + entryLabel + ":");
        node.variables().forEach((name, value) -> lines.add(indent(1, "$ " + name + " = " + value)));
        return new Emission<>(String.join("\n", lines), new State(BlockStack.empty(), true));
    }

    @Override
    public Emission<State> visitSceneHeading(final Node.SceneHeading node, final State state) {
        return statement("# " + node.text(), state);
    }

    @Override
    public Emission<State> visitSectionHeading(final Node.SectionHeading node, final State state) {
        reportOpenBlocks(state.blocks(), Reason.UNCLOSED_AT_BOUNDARY);
        final var label = "\nlabel " + Node.SectionHeading.anchorOf(node.anchor()) + ":";
        return new Emission<>(label, new State(BlockStack.empty(), true));
    }

    @Override
    public Emission<State> visitAction(final Node.Action node, final State state) {
        return statement(quote(node.text()), state);
    }

    @Override
    public Emission<State> visitDialogue(final Node.Dialogue node, final State state) {
        final var speaker = speakerName(node.character());
        return statement(speaker.isEmpty() ? quote(node.text()) : speaker + ' ' + quote(node.text()), state);
    }

    @Override
    public Emission<State> visitAsset(final Node.Asset node, final State state) {
        final var data = node.data();
        final String statement;
        switch (node.kind().toUpperCase(Locale.ROOT)) {
            case "BG" -> statement = "scene " + data;
            case "SHOW" -> statement = "show " + data;
            case "MUSIC" -> statement = "play music " + quote(data);
            case "SOUND" -> statement = "play sound " + quote(data);
            default -> statement = "# Asset: " + node.kind() + ' ' + data;
        }
        return statement(statement, state);
    }

    @Override
    public Emission<State> visitStateChange(final Node.StateChange node, final State state) {
        return statement("$ " + node.expression(), state);
    }

    @Override
    public Emission<State> visitLogic(final Node.Logic node, final State state) {
        return switch (node.role()) {
            case IF -> openIf(node, state);
            case ELSE -> openElse(state);
            case END -> closeConditional(state);
            case NONE -> {
                reportRoleless(node);
                yield new Emission<>("", state);
            }
        };
    }

    @Override
    public Emission<State> visitDecision(final Node.Decision node, final State state) {
        final var prepared = prepare(state);
        final var inner = prepared.state();
        final var output = lines(
            prepared.output(),
            indent(inner.level(), "menu:"),
            indent(inner.level() + 1, quote(node.prompt()))
        );
        return new Emission<>(output, inner.push(Block.MENU));
    }

    @Override
    public Emission<State> visitChoice(final Node.Choice node, final State state) {
        final Emission<State> menu;
        if (state.blocks().top() == Block.MENU) {
            menu = new Emission<>("", state);
        } else {
            final var prepared = prepare(state);
            final var output = lines(prepared.output(), indent(prepared.state().level(), "menu:"));
            menu = new Emission<>(output, prepared.state().push(Block.MENU));
        }

        final var level = menu.state().level();
        final var lines = new ArrayList<String>();
        lines.add(menu.output());
        lines.add(indent(level, quote(node.label()) + ":"));
        if (!node.text().isEmpty()) {
            lines.add(indent(level + 1, quote(node.text())));
        }
        if (node.hasTarget()) {
            lines.add(indent(level + 1, "jump " + Node.SectionHeading.anchorOf(node.target())));
        } else {
            ConditionContext.signal(new UnsupportedConstructCondition(
                "Choice without a target: the nodes that follow it can't be moved into the menu item",
                node
            ));
            lines.add(indent(level + 1, "# The effect of this choice follows the menu."));
            lines.add(indent(level + 1, "pass"));
        }
        return new Emission<>(lines(lines.toArray(String[]::new)), menu.state());
    }

    @Override
    public Emission<State> visitJump(final Node.Jump node, final State state) {
        return statement("jump " + Node.SectionHeading.anchorOf(node.target()), state);
    }

    private static Emission<State> openIf(final Node.Logic node, final State state) {
        final var prepared = prepare(state);
        final var inner = prepared.state();
        final var output = lines(prepared.output(), indent(inner.level(), "if " + node.condition() + ":"));
        return new Emission<>(output, inner.push(Block.IF));
    }

    private static Emission<State> openElse(final State state) {
        final var prepared = prepare(state);
        final var inner = prepared.state();
        if (inner.blocks().top() != Block.IF) {
            ConditionContext.signal(new UnbalancedBlockCondition(Reason.UNMATCHED_ELSE));
            return prepared;
        }
        final var outer = inner.pop();
        return new Emission<>(lines(prepared.output(), indent(outer.level(), "else:")), outer.push(Block.ELSE));
    }

    private static Emission<State> closeConditional(final State state) {
        final var prepared = prepare(state);
        final var inner = prepared.state();
        final var top = inner.blocks().top();
        if (top != Block.IF && top != Block.ELSE) {
            ConditionContext.signal(new UnbalancedBlockCondition(Reason.UNMATCHED_END));
            return prepared;
        }
        return new Emission<>(prepared.output(), inner.pop());
    }

    private static Emission<State> statement(final String statement, final State state) {
        final var prepared = prepare(state);
        final var inner = prepared.state();
        return new Emission<>(lines(prepared.output(), indent(inner.level(), statement)), inner);
    }

    /**
     * Gets the state ready for a node other than a choice: closes the menu the previous choices were in, and opens the
     * entry label if no label is open yet.
     */
    private static Emission<State> prepare(final State state) {
        final var blocks = state.blocks();
        final var withoutMenu = (blocks.top() == Block.MENU) ? blocks.pop() : blocks;
        final var opening = state.inLabel() ? "" : "label " + entryLabel + ":";
        return new Emission<>(opening, new State(withoutMenu, true));
    }

    private static void reportOpenBlocks(final BlockStack blocks, final Reason reason) {
        final var open = blocks.conditionalDepth();
        if (open != 0) {
            ConditionContext.signal(new UnbalancedBlockCondition(reason, open));
        }
    }

    private static String indent(final int level, final String line) {
        return indentUnit.repeat(level) + line;
    }

    private static String quote(final String string) {
        return '"' + string.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    /**
     * Turns a character name into a Ren'Py speaker name: every word capitalized, spaces and other characters that
     * can't appear in an identifier removed. {@code DR SMITH} becomes {@code DrSmith}.
     */
    static String speakerName(final String character) {
        final var builder = new StringBuilder(character.length());
        var wordStart = true;
        for (int i = 0; i < character.length(); i += 1) {
            final var c = character.charAt(i);
            if (Character.isLetter(c)) {
                builder.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
                wordStart = false;
            } else {
                if (Character.isDigit(c) || c == '_') {
                    builder.append(c);
                }
                wordStart = true;
            }
        }
        return builder.toString();
    }

    private static final String entryLabel = "start";
    private static final String indentUnit = "    ";

    private static final RenPyGenerator instance = new RenPyGenerator();

    /**
     * The formatting state of the Ren'Py generator.
     *
     * @param blocks  The blocks open inside the current label.
     * @param inLabel Whether a label is open, so that statements are indented one level.
     */
    public record State(BlockStack blocks, boolean inLabel) {
        int level() {
            return (inLabel ? 1 : 0) + blocks.depth();
        }

        State push(final Block block) {
            return new State(blocks.push(block), inLabel);
        }

        State pop() {
            return new State(blocks.pop(), inLabel);
        }
    }
}
