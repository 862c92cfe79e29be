// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import fountainflow.generator.BlockStack.Block;
import fountainflow.generator.UnbalancedBlockCondition.Reason;
import fountainflow.script.Node;
import fountainflow.script.Script;
import fountainflow.util.condition.ConditionContext;

/**
 * The Twee generator: writes Twee 3 source using SugarCube macros.
 * <p>
 * Section headings open passages; a scene heading right after one is folded into it, any other scene heading opens a
 * passage of its own. The frontmatter becomes the {@code StoryInit} special passage, and content with no passage to
 * go into opens the {@code Start} passage.
 * <p>
 * SugarCube variables carry a {@code $} sigil that the other formats don't have, so bare identifiers in conditions and
 * state changes get one added. Conditional blocks can't span passages: blocks left open at a passage boundary or at
 * the end of the script are reported and closed.
 */
public final class TweeGenerator extends ScriptGenerator<TweeGenerator.State> {
    private TweeGenerator() {
        super("Twee");
    }

    /**
     * Generates Twee source text from the given script. This method never fails.
     */
    public static String generate(final Script script) {
        return instance.run(script);
    }

    @Override
    protected State initialState() {
        return new State(false, false, BlockStack.empty());
    }

    @Override
    protected String finish(final State state) {
        return closeBlocks(state.blocks(), Reason.UNCLOSED_AT_END);
    }

    @Override
    public Emission<State> visitFrontmatter(final Node.Frontmatter node, final State state) {
        final var lines = new ArrayList<String>();
        lines.add(closeBlocks(state.blocks(), Reason.UNCLOSED_AT_BOUNDARY));
        lines.add("\n:: " + storyInitPassage);
        node.variables().forEach((name, value) -> lines.add("<<set $" + name + " to " + value + ">>"));
        return new Emission<>(lines(lines.toArray(String[]::new)), new State(false, false, BlockStack.empty()));
    }

    @Override
    public Emission<State> visitSceneHeading(final Node.SceneHeading node, final State state) {
        final var bold = "**" + node.text() + "**";
        if (state.freshPassage()) {
            return new Emission<>(bold, new State(true, false, state.blocks()));
        }
        final var closing = closeBlocks(state.blocks(), Reason.UNCLOSED_AT_BOUNDARY);
        final var header = "\n:: " + Node.SceneHeading.identifierOf(node.text());
        return new Emission<>(lines(closing, header, bold), new State(true, false, BlockStack.empty()));
    }

    @Override
    public Emission<State> visitSectionHeading(final Node.SectionHeading node, final State state) {
        final var closing = closeBlocks(state.blocks(), Reason.UNCLOSED_AT_BOUNDARY);
        return new Emission<>(lines(closing, "\n:: " + node.anchor()), new State(true, true, BlockStack.empty()));
    }

    @Override
    public Emission<State> visitAction(final Node.Action node, final State state) {
        return content(node.text(), state, state.blocks());
    }

    @Override
    public Emission<State> visitDialogue(final Node.Dialogue node, final State state) {
        final var parenthetical = node.parenthetical();
        final var speaker = "**" + node.character() + "**" + ((parenthetical != null) ? " " + parenthetical : "");
        return content(speaker + ": " + node.text(), state, state.blocks());
    }

    @Override
    public Emission<State> visitAsset(final Node.Asset node, final State state) {
        final String text;
        switch (node.kind().toUpperCase(Locale.ROOT)) {
            case "BG" -> text = "<script>$(\"body\").css(\"background-image\", \"url('" + node.data()
                + ".jpg')\");</script>";
            case "SHOW" -> text = "<!-- SHOW: " + node.data() + " -->";
            default -> text = "<!-- Asset: " + node.kind() + ' ' + node.data() + " -->";
        }
        return content(text, state, state.blocks());
    }

    @Override
    public Emission<State> visitStateChange(final Node.StateChange node, final State state) {
        final var assignment = simpleAssignment.matcher(node.expression());
        final var macro = assignment.matches()
            ? "<<set $" + assignment.group(1) + " to " + addSigils(assignment.group(2)) + ">>"
            : "<<set " + addSigils(node.expression()) + ">>";
        return content(macro, state, state.blocks());
    }

    @Override
    public Emission<State> visitLogic(final Node.Logic node, final State state) {
        final var blocks = state.blocks();
        final var top = blocks.top();
        return switch (node.role()) {
            case IF -> content("<<if " + addSigils(node.condition()) + ">>", state, blocks.push(Block.IF));
            case ELSE -> {
                if (top != Block.IF) {
                    ConditionContext.signal(new UnbalancedBlockCondition(Reason.UNMATCHED_ELSE));
                    yield content("<<else>>", state, blocks);
                }
                yield content("<<else>>", state, blocks.pop().push(Block.ELSE));
            }
            case END -> {
                if (top == null) {
                    ConditionContext.signal(new UnbalancedBlockCondition(Reason.UNMATCHED_END));
                    yield content("<<endif>>", state, blocks);
                }
                yield content("<<endif>>", state, blocks.pop());
            }
            case NONE -> {
                reportRoleless(node);
                yield new Emission<>("", new State(state.passageOpen(), false, blocks));
            }
        };
    }

    @Override
    public Emission<State> visitDecision(final Node.Decision node, final State state) {
        return content("\n" + node.prompt(), state, state.blocks());
    }

    @Override
    public Emission<State> visitChoice(final Node.Choice node, final State state) {
        final var prefix = node.text().isEmpty() ? "" : node.text() + ' ';
        if (node.hasTarget()) {
            return content(prefix + "[[" + node.label() + '|' + node.target() + "]]", state, state.blocks());
        }
        ConditionContext.signal(new UnsupportedConstructCondition(
            "Choice without a target: the nodes that follow it can't be attached to a Twee link",
            node
        ));
        final var warning =
            "<!-- Choice '" + node.label() + "' has inline logic, which a flat passage can't express -->";
        final var link = prefix + "[[" + node.label() + '|' + placeholderTarget + "]]";
        return content(lines(warning, link), state, state.blocks());
    }

    @Override
    public Emission<State> visitJump(final Node.Jump node, final State state) {
        return content("<<goto \"" + node.target() + "\">>", state, state.blocks());
    }

    /**
     * Prefixes every bare identifier in the given expression with the {@code $} sigil.
     * <p>
     * Identifiers already carrying a sigil, property names after a dot, the contents of string literals, number
     * literals and the keywords {@code true}, {@code false}, {@code and}, {@code or} and {@code not} are left alone.
     */
    static String addSigils(final String expression) {
        final var builder = new StringBuilder(expression.length() + 8);
        int i = 0;
        while (i < expression.length()) {
            final var c = expression.charAt(i);
            if (c == '"' || c == '\'') {
                final var end = stringLiteralEnd(expression, i);
                builder.append(expression, i, end);
                i = end;
            } else if (Character.isJavaIdentifierStart(c) && c != '$') {
                final var end = identifierEnd(expression, i);
                final var token = expression.substring(i, end);
                final var previous = (i == 0) ? ' ' : expression.charAt(i - 1);
                if (previous != '$' && previous != '.' && !keywords.contains(token)) {
                    builder.append('$');
                }
                builder.append(token);
                i = end;
            } else if (Character.isDigit(c)) {
                final var end = identifierEnd(expression, i);
                builder.append(expression, i, end);
                i = end;
            } else {
                builder.append(c);
                i += 1;
            }
        }
        return builder.toString();
    }

    private static int stringLiteralEnd(final String expression, final int start) {
        final var quote = expression.charAt(start);
        int i = start + 1;
        while (i < expression.length()) {
            final var c = expression.charAt(i);
            i += 1;
            if (c == '\\') {
                i += 1;
            } else if (c == quote) {
                break;
            }
        }
        return Math.min(i, expression.length());
    }

    private static int identifierEnd(final String expression, final int start) {
        int i = start + 1;
        while (i < expression.length() && Character.isJavaIdentifierPart(expression.charAt(i))
            && expression.charAt(i) != '$') {
            i += 1;
        }
        return i;
    }

    private static Emission<State> content(final String text, final State state, final BlockStack blocks) {
        final var opening = state.passageOpen() ? "" : "\n:: " + startPassage;
        return new Emission<>(lines(opening, text), new State(true, false, blocks));
    }

    // SugarCube can't carry a block over to another passage, so the open ones are closed where they stand.
    private static String closeBlocks(final BlockStack blocks, final Reason reason) {
        final var open = blocks.conditionalDepth();
        if (open == 0) {
            return "";
        }
        ConditionContext.signal(new UnbalancedBlockCondition(reason, open));
        return String.join("\n", Collections.nCopies(open, "<<endif>>"));
    }

    private static final String storyInitPassage = "StoryInit";
    private static final String startPassage = "Start";
    private static final String placeholderTarget = "NEXT_STEP";
    private static final Set<String> keywords = Set.of("true", "false", "and", "or", "not");
    private static final Pattern simpleAssignment = Pattern.compile("^\\$?(\\w+)\\s*=(?!=)\\s*(.+)$");

    private static final TweeGenerator instance = new TweeGenerator();

    /**
     * The formatting state of the Twee generator.
     *
     * @param passageOpen  Whether content can go into the current passage. {@code StoryInit} doesn't count.
     * @param freshPassage Whether the previous node opened a passage from a section heading and nothing was written
     *                     into it yet.
     * @param blocks       The conditional blocks open in the current passage.
     */
    public record State(boolean passageOpen, boolean freshPassage, BlockStack blocks) {
    }
}
