// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base interface for narrative nodes.
 * <p>
 * Nodes are guaranteed to be immutable. The set of node types is closed: code that needs to treat every kind of node
 * differently implements {@link Visitor}, so that adding a node type fails to compile until every parser and generator
 * knows about it.
 * <p>
 * There are no container nodes. Conditional blocks and choice menus are flat runs of marker nodes ({@link Logic},
 * {@link Decision}, {@link Choice}) in document order.
 */
public sealed interface Node {
    /**
     * Dispatches to the {@code visitor} method corresponding to the type of this node, passing {@code context} along.
     */
    <C, R> R accept(Visitor<C, R> visitor, C context);

    /**
     * Variables declared at the start of a script, with their initial values.
     *
     * @param variables Variable names mapped to their initial value expressions, in declaration order.
     */
    record Frontmatter(Map<String, String> variables) implements Node {
        public Frontmatter {
            variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }

        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitFrontmatter(this, context);
        }
    }

    /**
     * A screenplay scene marker, such as {@code INT. BAR - NIGHT}.
     *
     * @param identifier An identifier usable as a passage or label name.
     * @param text       The full heading text.
     */
    record SceneHeading(String identifier, String text) implements Node {
        /**
         * Returns a scene heading with the given text and an identifier derived from it by
         * {@link #identifierOf(String)}.
         */
        public static SceneHeading of(final String text) {
            return new SceneHeading(identifierOf(text), text);
        }

        /**
         * Derives an identifier from scene heading text: spaces become underscores, periods are dropped.
         * {@code INT. ROOM} becomes {@code INT_ROOM}.
         */
        public static String identifierOf(final String text) {
            return text.strip().replace(' ', '_').replace(".", "");
        }

        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitSceneHeading(this, context);
        }
    }

    /**
     * A named target for jumps and links.
     *
     * @param text   The heading as displayed.
     * @param anchor The identifier jumps and choices refer to.
     */
    record SectionHeading(String text, String anchor) implements Node {
        /**
         * Derives an anchor usable in every format from a passage or section name: runs of whitespace become a single
         * underscore, anything but ASCII letters, digits and underscores is dropped. {@code Dark Street} becomes
         * {@code Dark_Street}; a name that is already an identifier is returned unchanged.
         */
        public static String anchorOf(final String name) {
            final var builder = new StringBuilder(name.length());
            var pendingSeparator = false;
            for (final var c : name.strip().toCharArray()) {
                if (Character.isWhitespace(c)) {
                    pendingSeparator = true;
                } else if (c < 0x80 && (Character.isLetterOrDigit(c) || c == '_')) {
                    if (pendingSeparator && builder.length() != 0) {
                        builder.append('_');
                    }
                    builder.append(c);
                    pendingSeparator = false;
                }
            }
            return (builder.length() == 0) ? "_" : builder.toString();
        }

        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitSectionHeading(this, context);
        }
    }

    /**
     * A line of descriptive prose.
     */
    record Action(String text) implements Node {
        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitAction(this, context);
        }
    }

    /**
     * One line of spoken dialogue.
     *
     * @param character     The speaking character, as written in the source.
     * @param text          What is said, with source line breaks collapsed into single spaces.
     * @param parenthetical The delivery note, parentheses included, or {@code null} if there is none.
     */
    record Dialogue(String character, String text, @Nullable String parenthetical) implements Node {
        public Dialogue(final String character, final String text) {
            this(character, text, null);
        }

        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitDialogue(this, context);
        }
    }

    /**
     * A media directive.
     *
     * @param kind A free-form tag such as {@code BG}, {@code SHOW}, {@code MUSIC} or {@code SOUND}.
     * @param data The asset reference, uninterpreted.
     */
    record Asset(String kind, String data) implements Node {
        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitAsset(this, context);
        }
    }

    /**
     * A variable mutation. The expression is kept as written, it's never parsed.
     */
    record StateChange(String expression) implements Node {
        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitStateChange(this, context);
        }
    }

    /**
     * One edge of a conditional run: the opening condition, the else branch, or the end of the run.
     * <p>
     * Exactly one of the three is expected to be set; use the factory methods to get that right. Nothing guarantees
     * that a script's runs are balanced.
     *
     * @param condition The condition of an opening node, {@code null} otherwise.
     * @param isElse    Whether this node starts the else branch.
     * @param isEnd     Whether this node closes the run.
     */
    record Logic(@Nullable String condition, boolean isElse, boolean isEnd) implements Node {
        public static Logic ifOpen(final String condition) {
            return new Logic(condition, false, false);
        }

        public static Logic orElse() {
            return new Logic(null, true, false);
        }

        public static Logic end() {
            return new Logic(null, false, true);
        }

        /**
         * Returns the role this node plays in its conditional run.
         */
        public Role role() {
            if (condition != null) {
                return Role.IF;
            } else if (isElse) {
                return Role.ELSE;
            } else if (isEnd) {
                return Role.END;
            } else {
                return Role.NONE;
            }
        }

        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitLogic(this, context);
        }

        /**
         * The role of a {@link Logic} node. {@code NONE} only arises from hand-built nodes with no flag set.
         */
        public enum Role {
            IF,
            ELSE,
            END,
            NONE,
        }
    }

    /**
     * Opens a choice menu. The {@link Choice} nodes that follow belong to it.
     */
    record Decision(String prompt) implements Node {
        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitDecision(this, context);
        }
    }

    /**
     * One selectable branch of a choice menu.
     *
     * @param label      The short label of the choice.
     * @param text       Additional text shown with the choice, possibly empty.
     * @param target     The anchor the choice leads to. Empty when the choice's effect is given by the nodes that
     *                   follow it rather than by a jump.
     * @param conditions Reserved for choice guards; always empty at the moment.
     */
    record Choice(String label, String text, String target, List<String> conditions) implements Node {
        public Choice {
            conditions = List.copyOf(conditions);
        }

        public Choice(final String label, final String text, final String target) {
            this(label, text, target, List.of());
        }

        /**
         * Returns whether this choice leads directly to an anchor.
         */
        public boolean hasTarget() {
            return !target.isEmpty();
        }

        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitChoice(this, context);
        }
    }

    /**
     * An unconditional transfer to an anchor.
     */
    record Jump(String target) implements Node {
        @Override
        public <C, R> R accept(final Visitor<C, R> visitor, final C context) {
            return visitor.visitJump(this, context);
        }
    }

    /**
     * Exhaustive dispatch over the node types, threading a context value through.
     *
     * @param <C> The type of the context passed to each method.
     * @param <R> The result type.
     */
    interface Visitor<C, R> {
        R visitFrontmatter(Frontmatter node, C context);

        R visitSceneHeading(SceneHeading node, C context);

        R visitSectionHeading(SectionHeading node, C context);

        R visitAction(Action node, C context);

        R visitDialogue(Dialogue node, C context);

        R visitAsset(Asset node, C context);

        R visitStateChange(StateChange node, C context);

        R visitLogic(Logic node, C context);

        R visitDecision(Decision node, C context);

        R visitChoice(Choice node, C context);

        R visitJump(Jump node, C context);
    }
}
