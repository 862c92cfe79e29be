// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.script;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable, ordered sequence of {@link Node}s: the parsed form of a script.
 * <p>
 * Order is document order, which is also execution order. Scripts are built once by a parser through a
 * {@link Builder} and never modified afterwards, so one script can be handed to any number of generators, on any
 * number of threads.
 */
public final class Script implements Iterable<Node> {
    private Script(final List<Node> nodes) {
        this.nodes = nodes;
    }

    /**
     * Returns a script consisting of the given nodes, in order.
     */
    public static Script of(final Node... nodes) {
        return new Script(List.of(nodes));
    }

    /**
     * Returns a script consisting of the nodes of the given list, in order.
     */
    public static Script copyOf(final List<? extends Node> nodes) {
        return new Script(List.copyOf(nodes));
    }

    /**
     * Returns a new, empty script builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Returns the node at the given position.
     *
     * @throws IndexOutOfBoundsException if the index is out of range.
     */
    public Node get(final int index) {
        return nodes.get(index);
    }

    /**
     * Returns an unmodifiable list view of the nodes.
     */
    public List<Node> nodes() {
        return nodes;
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return this == other || (other instanceof final Script script && nodes.equals(script.nodes));
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return nodes.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    private final List<Node> nodes;

    /**
     * A builder of {@link Script}s. Builders are not thread-safe.
     */
    public static final class Builder {
        private Builder() {
        }

        /**
         * Appends the given node at the end of the script being built.
         */
        public Builder append(final Node node) {
            nodes.add(node);
            return this;
        }

        /**
         * Inserts the given node at the start of the script being built.
         */
        public Builder prepend(final Node node) {
            nodes.add(0, node);
            return this;
        }

        /**
         * Returns the number of nodes appended so far.
         */
        public int size() {
            return nodes.size();
        }

        /**
         * Returns a script containing the nodes appended so far. The builder remains usable.
         */
        public Script toScript() {
            return new Script(List.copyOf(nodes));
        }

        private final ArrayList<Node> nodes = new ArrayList<>();
    }
}
