// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable stack of the blocks open at some point of the output, innermost on top.
 * <p>
 * Pushing and popping return new stacks and leave the original untouched, so a stack can be part of a generator's
 * state value. Popping an empty stack is a programming error: generators check {@link #top()} first and report
 * unbalanced input instead.
 */
public final class BlockStack {
    private BlockStack(final @Nullable Block top, final @Nullable BlockStack rest, final int depth) {
        this.top = top;
        this.rest = rest;
        this.depth = depth;
    }

    public static BlockStack empty() {
        return empty;
    }

    /**
     * Returns a stack with the given block opened on top of this one.
     */
    public BlockStack push(final Block block) {
        return new BlockStack(block, this, depth + 1);
    }

    /**
     * Returns this stack without its innermost block.
     *
     * @throws IllegalStateException if the stack is empty.
     */
    public BlockStack pop() {
        if (rest == null) {
            throw new IllegalStateException("No open block to close");
        }
        return rest;
    }

    /**
     * Returns the innermost open block, or {@code null} if there is none.
     */
    public @Nullable Block top() {
        return top;
    }

    public boolean isEmpty() {
        return rest == null;
    }

    /**
     * Returns the number of open blocks.
     */
    public int depth() {
        return depth;
    }

    /**
     * Returns the number of open conditional blocks, i.e. {@link Block#IF} and {@link Block#ELSE} ones.
     */
    public int conditionalDepth() {
        int count = 0;
        for (var stack = this; stack.rest != null; stack = stack.rest) {
            if (stack.top != Block.MENU) {
                count += 1;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder("]");
        for (var stack = this; stack.rest != null; stack = stack.rest) {
            builder.insert(0, stack.top);
            if (stack.rest.rest != null) {
                builder.insert(0, ", ");
            }
        }
        return builder.insert(0, '[').toString();
    }

    private static final BlockStack empty = new BlockStack(null, null, 0);

    private final @Nullable Block top;
    private final @Nullable BlockStack rest;
    private final int depth;

    /**
     * The kinds of blocks.
     */
    public enum Block {
        IF,
        ELSE,
        MENU,
    }
}
