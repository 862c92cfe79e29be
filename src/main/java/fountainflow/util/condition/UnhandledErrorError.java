// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control away from a fatal condition.
 * <p>
 * Since this represents a programming error, this class extends {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
    }
}
