// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util.condition;

/**
 * A functional interface representing {@link Handler} procedures.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * A handler declines a condition by returning normally. It handles it by transferring control elsewhere, usually
     * with {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
