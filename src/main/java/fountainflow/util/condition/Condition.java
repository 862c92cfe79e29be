// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that happened while converting a script that code further up the call stack may
 * care about: a line the parser had to guess about, an if/else run that doesn't balance, a file that couldn't be
 * read. Unlike exceptions, handlers run <em>before</em> the stack is unwound, so a non-fatal condition lets the
 * conversion carry on once every handler has looked at it.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message representing this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full, detailed, user-readable message representing this condition.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
