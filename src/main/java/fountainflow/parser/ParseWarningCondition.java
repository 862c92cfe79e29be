// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

import fountainflow.util.condition.Condition;

/**
 * A non-fatal condition type indicating that a parser dropped a line or had to guess what it meant.
 */
public final class ParseWarningCondition extends Condition {
    ParseWarningCondition(final String message, final SourceLocation location) {
        super(message);
        this.location = location;
    }

    /**
     * Retrieves the location of the offending line.
     */
    public SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + location;
    }

    private final SourceLocation location;
}
