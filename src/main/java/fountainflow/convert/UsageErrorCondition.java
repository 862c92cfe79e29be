// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.convert;

import fountainflow.util.condition.Condition;

/**
 * A fatal condition type indicating that the conversion was requested in a way that can't be carried out: an unknown
 * input format, a missing target format, malformed command line arguments.
 */
public final class UsageErrorCondition extends Condition {
    /**
     * Initializes a new {@code UsageErrorCondition} with the given user-readable message.
     */
    public UsageErrorCondition(final String message) {
        super(message);
    }
}
