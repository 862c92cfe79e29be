// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import fountainflow.util.condition.Condition;

/**
 * A non-fatal condition type indicating that the conditional runs of a script don't balance: an else or end node
 * with no open conditional block, or blocks still open where the output format forces them closed.
 */
public final class UnbalancedBlockCondition extends Condition {
    UnbalancedBlockCondition(final Reason reason, final int openBlocks) {
        super(reason.message);
        this.reason = reason;
        this.openBlocks = openBlocks;
    }

    UnbalancedBlockCondition(final Reason reason) {
        this(reason, 0);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Retrieves the number of conditional blocks that were left open, zero for unmatched else and end nodes.
     */
    public int openBlocks() {
        return openBlocks;
    }

    @Override
    public String detailedMessage() {
        return (openBlocks == 0) ? message() : message() + "\nOpen conditional blocks: " + openBlocks;
    }

    private final Reason reason;
    private final int openBlocks;

    /**
     * The ways a conditional run can fail to balance.
     */
    public enum Reason {
        UNMATCHED_ELSE("Else branch without an open conditional block"),
        UNMATCHED_END("End of conditional block without an open conditional block"),
        UNCLOSED_AT_BOUNDARY("Conditional block left open where a new passage or label starts"),
        UNCLOSED_AT_END("Conditional block left open at the end of the script");

        Reason(final String message) {
            this.message = message;
        }

        private final String message;
    }
}
