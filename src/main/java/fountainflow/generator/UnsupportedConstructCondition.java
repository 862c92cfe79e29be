// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import fountainflow.script.Node;
import fountainflow.util.condition.Condition;

/**
 * A non-fatal condition type indicating that the target format has no way to express a node faithfully, so the
 * generator wrote an approximation instead.
 * <p>
 * The typical case is a choice without a target, whose effect is given by the nodes following it: neither Twee links
 * nor Ren'Py menu items can capture those nodes from a flat script.
 */
public final class UnsupportedConstructCondition extends Condition {
    UnsupportedConstructCondition(final String message, final Node node) {
        super(message);
        this.node = node;
    }

    /**
     * Retrieves the node that couldn't be expressed.
     */
    public Node node() {
        return node;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nNode: " + node;
    }

    private final Node node;
}
