// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.convert;

import java.nio.file.Path;
import fountainflow.util.condition.Condition;

/**
 * A fatal condition type indicating that the input file of a conversion doesn't exist.
 */
public final class InputNotFoundCondition extends Condition {
    InputNotFoundCondition(final Path path) {
        super("File '" + path + "' not found");
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nAbsolute path: " + path.toAbsolutePath();
    }

    private final Path path;
}
