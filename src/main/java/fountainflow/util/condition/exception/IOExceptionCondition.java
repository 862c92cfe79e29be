// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util.condition.exception;

import java.io.IOException;

/**
 * A condition type indicating that reading a script or writing the converted output failed.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    /**
     * Initializes a new {@code IOExceptionCondition} representing the given {@link IOException}.
     */
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
