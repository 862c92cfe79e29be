// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import fountainflow.util.condition.ConditionContext;

/**
 * A forward-only cursor over the lines of a script, with one line of lookahead.
 * <p>
 * Both {@code \n} and {@code \r\n} line endings are accepted. Lines are returned as written, indentation included.
 */
final class LineCursor {
    LineCursor(final String text) {
        lines = lineBreak.split(text, -1);
    }

    boolean hasNext() {
        return index < lines.length;
    }

    /**
     * Returns the next line without consuming it.
     */
    String peek() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines left");
        }
        return lines[index];
    }

    String next() {
        final var line = peek();
        index += 1;
        return line;
    }

    /**
     * Returns the one-based number of the line most recently returned by {@link #next()}.
     */
    int lineNumber() {
        return index;
    }

    SourceLocation location() {
        return new SourceLocation(index);
    }

    /**
     * Signals a {@link ParseWarningCondition} about the line most recently returned by {@link #next()}.
     */
    void warn(final String message) {
        ConditionContext.signal(new ParseWarningCondition(message, location()));
    }

    private static final Pattern lineBreak = Pattern.compile("\r?\n");

    private final String[] lines;
    private int index = 0;
}
