// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

/**
 * The position of a line within script source text.
 *
 * @param lineNumber The one-based line number.
 */
public record SourceLocation(int lineNumber) {
    @Override
    public String toString() {
        return "In line " + lineNumber;
    }
}
