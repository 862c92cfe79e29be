// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.generator;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The result of generating one node: its output text, possibly empty or spanning several lines, and the formatting
 * state the next node is generated in.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record Emission<S>(String output, S state) {
}
