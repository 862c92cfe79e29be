// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Front ends: parsers turning FFlow, Twee and Ren'Py source text into {@link fountainflow.script.Script}s.
 * <p>
 * Parsers never fail. Every line resolves to the most specific node it matches, ultimately plain action text, and
 * lines a parser had to drop or guess about are reported as non-fatal {@link ParseWarningCondition}s.
 */
@NonNullByDefault
package fountainflow.parser;

import fountainflow.util.annotation.NonNullByDefault;
