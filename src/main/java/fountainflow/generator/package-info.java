// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Back ends: generators turning {@link fountainflow.script.Script}s into FFlow, Twee and Ren'Py source text.
 * <p>
 * Generators are stateless singletons. The formatting state of one run is an immutable value threaded through the
 * node handlers, see {@link fountainflow.generator.ScriptGenerator}. Structural problems, such as a conditional run
 * that doesn't balance, never stop generation; they're signaled as {@link UnbalancedBlockCondition}s and
 * {@link UnsupportedConstructCondition}s.
 */
@NonNullByDefault
package fountainflow.generator;

import fountainflow.util.annotation.NonNullByDefault;
