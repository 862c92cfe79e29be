// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * The converter core only ever signals non-fatal conditions, so it never fails; the command-line driver installs
 * the handler that prints them and the restart that fatal driver errors unwind to.
 */
@NonNullByDefault
package fountainflow.util.condition;

import fountainflow.util.annotation.NonNullByDefault;
