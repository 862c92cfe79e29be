// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The intermediate representation shared by every parser and generator: a flat, immutable sequence of narrative
 * nodes.
 */
@NonNullByDefault
package fountainflow.script;

import fountainflow.util.annotation.NonNullByDefault;
