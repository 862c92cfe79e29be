// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Implementation of the command line interface of the program.
 */
@NonNullByDefault
package fountainflow.cli;

import fountainflow.util.annotation.NonNullByDefault;
