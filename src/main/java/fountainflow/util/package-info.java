// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the whole converter.
 */
@NonNullByDefault
package fountainflow.util;

import fountainflow.util.annotation.NonNullByDefault;
