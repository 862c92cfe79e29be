// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conditions wrapping Java exceptions.
 */
@NonNullByDefault
package fountainflow.util.condition.exception;

import fountainflow.util.annotation.NonNullByDefault;
