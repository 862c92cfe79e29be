// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conversion planning and execution: choosing a parser by the input file's extension, a generator by the requested
 * target format, and the file the output is written to.
 */
@NonNullByDefault
package fountainflow.convert;

import fountainflow.util.annotation.NonNullByDefault;
