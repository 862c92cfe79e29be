// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

import java.util.regex.Pattern;

/**
 * Recognition of screenplay scene headings.
 */
final class SceneHeadings {
    private SceneHeadings() {
    }

    /**
     * Returns whether the given trimmed text starts with a scene prefix ({@code INT.}, {@code EXT.}, {@code EST.},
     * {@code INT./EXT.} or {@code I/E}) followed by something.
     */
    static boolean isSceneHeading(final String text) {
        return scenePattern.matcher(text).matches();
    }

    private static final Pattern scenePattern = Pattern.compile("^(?:INT\\./EXT\\.|INT\\.|EXT\\.|EST\\.|I/E)\\s*.+$");
}
