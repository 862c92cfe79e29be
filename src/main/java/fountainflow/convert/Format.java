// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.convert;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import fountainflow.generator.FFlowGenerator;
import fountainflow.generator.RenPyGenerator;
import fountainflow.generator.TweeGenerator;
import fountainflow.parser.FFlowParser;
import fountainflow.parser.RenPyParser;
import fountainflow.parser.TweeParser;
import fountainflow.script.Script;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The supported script formats, each with its file extensions, parser and generator.
 */
public enum Format {
    FFLOW("fflow", "FFlow", List.of(".fflow"), FFlowParser::parse, FFlowGenerator::generate),
    TWEE("twee", "Twee", List.of(".twee", ".tw"), TweeParser::parse, TweeGenerator::generate),
    RENPY("renpy", "Ren'Py", List.of(".rpy"), RenPyParser::parse, RenPyGenerator::generate);

    Format(
        final String commandLineName,
        final String displayName,
        final List<String> extensions,
        final Function<String, Script> parser,
        final Function<Script, String> generator
    ) {
        this.commandLineName = commandLineName;
        this.displayName = displayName;
        this.extensions = extensions;
        this.parser = parser;
        this.generator = generator;
    }

    /**
     * Returns the format with the given command line name, such as {@code renpy}, or {@code null} if there is none.
     */
    public static @Nullable Format fromCommandLineName(final String name) {
        for (final var format : values()) {
            if (format.commandLineName.equals(name)) {
                return format;
            }
        }
        return null;
    }

    /**
     * Returns the format of the given file judging by its extension, ignoring case, or {@code null} if the extension
     * isn't known.
     */
    public static @Nullable Format ofPath(final Path path) {
        final var extension = extensionOf(path);
        for (final var format : values()) {
            if (format.extensions.contains(extension)) {
                return format;
            }
        }
        return null;
    }

    /**
     * Returns the lower-cased extension of the given file, dot included, or an empty string if it has none.
     */
    static String extensionOf(final Path path) {
        final var fileName = String.valueOf(path.getFileName());
        final var dot = fileName.lastIndexOf('.');
        return (dot <= 0) ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the name of the given file without its extension.
     */
    static String baseNameOf(final Path path) {
        final var fileName = String.valueOf(path.getFileName());
        final var dot = fileName.lastIndexOf('.');
        return (dot <= 0) ? fileName : fileName.substring(0, dot);
    }

    /**
     * Parses source text in this format. This method never fails.
     */
    public Script parse(final String text) {
        return parser.apply(text);
    }

    /**
     * Generates source text in this format. This method never fails.
     */
    public String generate(final Script script) {
        return generator.apply(script);
    }

    public String commandLineName() {
        return commandLineName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns the extension given to files generated in this format.
     */
    public String outputExtension() {
        return extensions.get(0);
    }

    private final String commandLineName;
    private final String displayName;
    private final List<String> extensions;
    private final Function<String, Script> parser;
    private final Function<Script, String> generator;
}
