// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import fountainflow.script.Node;
import fountainflow.script.Script;
import fountainflow.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The Ren'Py parser: turns Ren'Py script statements into a {@link Script}.
 * <p>
 * Statements are read one line at a time. Indentation is only used to tell where a {@code menu:} ends; conditional
 * blocks are <em>not</em> tracked, so {@code if} and {@code else} produce opening and else nodes but no end node ever
 * follows them. Scripts parsed from Ren'Py therefore have unbalanced conditional runs whenever they contain an
 * {@code if}.
 * <p>
 * Statements with no node counterpart, such as {@code define}, {@code return} or {@code with}, are dropped with a
 * {@link ParseWarningCondition}.
 */
public final class RenPyParser {
    private RenPyParser(final String text) {
        cursor = new LineCursor(text);
    }

    /**
     * Parses the given Ren'Py source text. This method never fails.
     */
    public static Script parse(final String text) {
        return new RenPyParser(text).parse();
    }

    private Script parse() {
        try (final var trace = new Trace("Parsing Ren'Py source")) {
            trace.use();
            while (cursor.hasNext()) {
                final var rawLine = cursor.next();
                final var line = rawLine.strip();
                if (line.isEmpty()) {
                    continue;
                }
                final var lineNumber = cursor.lineNumber();
                try (final var lineTrace = new Trace(() -> "Parsing line " + lineNumber)) {
                    lineTrace.use();
                    step(line, indentationOf(rawLine));
                }
            }
            leaveMenu();
            return script.toScript();
        }
    }

    private void step(final String line, final int indentation) {
        if (state == State.MENU_OPENED && !bareString.matcher(line).matches()) {
            openMenu(defaultPrompt);
        }
        if (line.startsWith("#")) {
            readComment(line.substring(1).strip());
            return;
        }
        if (state != State.SCANNING && indentation <= menuIndentation) {
            leaveMenu();
        }

        Matcher matcher;
        if ((matcher = label.matcher(line)).lookingAt()) {
            leaveMenu();
            final var name = matcher.group(1);
            if (!name.equals(entryLabel)) {
                script.append(new Node.SectionHeading(name, name));
            }
        } else if ((matcher = assignment.matcher(line)).lookingAt()) {
            script.append(new Node.StateChange(matcher.group(1) + " = " + matcher.group(2).strip()));
        } else if ((matcher = pythonLine.matcher(line)).lookingAt()) {
            script.append(new Node.StateChange(matcher.group(1).strip()));
        } else if ((matcher = scene.matcher(line)).lookingAt()) {
            script.append(new Node.Asset("BG", matcher.group(1).strip()));
        } else if ((matcher = show.matcher(line)).lookingAt()) {
            script.append(new Node.Asset("SHOW", matcher.group(1).strip()));
        } else if ((matcher = play.matcher(line)).lookingAt()) {
            script.append(new Node.Asset(matcher.group(1).toUpperCase(Locale.ROOT), matcher.group(2)));
        } else if (menu.matcher(line).matches()) {
            leaveMenu();
            state = State.MENU_OPENED;
            menuIndentation = indentation;
        } else {
            readMenuOrStatement(line);
        }
    }

    private void readMenuOrStatement(final String line) {
        if (state == State.MENU_OPENED) {
            final var caption = bareString.matcher(line);
            if (caption.matches()) {
                openMenu(unescape(caption.group(1)));
                return;
            }
            openMenu(defaultPrompt);
        }
        if (state == State.IN_MENU) {
            if (line.endsWith(":")) {
                pendingChoiceLabel = menuItemLabel(line);
                pendingChoiceText = "";
                return;
            }
            final var choiceLabel = pendingChoiceLabel;
            if (choiceLabel != null && readChoiceBody(choiceLabel, line)) {
                return;
            }
        }
        readStatement(line);
    }

    // A bare string right under a menu item is the choice's text, the jump ends the item.
    private boolean readChoiceBody(final String choiceLabel, final String line) {
        final var text = bareString.matcher(line);
        if (text.matches() && pendingChoiceText.isEmpty()) {
            pendingChoiceText = unescape(text.group(1));
            return true;
        }
        final var matcher = jump.matcher(line);
        if (matcher.lookingAt()) {
            script.append(new Node.Choice(choiceLabel, pendingChoiceText, matcher.group(1)));
            pendingChoiceLabel = null;
            pendingChoiceText = "";
            return true;
        }
        return false;
    }

    private void readStatement(final String line) {
        Matcher matcher;
        if ((matcher = ifStatement.matcher(line)).matches()) {
            script.append(Node.Logic.ifOpen(matcher.group(1).strip()));
        } else if (elseStatement.matcher(line).matches()) {
            script.append(Node.Logic.orElse());
        } else if ((matcher = dialogue.matcher(line)).lookingAt()) {
            script.append(new Node.Dialogue(matcher.group(1), unescape(matcher.group(2))));
        } else if ((matcher = narration.matcher(line)).lookingAt()) {
            script.append(new Node.Action(unescape(matcher.group(1))));
        } else if ((matcher = jump.matcher(line)).lookingAt()) {
            script.append(new Node.Jump(matcher.group(1)));
        } else {
            cursor.warn("Ignoring unrecognized Ren'Py statement: " + line);
        }
    }

    private void readComment(final String comment) {
        if (SceneHeadings.isSceneHeading(comment)) {
            script.append(Node.SceneHeading.of(comment));
        }
    }

    // Emits the menu's decision before anything else inside the menu can produce a node.
    private void openMenu(final String prompt) {
        script.append(new Node.Decision(prompt));
        state = State.IN_MENU;
    }

    private void leaveMenu() {
        if (state == State.MENU_OPENED) {
            script.append(new Node.Decision(defaultPrompt));
        }
        state = State.SCANNING;
        pendingChoiceLabel = null;
        pendingChoiceText = "";
    }

    private static String menuItemLabel(final String line) {
        final var matcher = quotedMenuItem.matcher(line);
        if (matcher.matches()) {
            return unescape(matcher.group(1));
        }
        return stripLabelCharacters(line);
    }

    // Strips quotes, colons and spaces from both ends.
    private static String stripLabelCharacters(final String line) {
        int start = 0;
        int end = line.length();
        while (start < end && labelPadding.indexOf(line.charAt(start)) >= 0) {
            start += 1;
        }
        while (end > start && labelPadding.indexOf(line.charAt(end - 1)) >= 0) {
            end -= 1;
        }
        return line.substring(start, end);
    }

    private static String unescape(final String string) {
        if (string.indexOf('\\') < 0) {
            return string;
        }
        final var builder = new StringBuilder(string.length());
        for (int i = 0; i < string.length(); i += 1) {
            final var c = string.charAt(i);
            if (c == '\\' && i + 1 < string.length()) {
                i += 1;
                builder.append(string.charAt(i));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static int indentationOf(final String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i += 1) {
            final var c = line.charAt(i);
            if (c == ' ') {
                width += 1;
            } else if (c == '\t') {
                width += tabWidth;
            } else {
                break;
            }
        }
        return width;
    }

    private static final String entryLabel = "start";
    private static final String defaultPrompt = "Choice";
    private static final String labelPadding = "\": ";
    private static final int tabWidth = 4;

    private static final Pattern label = Pattern.compile("^label\\s+(\\w+)\\s*:");
    private static final Pattern assignment = Pattern.compile("^\\$\\s*(\\w+)\\s*=\\s*(.+)");
    private static final Pattern pythonLine = Pattern.compile("^\\$\\s*(.+)");
    private static final Pattern scene = Pattern.compile("^scene\\s+(.+)");
    private static final Pattern show = Pattern.compile("^show\\s+(.+)");
    private static final Pattern play = Pattern.compile("^play\\s+(music|sound)\\s+\"(.+)\"");
    private static final Pattern menu = Pattern.compile("^menu\\s*:$");
    private static final Pattern bareString = Pattern.compile("^\"(.*)\"$");
    private static final Pattern quotedMenuItem = Pattern.compile("^\"(.*)\"\\s*(?:if\\s+.+)?:$");
    private static final Pattern jump = Pattern.compile("^jump\\s+(\\w+)");
    private static final Pattern ifStatement = Pattern.compile("^if\\s+(.+):$");
    private static final Pattern elseStatement = Pattern.compile("^else\\s*:$");
    private static final Pattern dialogue = Pattern.compile("^(\\w+)\\s+\"(.+)\"");
    private static final Pattern narration = Pattern.compile("^\"(.+)\"");

    private final LineCursor cursor;
    private final Script.Builder script = Script.builder();
    private State state = State.SCANNING;
    private int menuIndentation = 0;
    private @Nullable String pendingChoiceLabel = null;
    private String pendingChoiceText = "";

    private enum State {
        SCANNING,
        /**
         * Right after {@code menu:}; a bare string on the next line is the menu caption.
         */
        MENU_OPENED,
        /**
         * Inside a menu: lines ending with a colon are choice labels, closed into choices by the next {@code jump}.
         * A bare string between the two is the choice text.
         */
        IN_MENU,
    }
}
