// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

import java.util.LinkedHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import fountainflow.script.Node;
import fountainflow.script.Script;
import fountainflow.util.Trace;

/**
 * The Twee parser: turns Twee 3 source using SugarCube macros into a {@link Script}.
 * <p>
 * Passage headers become section or scene headings, the {@code StoryInit} passage becomes the frontmatter, SugarCube
 * {@code <<if>>}, {@code <<set>>} and {@code <<goto>>} macros become logic, state change and jump nodes, and every
 * link becomes a choice. Passages are not nested: the passage structure only survives as the headings.
 */
public final class TweeParser {
    private TweeParser(final String text) {
        cursor = new LineCursor(text);
    }

    /**
     * Parses the given Twee source text. This method never fails.
     */
    public static Script parse(final String text) {
        return new TweeParser(text).parse();
    }

    private Script parse() {
        try (final var trace = new Trace("Parsing Twee source")) {
            trace.use();
            while (cursor.hasNext()) {
                final var line = cursor.next().strip();
                if (line.isEmpty()) {
                    continue;
                }
                final var lineNumber = cursor.lineNumber();
                try (final var lineTrace = new Trace(() -> "Parsing line " + lineNumber)) {
                    lineTrace.use();
                    step(line);
                }
            }
            if (!storyInitVariables.isEmpty()) {
                script.prepend(new Node.Frontmatter(storyInitVariables));
            }
            return script.toScript();
        }
    }

    private void step(final String line) {
        final var header = passageHeader.matcher(line);
        if (header.matches()) {
            startPassage(header.group(1).strip());
            return;
        }
        switch (state) {
            case IN_STORY_INIT -> readStoryInitLine(line);
            case SCANNING -> scan(line);
        }
    }

    private void startPassage(final String name) {
        final var anchor = passageName(name);
        if (anchor.equals(storyInitPassage)) {
            state = State.IN_STORY_INIT;
            return;
        }
        state = State.SCANNING;
        if (SceneHeadings.isSceneHeading(anchor)) {
            script.append(new Node.SceneHeading(anchor, anchor));
        } else {
            script.append(new Node.SectionHeading(name, anchor));
        }
    }

    // Strips the optional [tags] and {metadata} blocks following a passage name.
    private static String passageName(final String header) {
        final var matcher = passageTrailer.matcher(header);
        return matcher.find() ? header.substring(0, matcher.start()).strip() : header;
    }

    private void readStoryInitLine(final String line) {
        final var matcher = setMacro.matcher(line);
        if (matcher.lookingAt()) {
            storyInitVariables.put(matcher.group(1), matcher.group(2).strip());
        } else {
            cursor.warn("Ignoring StoryInit content that isn't a <<set>> macro: " + line);
        }
    }

    private void scan(final String line) {
        Matcher matcher;
        if ((matcher = ifMacro.matcher(line)).lookingAt()) {
            script.append(Node.Logic.ifOpen(matcher.group(1).strip()));
        } else if (elseMacro.matcher(line).lookingAt()) {
            script.append(Node.Logic.orElse());
        } else if (endIfMacro.matcher(line).lookingAt()) {
            script.append(Node.Logic.end());
        } else if ((matcher = setMacro.matcher(line)).lookingAt()) {
            script.append(new Node.StateChange(matcher.group(1) + " = " + matcher.group(2).strip()));
        } else if ((matcher = bgMacro.matcher(line)).lookingAt()) {
            script.append(new Node.Asset(backgroundAsset, matcher.group(1)));
        } else if ((matcher = showMacro.matcher(line)).lookingAt()) {
            script.append(new Node.Asset(showAsset, matcher.group(1)));
        } else if ((matcher = gotoMacro.matcher(line)).lookingAt()) {
            script.append(new Node.Jump(matcher.group(1)));
        } else if ((matcher = backgroundScript.matcher(line)).find()) {
            script.append(new Node.Asset(backgroundAsset, matcher.group(1)));
        } else if ((matcher = assetComment.matcher(line)).matches()) {
            script.append(new Node.Asset(matcher.group(1), matcher.group(2)));
        } else if ((matcher = kindComment.matcher(line)).matches()) {
            script.append(new Node.Asset(matcher.group(1), matcher.group(2)));
        } else if (!readLinks(line)) {
            readText(line);
        }
    }

    private boolean readLinks(final String line) {
        final var matcher = link.matcher(line);
        if (!matcher.find()) {
            return false;
        }
        final var text = line.substring(0, matcher.start()).strip();
        do {
            script.append(linkToChoice(matcher.group(1), text));
        } while (matcher.find());
        return true;
    }

    private static Node.Choice linkToChoice(final String markup, final String text) {
        final var pipe = markup.indexOf('|');
        if (pipe >= 0) {
            return new Node.Choice(markup.substring(0, pipe), text, markup.substring(pipe + 1));
        }
        final var arrow = markup.indexOf("->");
        if (arrow >= 0) {
            return new Node.Choice(markup.substring(0, arrow), text, markup.substring(arrow + 2));
        }
        return new Node.Choice(markup, text, markup);
    }

    private void readText(final String line) {
        final var matcher = dialogue.matcher(line);
        if (matcher.matches()) {
            script.append(new Node.Dialogue(matcher.group(1).strip(), matcher.group(3).strip(), matcher.group(2)));
        } else {
            script.append(new Node.Action(line));
        }
    }

    private static final String storyInitPassage = "StoryInit";
    private static final String backgroundAsset = "BG";
    private static final String showAsset = "SHOW";

    private static final Pattern passageHeader = Pattern.compile("^::\\s*(.+)$");
    private static final Pattern passageTrailer = Pattern.compile("\\s*[\\[{]");
    private static final Pattern setMacro = Pattern.compile("^<<set\\s+\\$(\\w+)\\s*(?:to|=)\\s*(.+)>>");
    private static final Pattern ifMacro = Pattern.compile("^<<if\\s+(.+)>>");
    private static final Pattern elseMacro = Pattern.compile("^<<else>>");
    private static final Pattern endIfMacro = Pattern.compile("^(?:<<endif>>|<</if>>)");
    private static final Pattern bgMacro = Pattern.compile("^<<bg\\s+\"(.+)\">>");
    private static final Pattern showMacro = Pattern.compile("^<<show\\s+\"(.+)\">>");
    private static final Pattern gotoMacro = Pattern.compile("^<<goto\\s+\"(.+)\">>");
    private static final Pattern backgroundScript =
        Pattern.compile("^<script>.*background-image.*url\\('(.+?)\\.jpg'\\).*</script>");
    private static final Pattern assetComment = Pattern.compile("^<!--\\s*Asset:\\s*(\\w+)\\s+(.+?)\\s*-->$");
    private static final Pattern kindComment = Pattern.compile("^<!--\\s*([A-Z]+):\\s*(.+?)\\s*-->$");
    private static final Pattern link = Pattern.compile("\\[\\[(.*?)]]");
    private static final Pattern dialogue = Pattern.compile("^\\*\\*(.+?)\\*\\*\\s*(\\(.*?\\))?\\s*:\\s*(.*)$");

    private final LineCursor cursor;
    private final Script.Builder script = Script.builder();
    private final LinkedHashMap<String, String> storyInitVariables = new LinkedHashMap<>();
    private State state = State.SCANNING;

    private enum State {
        SCANNING,
        /**
         * Inside the StoryInit passage, whose {@code <<set>>} macros declare the frontmatter variables.
         */
        IN_STORY_INIT,
    }
}
