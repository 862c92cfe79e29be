// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import fountainflow.script.Node;
import fountainflow.script.Script;
import fountainflow.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The FFlow parser: turns Fountain-style screenplay markup with flow extensions into a {@link Script}.
 * <p>
 * Each line is classified by the first rule it matches, in this order: frontmatter variable ({@code $ NAME: value},
 * only inside the leading block closed by {@code ===}), asset ({@code ! KIND: data}), state change
 * ({@code ~ expression}), decision ({@code ? prompt}), choice ({@code + [label] text -> #target}), jump
 * ({@code -> #target}), conditional ({@code (IF: condition)}, {@code (ELSE)}, {@code (END)}), section heading
 * ({@code # ANCHOR}), scene heading ({@code INT.}, {@code EXT.} and friends), character cue, and finally action.
 * <p>
 * A character cue is an all-uppercase line immediately followed by a non-blank line. The cue, an optional
 * parenthetical right after it, and every non-blank line up to the next blank line collapse into one
 * {@link Node.Dialogue}.
 */
public final class FFlowParser {
    private FFlowParser(final String text) {
        cursor = new LineCursor(text);
    }

    /**
     * Parses the given FFlow source text. This method never fails.
     */
    public static Script parse(final String text) {
        return new FFlowParser(text).parse();
    }

    private Script parse() {
        try (final var trace = new Trace("Parsing FFlow source")) {
            trace.use();
            while (cursor.hasNext()) {
                final var line = cursor.next().strip();
                final var lineNumber = cursor.lineNumber();
                try (final var lineTrace = new Trace(() -> "Parsing line " + lineNumber)) {
                    lineTrace.use();
                    step(line);
                }
            }
            finish();
            return script.toScript();
        }
    }

    private void step(final String line) {
        switch (state) {
            case START -> start(line);
            case IN_FRONTMATTER -> continueFrontmatter(line);
            case SCANNING -> scan(line);
            case IN_DIALOGUE -> continueDialogue(line);
        }
    }

    private void finish() {
        switch (state) {
            case IN_FRONTMATTER -> {
                cursor.warn("Frontmatter block not terminated with ===, closing it at end of input");
                emitFrontmatter();
            }
            case IN_DIALOGUE -> emitDialogue();
            case START, SCANNING -> {
            }
        }
    }

    private void start(final String line) {
        if (line.isEmpty()) {
            return;
        }
        if (line.startsWith("$")) {
            state = State.IN_FRONTMATTER;
            readFrontmatterVariable(line);
        } else {
            state = State.SCANNING;
            scan(line);
        }
    }

    private void continueFrontmatter(final String line) {
        if (line.isEmpty()) {
            return;
        }
        if (line.equals(frontmatterTerminator)) {
            emitFrontmatter();
            state = State.SCANNING;
        } else if (line.startsWith("$")) {
            readFrontmatterVariable(line);
        } else {
            cursor.warn("Frontmatter block not terminated with ===, closing it before this line");
            emitFrontmatter();
            state = State.SCANNING;
            scan(line);
        }
    }

    private void readFrontmatterVariable(final String line) {
        final var matcher = frontmatterVariable.matcher(line);
        if (matcher.matches()) {
            frontmatter.put(matcher.group(1), matcher.group(2));
        }
    }

    private void emitFrontmatter() {
        script.append(new Node.Frontmatter(frontmatter));
    }

    private void scan(final String line) {
        if (line.isEmpty()) {
            return;
        }
        final var node = classify(line);
        if (node != null) {
            script.append(node);
        } else if (isCharacterCue(line)) {
            startDialogue(line);
        } else {
            script.append(new Node.Action(line));
        }
    }

    // Returns null for lines that are either a character cue or plain action, which need lookahead to tell apart.
    private static @Nullable Node classify(final String line) {
        Matcher matcher;
        if ((matcher = asset.matcher(line)).lookingAt()) {
            return new Node.Asset(matcher.group(1), matcher.group(2));
        } else if ((matcher = stateChange.matcher(line)).lookingAt()) {
            return new Node.StateChange(matcher.group(1));
        } else if ((matcher = decision.matcher(line)).lookingAt()) {
            return new Node.Decision(matcher.group(1));
        } else if ((matcher = choice.matcher(line)).matches()) {
            final var target = matcher.group(3);
            return new Node.Choice(matcher.group(1), matcher.group(2), (target != null) ? target : "");
        } else if ((matcher = jump.matcher(line)).lookingAt()) {
            return new Node.Jump(matcher.group(1));
        } else if ((matcher = logicIf.matcher(line)).lookingAt()) {
            return Node.Logic.ifOpen(matcher.group(1));
        } else if (logicElse.matcher(line).lookingAt()) {
            return Node.Logic.orElse();
        } else if (logicEnd.matcher(line).lookingAt()) {
            return Node.Logic.end();
        } else if ((matcher = section.matcher(line)).lookingAt()) {
            return new Node.SectionHeading((matcher.group(1) + matcher.group(2)).strip(), matcher.group(1));
        } else if (SceneHeadings.isSceneHeading(line)) {
            return Node.SceneHeading.of(line);
        } else {
            return null;
        }
    }

    private boolean isCharacterCue(final String line) {
        return characterCue.matcher(line).matches() && cursor.hasNext() && !cursor.peek().isBlank();
    }

    private void startDialogue(final String cue) {
        character = cue;
        parenthetical = null;
        expectingParenthetical = true;
        dialogueLines.clear();
        state = State.IN_DIALOGUE;
    }

    private void continueDialogue(final String line) {
        if (line.isEmpty()) {
            emitDialogue();
            state = State.SCANNING;
            return;
        }
        if (expectingParenthetical && parentheticalLine.matcher(line).matches()) {
            parenthetical = line;
        } else {
            dialogueLines.add(line);
        }
        expectingParenthetical = false;
    }

    private void emitDialogue() {
        script.append(new Node.Dialogue(character, String.join(" ", dialogueLines), parenthetical));
    }

    private static final String frontmatterTerminator = "===";
    private static final Pattern frontmatterVariable = Pattern.compile("^\\$\\s*([^:]*?)\\s*:\\s*(.*)$");
    private static final Pattern asset = Pattern.compile("^!\\s*(\\w+):\\s*(.+)");
    private static final Pattern stateChange = Pattern.compile("^~\\s*(.+)");
    private static final Pattern decision = Pattern.compile("^\\?\\s*(.+)");
    private static final Pattern choice = Pattern.compile("^\\+\\s*\\[(.*?)]\\s*(.*?)\\s*(?:->\\s*#(\\w+))?$");
    private static final Pattern jump = Pattern.compile("^->\\s*#(\\w+)");
    private static final Pattern logicIf = Pattern.compile("^\\(IF:\\s*(.+)\\)");
    private static final Pattern logicElse = Pattern.compile("^\\(ELSE\\)");
    private static final Pattern logicEnd = Pattern.compile("^\\(END\\)");
    private static final Pattern section = Pattern.compile("^#\\s*(\\w+)(.*)");
    private static final Pattern characterCue = Pattern.compile("^[A-Z0-9 ]*[A-Z0-9]+(?:\\s*\\(.*\\))?$");
    private static final Pattern parentheticalLine = Pattern.compile("^\\(.*\\)$");

    private final LineCursor cursor;
    private final Script.Builder script = Script.builder();
    private final LinkedHashMap<String, String> frontmatter = new LinkedHashMap<>();
    private State state = State.START;

    private String character = "";
    private @Nullable String parenthetical = null;
    private boolean expectingParenthetical = false;
    private final ArrayList<String> dialogueLines = new ArrayList<>();

    private enum State {
        /**
         * Nothing but blank lines seen so far; a {@code $} line here opens the frontmatter block.
         */
        START,
        IN_FRONTMATTER,
        SCANNING,
        /**
         * A character cue was read; collecting its parenthetical and dialogue lines up to a blank line.
         */
        IN_DIALOGUE,
    }
}
