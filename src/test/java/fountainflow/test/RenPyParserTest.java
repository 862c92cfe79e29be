// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.test;

import fountainflow.parser.ParseWarningCondition;
import fountainflow.parser.RenPyParser;
import fountainflow.script.Node;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class RenPyParserTest {
    @Test
    void statementsBecomeNodes() {
        final var script = RenPyParser.parse(String.join(
            "\n",
            "label start:",
            "    $ hp = 100",
            "    scene bg room",
            "    show e happy",
            "    e \"Hello\"",
            "    \"It is dark.\"",
            "    menu:",
            "        \"Go West\":",
            "            jump west_room",
            "    if hp < 0:",
            "        \"Dead\""
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.StateChange("hp = 100"),
            new Node.Asset("BG", "bg room"),
            new Node.Asset("SHOW", "e happy"),
            new Node.Dialogue("e", "Hello"),
            new Node.Action("It is dark."),
            new Node.Decision("Choice"),
            new Node.Choice("Go West", "", "west_room"),
            Node.Logic.ifOpen("hp < 0"),
            new Node.Action("Dead")
        );
    }

    @Test
    void noLogicEndIsEverEmitted() {
        final var script = RenPyParser.parse("if x:\n    \"a\"\nelse:\n    \"b\"\n\"c\"");
        Assertions.assertThat(script.nodes()).containsExactly(
            Node.Logic.ifOpen("x"),
            new Node.Action("a"),
            Node.Logic.orElse(),
            new Node.Action("b"),
            new Node.Action("c")
        );
    }

    @Test
    void menuCaptionBecomesPromptAndChoiceTextIsKept() {
        final var script = RenPyParser.parse(String.join(
            "\n",
            "label crossroads:",
            "    menu:",
            "        \"Which way?\"",
            "        \"Left\" if has_map:",
            "            \"The safe road.\"",
            "            jump left_road",
            "        \"Right\":",
            "            jump right_road",
            "    \"Nobody chose.\""
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.SectionHeading("crossroads", "crossroads"),
            new Node.Decision("Which way?"),
            new Node.Choice("Left", "The safe road.", "left_road"),
            new Node.Choice("Right", "", "right_road"),
            new Node.Action("Nobody chose.")
        );
    }

    @Test
    void jumpOutsideMenuIsJump() {
        final var script = RenPyParser.parse("label a:\n    jump b\nlabel b:\n    return");
        Assertions.assertThat(script.nodes()).startsWith(
            new Node.SectionHeading("a", "a"),
            new Node.Jump("b"),
            new Node.SectionHeading("b", "b")
        );
    }

    @Test
    void audioAndPythonStatements() {
        final var script = RenPyParser.parse(String.join(
            "\n",
            "play music \"tension.ogg\"",
            "play sound \"door.wav\"",
            "$ inventory.append(\"key\")",
            "$ gold += 5"
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.Asset("MUSIC", "tension.ogg"),
            new Node.Asset("SOUND", "door.wav"),
            new Node.StateChange("inventory.append(\"key\")"),
            new Node.StateChange("gold += 5")
        );
    }

    @Test
    void sceneCommentsSurviveAndOtherCommentsDoNot() {
        final var script = RenPyParser.parse("# INT. ROOM\n# just a note\n\"Quiet.\"");
        Assertions.assertThat(script.nodes()).containsExactly(
            Node.SceneHeading.of("INT. ROOM"),
            new Node.Action("Quiet.")
        );
    }

    @Test
    void escapedQuotesAreUnescaped() {
        final var script = RenPyParser.parse("e \"She said \\\"run\\\".\"");
        Assertions.assertThat(script.nodes()).containsExactly(new Node.Dialogue("e", "She said \"run\"."));
    }

    @Test
    void decisionComesBeforeOtherNodesInsideMenu() {
        final var script = RenPyParser.parse(String.join(
            "\n",
            "label start:",
            "    menu:",
            "        # INT. HALL",
            "        \"Go\":",
            "            jump hall",
            "    menu:",
            "        $ seen = True",
            "        \"Stay\":",
            "            jump room"
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.Decision("Choice"),
            Node.SceneHeading.of("INT. HALL"),
            new Node.Choice("Go", "", "hall"),
            new Node.Decision("Choice"),
            new Node.StateChange("seen = True"),
            new Node.Choice("Stay", "", "room")
        );
    }

    @Test
    void unknownStatementsAreDroppedWithWarning() {
        try (final var diagnostics = new Diagnostics()) {
            final var script = RenPyParser.parse("define e = Character(\"Eileen\")\n\nlabel start:\n    return");
            Assertions.assertThat(script.isEmpty()).isTrue();
            Assertions.assertThat(diagnostics.ofType(ParseWarningCondition.class))
                .extracting(warning -> warning.location().lineNumber())
                .containsExactly(1, 4);
        }
    }
}
