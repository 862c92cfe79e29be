// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.test;

import java.util.Map;
import fountainflow.generator.TweeGenerator;
import fountainflow.generator.UnbalancedBlockCondition;
import fountainflow.generator.UnbalancedBlockCondition.Reason;
import fountainflow.generator.UnsupportedConstructCondition;
import fountainflow.parser.FFlowParser;
import fountainflow.script.Node;
import fountainflow.script.Script;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class TweeGeneratorTest {
    @Test
    void convertsParsedFFlow() {
        final var script = FFlowParser.parse("$ HP: 100\n===\nINT. ROOM\nAction.\n+ [Go] Move -> #NEXT");
        final var output = TweeGenerator.generate(script);
        Assertions.assertThat(output).contains(":: StoryInit", "<<set $HP to 100>>", ":: INT_ROOM", "[[Go|NEXT]]");
        Assertions.assertThat(output).isEqualTo(
            ":: StoryInit\n<<set $HP to 100>>\n\n:: INT_ROOM\n**INT. ROOM**\nAction.\nMove [[Go|NEXT]]\n"
        );
    }

    @Test
    void sceneHeadingFoldsIntoPrecedingSection() {
        final var script = Script.of(
            new Node.SectionHeading("Intro", "intro"),
            Node.SceneHeading.of("INT. ROOM"),
            new Node.Action("Quiet."),
            Node.SceneHeading.of("EXT. PARK")
        );
        Assertions.assertThat(TweeGenerator.generate(script))
            .isEqualTo(":: intro\n**INT. ROOM**\nQuiet.\n\n:: EXT_PARK\n**EXT. PARK**\n");
    }

    @Test
    void contentWithoutPassageOpensStart() {
        Assertions.assertThat(TweeGenerator.generate(Script.of(new Node.Action("Hello."))))
            .isEqualTo(":: Start\nHello.\n");
        Assertions.assertThat(TweeGenerator.generate(Script.of(
            new Node.Frontmatter(Map.of("a", "1")),
            new Node.Action("Hi.")
        ))).isEqualTo(":: StoryInit\n<<set $a to 1>>\n\n:: Start\nHi.\n");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "HP > 10 and not dead|<<if $HP > 10 and not $dead>>",
        "$hp > 10|<<if $hp > 10>>",
        "name == \"Eve Smith\" or player.level > 2|<<if $name == \"Eve Smith\" or $player.level > 2>>",
        "true|<<if true>>",
    })
    void conditionsGetSigils(final String condition, final String expected) {
        Assertions.assertThat(TweeGenerator.generate(Script.of(
            new Node.SectionHeading("P", "P"),
            Node.Logic.ifOpen(condition),
            Node.Logic.end()
        ))).isEqualTo(":: P\n" + expected + "\n<<endif>>\n");
    }

    @Test
    void stateChangesBecomeSetMacros() {
        final var output = TweeGenerator.generate(Script.of(
            new Node.StateChange("HP = HP - 10"),
            new Node.StateChange("gold += 5")
        ));
        Assertions.assertThat(output).isEqualTo(":: Start\n<<set $HP to $HP - 10>>\n<<set $gold += 5>>\n");
    }

    @Test
    void dialogueAssetsAndJumps() {
        final var output = TweeGenerator.generate(Script.of(
            new Node.SectionHeading("P", "P"),
            new Node.Dialogue("EVE", "Over here.", "(whispering)"),
            new Node.Dialogue("EVE", "Hello."),
            new Node.Asset("BG", "ruins"),
            new Node.Asset("SHOW", "eve angry"),
            new Node.Asset("MUSIC", "tension"),
            new Node.Jump("END")
        ));
        Assertions.assertThat(output).isEqualTo(String.join(
            "\n",
            ":: P",
            "**EVE** (whispering): Over here.",
            "**EVE**: Hello.",
            "<script>$(\"body\").css(\"background-image\", \"url('ruins.jpg')\");</script>",
            "<!-- SHOW: eve angry -->",
            "<!-- Asset: MUSIC tension -->",
            "<<goto \"END\">>",
            ""
        ));
    }

    @Test
    void choiceWithoutTargetGetsPlaceholderAndDiagnostic() {
        try (final var diagnostics = new Diagnostics()) {
            final var choice = new Node.Choice("Wait", "", "");
            final var output = TweeGenerator.generate(Script.of(new Node.SectionHeading("P", "P"), choice));
            Assertions.assertThat(output).contains("<!-- Choice 'Wait'", "[[Wait|NEXT_STEP]]");
            Assertions.assertThat(diagnostics.ofType(UnsupportedConstructCondition.class))
                .extracting(UnsupportedConstructCondition::node)
                .containsExactly(choice);
        }
    }

    @Test
    void unmatchedElseAndUnclosedBlocksAreReported() {
        try (final var diagnostics = new Diagnostics()) {
            final var output = TweeGenerator.generate(Script.of(
                new Node.SectionHeading("P", "P"),
                Node.Logic.orElse(),
                Node.Logic.ifOpen("x")
            ));
            Assertions.assertThat(output).isEqualTo(":: P\n<<else>>\n<<if $x>>\n<<endif>>\n");
            Assertions.assertThat(diagnostics.ofType(UnbalancedBlockCondition.class))
                .extracting(UnbalancedBlockCondition::reason)
                .containsExactly(Reason.UNMATCHED_ELSE, Reason.UNCLOSED_AT_END);
        }
    }

    @Test
    void blocksOpenAtPassageBoundaryAreClosed() {
        try (final var diagnostics = new Diagnostics()) {
            final var output = TweeGenerator.generate(Script.of(
                new Node.SectionHeading("a", "a"),
                Node.Logic.ifOpen("x"),
                new Node.SectionHeading("b", "b")
            ));
            Assertions.assertThat(output).isEqualTo(":: a\n<<if $x>>\n<<endif>>\n\n:: b\n");
            Assertions.assertThat(diagnostics.ofType(UnbalancedBlockCondition.class)).singleElement().satisfies(
                condition -> {
                    Assertions.assertThat(condition.reason()).isEqualTo(Reason.UNCLOSED_AT_BOUNDARY);
                    Assertions.assertThat(condition.openBlocks()).isEqualTo(1);
                }
            );
        }
    }
}
