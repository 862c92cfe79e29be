// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.test;

import java.util.Map;
import fountainflow.parser.ParseWarningCondition;
import fountainflow.parser.TweeParser;
import fountainflow.script.Node;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class TweeParserTest {
    @Test
    void storyPassagesBecomeNodes() {
        final var script = TweeParser.parse(String.join(
            "\n",
            ":: StoryInit",
            "<<set $hp to 100>>",
            "",
            ":: Start [tag]",
            "Intro text.",
            "**EVE**: Hello.",
            "[[Go North|NorthRoom]]",
            "<<if $hp > 10>>",
            "    Alive.",
            "<<endif>>"
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.Frontmatter(Map.of("hp", "100")),
            new Node.SectionHeading("Start [tag]", "Start"),
            new Node.Action("Intro text."),
            new Node.Dialogue("EVE", "Hello."),
            new Node.Choice("Go North", "", "NorthRoom"),
            Node.Logic.ifOpen("$hp > 10"),
            new Node.Action("Alive."),
            Node.Logic.end()
        );
    }

    @Test
    void storyInitIsPrependedEvenWhenItComesLast() {
        final var script = TweeParser.parse(
            ":: Start\nHello.\n:: StoryInit\n<<set $gold = 5>>\n<<set $name to \"Eve\">>"
        );
        Assertions.assertThat(script.get(0)).isEqualTo(new Node.Frontmatter(Map.of("gold", "5", "name", "\"Eve\"")));
        Assertions.assertThat(script.size()).isEqualTo(3);
    }

    @Test
    void storyInitContentOtherThanSetIsSkippedWithWarning() {
        try (final var diagnostics = new Diagnostics()) {
            final var script = TweeParser.parse(":: StoryInit\n<<set $hp to 1>>\nSome prose.");
            Assertions.assertThat(script.nodes()).containsExactly(new Node.Frontmatter(Map.of("hp", "1")));
            Assertions.assertThat(diagnostics.ofType(ParseWarningCondition.class))
                .singleElement()
                .satisfies(warning -> Assertions.assertThat(warning.location().lineNumber()).isEqualTo(3));
        }
    }

    @Test
    void scenePrefixedPassageBecomesSceneHeading() {
        final var script = TweeParser.parse(":: INT. ROOM\nQuiet.");
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.SceneHeading("INT. ROOM", "INT. ROOM"),
            new Node.Action("Quiet.")
        );
    }

    @Test
    void scenePassageDropsTagsAndMetadata() {
        final var script = TweeParser.parse(":: INT. BAR [night] {\"position\":\"100,200\"}\nQuiet.");
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.SceneHeading("INT. BAR", "INT. BAR"),
            new Node.Action("Quiet.")
        );
    }

    @Test
    void passageMetadataIsStrippedFromAnchor() {
        final var script = TweeParser.parse(":: Cellar [dark scary] {\"position\":\"100,200\"}");
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.SectionHeading("Cellar [dark scary] {\"position\":\"100,200\"}", "Cellar")
        );
    }

    @Test
    void everyLinkFormBecomesChoice() {
        final var script = TweeParser.parse("Where to? [[North]] [[Go south|South]] [[East->EastRoom]]");
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.Choice("North", "Where to?", "North"),
            new Node.Choice("Go south", "Where to?", "South"),
            new Node.Choice("East", "Where to?", "EastRoom")
        );
    }

    @Test
    void macrosBecomeStateLogicAndJumps() {
        final var script = TweeParser.parse(String.join(
            "\n",
            "<<set $hp to $hp - 10>>",
            "<<if $hp lte 0>>",
            "<<goto \"Death\">>",
            "<<else>>",
            "<<bg \"forest\">>",
            "<<show \"eve happy\">>",
            "<</if>>"
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.StateChange("hp = $hp - 10"),
            Node.Logic.ifOpen("$hp lte 0"),
            new Node.Jump("Death"),
            Node.Logic.orElse(),
            new Node.Asset("BG", "forest"),
            new Node.Asset("SHOW", "eve happy"),
            Node.Logic.end()
        );
    }

    @Test
    void generatedAssetMarkupIsRecognized() {
        final var script = TweeParser.parse(String.join(
            "\n",
            "<script>$(\"body\").css(\"background-image\", \"url('ruins.jpg')\");</script>",
            "<!-- SHOW: eve angry -->",
            "<!-- Asset: MUSIC tension -->"
        ));
        Assertions.assertThat(script.nodes()).containsExactly(
            new Node.Asset("BG", "ruins"),
            new Node.Asset("SHOW", "eve angry"),
            new Node.Asset("MUSIC", "tension")
        );
    }

    @Test
    void dialogueWithParenthetical() {
        final var script = TweeParser.parse("**EVE** (whispering): Over here.");
        Assertions.assertThat(script.nodes()).containsExactly(new Node.Dialogue("EVE", "Over here.", "(whispering)"));
    }
}
