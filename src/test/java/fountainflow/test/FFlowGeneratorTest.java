// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import fountainflow.generator.FFlowGenerator;
import fountainflow.parser.FFlowParser;
import fountainflow.parser.TweeParser;
import fountainflow.script.Node;
import fountainflow.script.Script;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class FFlowGeneratorTest {
    @Test
    void writesCanonicalFFlow() {
        final var script = Script.of(
            new Node.Frontmatter(Map.of("HP", "100")),
            Node.SceneHeading.of("INT. ROOM"),
            new Node.Action("Action."),
            new Node.Dialogue("Eve", "Hello.", "(quietly)"),
            new Node.Action("She leaves.")
        );
        Assertions.assertThat(FFlowGenerator.generate(script)).isEqualTo(
            "$ HP: 100\n===\n\nINT. ROOM\n\nAction.\n\nEVE\n(quietly)\nHello.\n\nShe leaves.\n"
        );
    }

    @Test
    void branchingPrimitives() {
        final var script = Script.of(
            new Node.Asset("BG", "ruins"),
            new Node.StateChange("HP = HP - 10"),
            Node.Logic.ifOpen("HP > 0"),
            new Node.Jump("ALIVE"),
            Node.Logic.orElse(),
            new Node.Jump("DEAD"),
            Node.Logic.end(),
            new Node.Decision("What now?"),
            new Node.Choice("Go", "Move on", "NEXT"),
            new Node.Choice("Stay", "", "")
        );
        Assertions.assertThat(FFlowGenerator.generate(script)).isEqualTo(String.join(
            "\n",
            "! BG: ruins",
            "~ HP = HP - 10",
            "(IF: HP > 0)",
            "-> #ALIVE",
            "(ELSE)",
            "-> #DEAD",
            "(END)",
            "",
            "? What now?",
            "",
            "+ [Go] Move on -> #NEXT",
            "+ [Stay]",
            ""
        ));
    }

    @Test
    void emptyFrontmatterStillReadsBackAsFrontmatter() {
        final var text = FFlowGenerator.generate(Script.of(new Node.Frontmatter(Map.of()), new Node.Action("x")));
        Assertions.assertThat(FFlowParser.parse(text).nodes())
            .containsExactly(new Node.Frontmatter(Map.of()), new Node.Action("x"));
    }

    @Test
    void uppercaseActionIsNotMistakenForCue() {
        final var script = Script.of(new Node.Action("THE END"), new Node.Action("Credits roll."));
        Assertions.assertThat(FFlowParser.parse(FFlowGenerator.generate(script))).isEqualTo(script);
    }

    @Test
    void spacedPassageNamesStayLinked() {
        final var twee = TweeParser.parse(String.join(
            "\n",
            ":: The Tavern",
            "Hello [[Leave|Dark Street]]",
            "<<goto \"Dark Street\">>",
            ":: Dark Street",
            "Cold."
        ));
        final var fflow = FFlowGenerator.generate(twee);
        Assertions.assertThat(fflow).contains("# The_Tavern\n", "+ [Leave] Hello -> #Dark_Street", "-> #Dark_Street\n");

        Assertions.assertThat(FFlowParser.parse(fflow).nodes()).containsExactly(
            new Node.SectionHeading("The_Tavern", "The_Tavern"),
            new Node.Choice("Leave", "Hello", "Dark_Street"),
            new Node.Jump("Dark_Street"),
            new Node.SectionHeading("Dark_Street", "Dark_Street"),
            new Node.Action("Cold.")
        );
    }

    @Test
    void emptyScriptGeneratesNothing() {
        Assertions.assertThat(FFlowGenerator.generate(Script.of())).isEmpty();
    }

    @Test
    void reparsingGeneratedTextKeepsNodeTypes() throws IOException {
        final var original = FFlowParser.parse(Files.readString(detectivePath, StandardCharsets.UTF_8));
        final var generated = FFlowGenerator.generate(original);
        final var reparsed = FFlowParser.parse(generated);
        Assertions.assertThat(nodeTypes(reparsed)).isNotEmpty().isEqualTo(nodeTypes(original));
        Assertions.assertThat(FFlowGenerator.generate(reparsed)).isEqualTo(generated);
    }

    private static List<String> nodeTypes(final Script script) {
        return script.nodes().stream().map(node -> node.getClass().getSimpleName()).toList();
    }

    private static final Path detectivePath = Path.of("src", "test", "resources", "scripts", "detective.fflow");
}
