package dev.flows.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FlowsCliTest {

    private static final String PIPELINE = """
        {
          "id": "pipeline",
          "name": "Pipeline",
          "steps": [
            { "id": "draft", "name": "Draft", "agent": "writer" },
            { "id": "edit", "name": "Edit", "agent": "editor", "dependsOn": ["draft"],
              "input": { "source": "step", "stepId": "draft" } },
            { "id": "tweet", "name": "Tweet", "agent": "social", "dependsOn": ["draft"],
              "condition": "results.draft.content.includes('urgent')" }
          ],
          "output": { "from": "edit" }
        }
        """;

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        cli = FlowsCli.commandLine(Map.of())
            .setOut(new PrintWriter(out, true))
            .setErr(new PrintWriter(err, true));
    }

    @Test
    void runPrintsOutputAndStepSummary() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);

        int exit = cli.execute("run", flow.toString(), "--prompt", "launch notes");

        assertThat(exit).isEqualTo(FlowsCli.EXIT_OK);
        assertThat(out.toString()).isEqualTo("[editor] [writer] launch notes" + System.lineSeparator());
        assertThat(err.toString()).contains("Steps:", "draft", "succeeded", "tweet", "skipped");
    }

    @Test
    void runReadsPromptFileAndHonoursBackendFlag() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);
        Path prompt = write("prompt.txt", "from a file");

        int exit = cli.execute("run", flow.toString(), "--prompt-file", prompt.toString(), "--backend", "echo");

        assertThat(exit).isEqualTo(FlowsCli.EXIT_OK);
        assertThat(out.toString()).contains("[editor] [writer] from a file");
    }

    @Test
    void echoPrefixComesFromConfigFile() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);
        Path config = write("agents.properties", "backend=echo\necho.prefix=dry:\n");

        cli.execute("run", flow.toString(), "-p", "x", "--config", config.toString());

        assertThat(out.toString()).startsWith("dry:[editor] dry:[writer] x");
    }

    @Test
    void runWithoutPromptFails() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);

        assertThat(cli.execute("run", flow.toString())).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).contains("a prompt is required");
    }

    @Test
    void runRefusesInvalidFlow() throws IOException {
        Path flow = write("bad.json", """
            { "id": "bad", "name": "Bad", "steps": [ { "id": "a", "name": "A", "agent": "x", "dependsOn": ["ghost"] } ],
              "output": { "from": "a" } }
            """);

        assertThat(cli.execute("run", flow.toString(), "-p", "x")).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).contains("flow 'bad' is invalid", "dependency 'ghost' not found");
    }

    @Test
    void unknownBackendIsAFatalError() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);

        int exit = cli.execute("run", flow.toString(), "-p", "x", "--backend", "smoke-signals");

        assertThat(exit).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).contains("Unknown backend 'smoke-signals'");
    }

    @Test
    void failedStepsExitWithTwo() throws IOException {
        Path flow = write("broken.json", """
            {
              "id": "broken", "name": "Broken",
              "steps": [
                { "id": "a", "name": "A", "agent": "x",
                  "input": { "transform": "jsonExtract", "transformArgs": "field" } }
              ],
              "output": { "from": "a" },
              "settings": { "failFast": false }
            }
            """);

        int exit = cli.execute("run", flow.toString(), "-p", "not json");

        assertThat(exit).isEqualTo(FlowsCli.EXIT_STEPS_FAILED);
        assertThat(err.toString()).contains("failed", "Invalid JSON input");
    }

    @Test
    void failFastAbortPrintsPartialSummary() throws IOException {
        Path flow = write("broken.json", """
            {
              "id": "broken", "name": "Broken",
              "steps": [
                { "id": "a", "name": "A", "agent": "x",
                  "input": { "transform": "jsonExtract", "transformArgs": "field" } },
                { "id": "b", "name": "B", "agent": "y", "dependsOn": ["a"] }
              ],
              "output": { "from": "b" }
            }
            """);

        int exit = cli.execute("run", flow.toString(), "-p", "not json");

        assertThat(exit).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).contains("Error: Step a failed", "Steps:");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void validateReportsValidFlow() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);

        assertThat(cli.execute("validate", flow.toString())).isEqualTo(FlowsCli.EXIT_OK);
        assertThat(out.toString()).contains("Flow 'pipeline' is valid");
    }

    @Test
    void validateReportsMalformedFile() throws IOException {
        Path flow = write("gate.json", """
            { "id": "g", "steps": [ { "id": "s", "agent": "x", "type": "gate" } ] }
            """);

        assertThat(cli.execute("validate", flow.toString())).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).contains("Invalid: gate.json: Step 's' has type 'gate' but no 'evaluate' block");
    }

    @Test
    void planPrintsWaves() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);

        assertThat(cli.execute("plan", flow.toString())).isEqualTo(FlowsCli.EXIT_OK);
        assertThat(out.toString())
            .contains("Execution plan for pipeline: 2 wave(s), max parallelism 3")
            .contains("Wave 1: draft")
            .contains("Wave 2: edit, tweet");
    }

    @Test
    void planReportsCycles() throws IOException {
        Path flow = write("cycle.json", """
            { "id": "c", "name": "C", "steps": [
              { "id": "a", "agent": "x", "dependsOn": ["b"] },
              { "id": "b", "agent": "x", "dependsOn": ["a"] } ] }
            """);

        assertThat(cli.execute("plan", flow.toString())).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).contains("Cycle detected");
    }

    @Test
    void showPrintsStepsAndGraph() throws IOException {
        Path flow = write("pipeline.json", PIPELINE);

        assertThat(cli.execute("show", flow.toString())).isEqualTo(FlowsCli.EXIT_OK);
        assertThat(out.toString())
            .contains("Flow: pipeline (Pipeline) v1.0.0")
            .contains("edit [agent] agent=editor input=step transform=passthrough")
            .contains("condition: results.draft.content.includes('urgent')")
            .contains("draft -> edit");
    }

    @Test
    void listShowsFlowsInDirectory() throws IOException {
        write("pipeline.json", PIPELINE);

        assertThat(cli.execute("list", "--dir", dir.toString())).isEqualTo(FlowsCli.EXIT_OK);
        assertThat(out.toString()).contains("Available flows:", "pipeline", "3 step(s)");
    }

    @Test
    void missingFileIsReportedWithoutStackTrace() {
        int exit = cli.execute("show", dir.resolve("nope.json").toString());

        assertThat(exit).isEqualTo(FlowsCli.EXIT_FATAL);
        assertThat(err.toString()).startsWith("Error: ");
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
