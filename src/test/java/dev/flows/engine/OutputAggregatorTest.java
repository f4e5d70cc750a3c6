package dev.flows.engine;

import dev.flows.backend.AgentResult;
import dev.flows.model.FlowOutput;
import dev.flows.model.OutputFormat;
import dev.flows.model.StepResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OutputAggregatorTest {

    private final Map<String, StepResult> results = results();

    @Test
    void singleSourceIsReturnedAsIs() {
        assertThat(OutputAggregator.aggregate(FlowOutput.of("summary"), results)).isEqualTo("All done");
        assertThat(OutputAggregator.aggregate(FlowOutput.of("skipped"), results)).isEmpty();
    }

    @Test
    void noSourcesGiveEmptyOutput() {
        assertThat(OutputAggregator.aggregate(new FlowOutput(List.of(), OutputFormat.JSON), results)).isEmpty();
    }

    @Test
    void concatJoinsNonEmptyContentsWithNewlines() {
        var output = new FlowOutput(List.of("summary", "skipped", "details"), OutputFormat.CONCAT);

        assertThat(OutputAggregator.aggregate(output, results)).isEqualTo("All done\nLine one");
    }

    @Test
    void jsonHoldsOneKeyPerProducingStep() {
        var output = new FlowOutput(List.of("summary", "skipped", "details"), OutputFormat.JSON);

        assertThat(OutputAggregator.aggregate(output, results))
            .isEqualTo("{\"summary\":\"All done\",\"details\":\"Line one\"}");
    }

    @Test
    void markdownRendersOneSectionPerSource() {
        var output = new FlowOutput(List.of("summary", "details"), OutputFormat.MARKDOWN);

        assertThat(OutputAggregator.aggregate(output, results))
            .isEqualTo("## summary\n\nAll done\n\n## details\n\nLine one");
    }

    private static Map<String, StepResult> results() {
        Instant now = Instant.now();
        var results = new LinkedHashMap<String, StepResult>();
        results.put("summary", StepResult.succeeded("summary", AgentResult.of("All done"), now, now));
        results.put("skipped", StepResult.skipped("skipped", "not needed", now, now));
        results.put("details", StepResult.succeeded("details", AgentResult.of("Line one"), now, now));
        return results;
    }
}
