package dev.flows.engine;

import dev.flows.backend.AgentResult;
import dev.flows.model.StepResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static dev.flows.engine.TestSteps.flow;
import static dev.flows.engine.TestSteps.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowRunStateTest {

    private final FlowRunState state = new FlowRunState(
        flow(List.of(step("first"), step("second"), step("third")), null, true));

    @Test
    void stepResultIsWrittenOnlyOnce() {
        state.record(ok("first"));

        assertThatThrownBy(() -> state.record(ok("first")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("first");
    }

    @Test
    void orderedResultsFollowDeclarationOrder() {
        state.record(ok("third"));
        state.record(ok("first"));

        assertThat(state.orderedResults()).containsOnlyKeys("first", "third");
        assertThat(state.orderedResults().keySet()).containsExactly("first", "third");
    }

    @Test
    void snapshotIsNotAffectedByLaterWrites() {
        state.record(ok("first"));
        var snapshot = state.snapshot();

        state.record(ok("second"));

        assertThat(snapshot).containsOnlyKeys("first");
        assertThat(state.hasResult("second")).isTrue();
    }

    @Test
    void skippedStepsCountAsSucceeded() {
        state.record(ok("first"));
        state.record(StepResult.skipped("second", "not needed", Instant.now(), Instant.now()));
        assertThat(state.allSucceeded()).isTrue();

        state.record(StepResult.failed("third", "boom", Instant.now(), Instant.now()));
        assertThat(state.allSucceeded()).isFalse();
    }

    @Test
    void wavesAreNumberedFromZero() {
        assertThat(state.nextWave()).isZero();
        assertThat(state.nextWave()).isEqualTo(1);
        assertThat(state.waveCount()).isEqualTo(2);
    }

    @Test
    void eachRunGetsItsOwnId() {
        var other = new FlowRunState(state.flow());

        assertThat(other.runId()).isNotEqualTo(state.runId());
    }

    private static StepResult ok(String id) {
        return StepResult.succeeded(id, AgentResult.of(id), Instant.now(), Instant.now());
    }
}
