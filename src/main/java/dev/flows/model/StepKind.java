package dev.flows.model;

import java.util.List;
import java.util.Map;

/**
 * Type-specific payload of a step. Exactly one form per step, chosen from its {@code type}.
 */
public sealed interface StepKind {

    StepType type();

    /** Plain agent invocation. */
    record Agent() implements StepKind {
        @Override
        public StepType type() { return StepType.AGENT; }
    }

    /** Quality gate judging upstream content; {@code loop} is nullable. */
    record Gate(GateConfig evaluate, LoopConfig loop) implements StepKind {
        @Override
        public StepType type() { return StepType.GATE; }
    }

    /** Conditional routing; {@code defaultStep} is nullable. */
    record Branch(List<BranchCondition> branches, String defaultStep) implements StepKind {
        public Branch {
            branches = branches == null ? List.of() : List.copyOf(branches);
        }

        @Override
        public StepType type() { return StepType.BRANCH; }
    }

    /** Multi-agent consensus; {@code judge} and {@code weights} are nullable. */
    record Consensus(ConsensusMethod method, String judge, Map<String, Double> weights) implements StepKind {
        @Override
        public StepType type() { return StepType.CONSENSUS; }
    }

    record BranchCondition(String condition, String gotoStep) {}

    /** Feedback loop settings: iterate until {@code targetScore} or {@code maxIterations}. */
    record LoopConfig(int maxIterations, double targetScore, String backTo) {
        public static final int DEFAULT_MAX_ITERATIONS = 3;
        public static final double DEFAULT_TARGET_SCORE = 0.9;
    }

    enum ConsensusMethod {
        MAJORITY, WEIGHTED, UNANIMOUS, JUDGE;

        public static ConsensusMethod fromValue(String value) {
            return valueOf(value.toUpperCase());
        }
    }
}
