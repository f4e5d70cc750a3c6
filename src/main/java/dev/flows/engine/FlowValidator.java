package dev.flows.engine;

import dev.flows.condition.ConditionEvaluator;
import dev.flows.gate.CriteriaLibrary;
import dev.flows.model.FlowDefinition;
import dev.flows.model.GateConfig;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepInput;
import dev.flows.model.StepKind;
import dev.flows.model.TransformSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates flow definitions before execution.
 */
public final class FlowValidator {

    private static final ConditionEvaluator CONDITIONS = new ConditionEvaluator();

    private FlowValidator() {}

    /**
     * Validate a flow definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(FlowDefinition flow) {
        var errors = new ArrayList<String>();

        if (isBlank(flow.id())) {
            errors.add("Flow id must not be empty");
        }
        if (isBlank(flow.name())) {
            errors.add("Flow '%s' has missing or empty name".formatted(flow.id()));
        }
        if (flow.steps().isEmpty()) {
            errors.add("Flow must have at least one step");
            return errors;
        }
        if (flow.settings().maxParallelism() < 1) {
            errors.add("settings.maxParallelism must be at least 1, got " + flow.settings().maxParallelism());
        }

        Set<String> ids = new HashSet<>();
        for (StepDefinition step : flow.steps()) {
            if (isBlank(step.id())) {
                errors.add("Step id must not be empty");
            } else if (!ids.add(step.id())) {
                errors.add("Duplicate step id: " + step.id());
            }
        }

        for (StepDefinition step : flow.steps()) {
            validateStep(step, ids, errors);
        }

        if (flow.output().from().isEmpty()) {
            errors.add("output.from must name at least one step");
        }
        for (String outputId : flow.output().from()) {
            if (!ids.contains(outputId)) {
                errors.add("output.from references non-existent step: " + outputId);
            }
        }

        // Graph checks only make sense once every reference resolves.
        if (errors.isEmpty()) {
            try {
                new DependencyResolver(flow.steps()).topologicalSort();
            } catch (FlowValidationException e) {
                errors.add("Invalid dependencies: " + e.getMessage());
            }
        }

        return errors;
    }

    /**
     * Non-fatal findings: gate criteria the library does not know. The gate drops them at run
     * time and judges the remaining criteria.
     */
    public static List<String> warnings(FlowDefinition flow) {
        var warnings = new ArrayList<String>();
        for (StepDefinition step : flow.steps()) {
            if (step.kind() instanceof StepKind.Gate gate) {
                for (String criterion : gate.evaluate().criteria()) {
                    if (CriteriaLibrary.byName(criterion).isEmpty()) {
                        warnings.add("Step '%s': gate uses unknown criterion '%s', it will be ignored"
                            .formatted(step.id(), criterion));
                    }
                }
            }
        }
        return warnings;
    }

    private static void validateStep(StepDefinition step, Set<String> ids, List<String> errors) {
        String stepId = step.id();

        if (isBlank(step.name())) {
            errors.add("Step '%s' has missing or empty name".formatted(stepId));
        }
        if (isBlank(step.agent())) {
            errors.add("Step '%s' has missing or empty agent".formatted(stepId));
        }

        for (String dependency : step.dependsOn()) {
            if (dependency.equals(stepId)) {
                errors.add("Step '%s' depends on itself".formatted(stepId));
            } else if (!ids.contains(dependency)) {
                errors.add("Step '%s': dependency '%s' not found in steps".formatted(stepId, dependency));
            }
        }

        validateInput(step, ids, errors);

        if (step.hasCondition()) {
            var validation = CONDITIONS.validateCondition(step.condition());
            if (!validation.valid()) {
                errors.add("Step '%s' has invalid condition: %s".formatted(stepId, validation.error()));
            }
        }

        if (step.retry().maxAttempts() < 1) {
            errors.add("Step '%s': retry.maxAttempts must be at least 1".formatted(stepId));
        }
        if (step.retry().backoffMs() < 0) {
            errors.add("Step '%s': retry.backoffMs must not be negative".formatted(stepId));
        }

        StepKind kind = step.kind();
        if (kind instanceof StepKind.Gate gate) {
            validateGate(stepId, gate, errors);
        } else if (kind instanceof StepKind.Branch branch) {
            for (StepKind.BranchCondition condition : branch.branches()) {
                if (!ids.contains(condition.gotoStep())) {
                    errors.add("Step '%s': branch target '%s' not found in steps".formatted(stepId, condition.gotoStep()));
                }
                var validation = CONDITIONS.validateCondition(condition.condition());
                if (!validation.valid()) {
                    errors.add("Step '%s' has invalid branch condition: %s".formatted(stepId, validation.error()));
                }
            }
            if (branch.defaultStep() != null && !ids.contains(branch.defaultStep())) {
                errors.add("Step '%s': default branch '%s' not found in steps".formatted(stepId, branch.defaultStep()));
            }
        } else if (kind instanceof StepKind.Consensus consensus) {
            if (consensus.method() == StepKind.ConsensusMethod.JUDGE && isBlank(consensus.judge())) {
                errors.add("Step '%s': consensus method 'judge' requires a judge agent".formatted(stepId));
            }
        }
    }

    private static void validateInput(StepDefinition step, Set<String> ids, List<String> errors) {
        StepInput input = step.input();
        String stepId = step.id();
        switch (input.source()) {
            case STEP -> {
                if (isBlank(input.stepId())) {
                    errors.add("Step '%s' has source 'step' but no stepId".formatted(stepId));
                } else if (!ids.contains(input.stepId())) {
                    errors.add("Step '%s': input stepId '%s' not found in steps".formatted(stepId, input.stepId()));
                }
            }
            case AGGREGATE -> {
                if (input.from().isEmpty()) {
                    errors.add("Step '%s' has source 'aggregate' but no 'from' steps".formatted(stepId));
                }
                for (String from : input.from()) {
                    if (!ids.contains(from)) {
                        errors.add("Step '%s': input from '%s' not found in steps".formatted(stepId, from));
                    }
                }
            }
            case FEEDBACK -> errors.add("Step '%s' uses input source 'feedback', which flow runs do not provide"
                .formatted(stepId));
            case REQUEST -> { }
        }

        if (input.transform() instanceof TransformSpec.Named named && !Transforms.BUILT_IN.contains(named.name())) {
            errors.add("Step '%s' uses unknown transform '%s'".formatted(stepId, named.name()));
        }
    }

    private static void validateGate(String stepId, StepKind.Gate gate, List<String> errors) {
        GateConfig config = gate.evaluate();
        if (isBlank(config.agent())) {
            errors.add("Step '%s': gate has missing or empty judge agent".formatted(stepId));
        }
        if (config.threshold() < 0 || config.threshold() > 1) {
            errors.add("Step '%s': gate threshold must be within [0, 1], got %s".formatted(stepId, config.threshold()));
        }
        if (config.maxRetries() < 1) {
            errors.add("Step '%s': gate maxRetries must be at least 1".formatted(stepId));
        }
        if (gate.loop() != null) {
            StepKind.LoopConfig loop = gate.loop();
            if (loop.maxIterations() < 1 || loop.maxIterations() > 10) {
                errors.add("Step '%s': loop maxIterations must be within [1, 10]".formatted(stepId));
            }
            if (loop.targetScore() < 0 || loop.targetScore() > 1) {
                errors.add("Step '%s': loop targetScore must be within [0, 1]".formatted(stepId));
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
