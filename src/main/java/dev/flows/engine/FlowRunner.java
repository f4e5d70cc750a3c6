package dev.flows.engine;

import dev.flows.backend.AgentExecutor;
import dev.flows.backend.AgentResult;
import dev.flows.backend.StepRequest;
import dev.flows.condition.ConditionEvaluator;
import dev.flows.condition.ConditionResult;
import dev.flows.gate.AgentImprovementAgent;
import dev.flows.gate.FeedbackLoop;
import dev.flows.gate.GateEvaluator;
import dev.flows.gate.GateResult;
import dev.flows.model.FlowDefinition;
import dev.flows.model.FlowRequest;
import dev.flows.model.FlowSettings;
import dev.flows.model.GateConfig;
import dev.flows.model.StepDefinition;
import dev.flows.model.StepKind;
import dev.flows.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a flow wave by wave.
 *
 * <p>Waves run strictly in order. The steps of one wave run concurrently, at most
 * {@code maxParallelism} at a time, and the whole wave settles before the next one starts; a
 * failing step never cancels its siblings. Each step first checks its condition (a false or
 * broken condition skips it), then resolves its input and calls its agent. Anything a step
 * throws becomes a failed {@link StepResult}. With {@code failFast}, a wave containing a failed
 * step ends the run with a {@link FlowExecutionException}; without it, dependents of a failed
 * step fail in turn when their input cannot be resolved.
 *
 * <p>Declared timeouts are not enforced here; cancellation belongs to the {@link AgentExecutor}.
 */
public final class FlowRunner {

    private static final Logger log = LoggerFactory.getLogger(FlowRunner.class);

    private final AgentExecutor agentExecutor;
    private final FlowEventLogger eventLogger;
    private final GateEvaluator gateEvaluator; // nullable: gate steps then run as agent steps
    private final ExecutorService workers;     // nullable: a pool is created per run
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
    private final TransformPipeline transformPipeline = new TransformPipeline();

    public FlowRunner(AgentExecutor agentExecutor, FlowEventLogger eventLogger) {
        this(agentExecutor, eventLogger, null, null);
    }

    public FlowRunner(AgentExecutor agentExecutor, FlowEventLogger eventLogger,
                      GateEvaluator gateEvaluator, ExecutorService workers) {
        this.agentExecutor = agentExecutor;
        this.eventLogger = eventLogger;
        this.gateEvaluator = gateEvaluator;
        this.workers = workers;
    }

    /**
     * Run a flow to completion.
     *
     * @return the run, successful only when every step succeeded or was skipped
     * @throws FlowValidationException if the step graph has unknown dependencies or a cycle
     * @throws FlowExecutionException  if the flow has no steps, or failFast stopped the run
     */
    public FlowRun execute(FlowDefinition flow, FlowRequest request) {
        FlowRunState state = new FlowRunState(flow);
        FlowSettings settings = flow.settings();

        emit("flow.validating", request, null, "flowId", flow.id(), "stepCount", flow.steps().size());
        if (flow.steps().isEmpty()) {
            String error = "Flow must have at least one step";
            emit("flow.validation.failed", request, null, "flowId", flow.id(), "error", error);
            throw new FlowExecutionException(error, state.runId());
        }
        emit("flow.validated", request, null, "flowId", flow.id(), "stepCount", flow.steps().size(),
            "maxParallelism", settings.maxParallelism(), "failFast", settings.failFast());
        emit("flow.started", request, state, "flowId", flow.id(), "stepCount", flow.steps().size(),
            "maxParallelism", settings.maxParallelism(), "failFast", settings.failFast());

        ExecutorService pool = workers != null ? workers : newRunPool(state.runId(), settings.maxParallelism());
        try {
            emit("flow.dependencies.resolving", request, state, "flowId", flow.id());
            List<List<String>> waves = new DependencyResolver(flow.steps()).groupIntoWaves();
            emit("flow.dependencies.resolved", request, state, "flowId", flow.id(),
                "waveCount", waves.size(), "totalSteps", flow.steps().size());

            var semaphore = new Semaphore(Math.max(1, settings.maxParallelism()));
            for (List<String> wave : waves) {
                runWave(wave, state, request, pool, semaphore);
            }

            Map<String, StepResult> results = state.orderedResults();
            emit("flow.output.aggregating", request, state, "flowId", flow.id(),
                "outputFrom", flow.output().from(), "outputFormat", flow.output().format().value(),
                "totalSteps", results.size());
            String output = OutputAggregator.aggregate(flow.output(), results);
            emit("flow.output.aggregated", request, state, "flowId", flow.id(), "outputLength", output.length());

            Instant completedAt = Instant.now();
            boolean success = state.allSucceeded();
            var run = new FlowRun(state.runId(), success, results, output,
                Duration.between(state.startedAt(), completedAt), state.startedAt(), completedAt);
            emit("flow.completed", request, state, "flowId", flow.id(), "success", success,
                "durationMs", run.duration().toMillis(), "stepsCompleted", results.size(),
                "successfulSteps", results.size() - run.failedCount(), "failedSteps", run.failedCount(),
                "outputLength", output.length());
            return run;
        } catch (FlowException e) {
            Map<String, StepResult> partial = state.orderedResults();
            long failed = partial.values().stream().filter(r -> !r.success()).count();
            emit("flow.failed", request, state, "flowId", flow.id(), "error", e.getMessage(),
                "errorType", e.getClass().getSimpleName(),
                "durationMs", Duration.between(state.startedAt(), Instant.now()).toMillis(),
                "stepsAttempted", partial.size(), "successfulSteps", partial.size() - failed, "failedSteps", failed);
            throw e;
        } finally {
            if (workers == null) {
                pool.shutdownNow();
            }
        }
    }

    private void runWave(List<String> wave, FlowRunState state, FlowRequest request,
                         ExecutorService pool, Semaphore semaphore) {
        int waveNumber = state.nextWave() + 1;
        emit("flow.wave.started", request, state, "waveNumber", waveNumber, "waveSize", wave.size(), "stepIds", wave);

        // Every step of the wave sees the same results: those of earlier waves.
        Map<String, StepResult> snapshot = state.snapshot();
        List<CompletableFuture<Void>> futures = new ArrayList<>(wave.size());
        for (String stepId : wave) {
            StepDefinition step = state.flow().step(stepId).orElseThrow();
            futures.add(CompletableFuture.runAsync(
                () -> state.record(runStep(step, snapshot, state, request, semaphore)), pool));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int successCount = 0;
        String firstFailed = null;
        for (String stepId : wave) {
            if (state.result(stepId).success()) {
                successCount++;
            } else if (firstFailed == null) {
                firstFailed = stepId;
            }
        }
        boolean abort = firstFailed != null && state.flow().settings().failFast();
        emit("flow.wave.completed", request, state, "waveNumber", waveNumber, "waveSize", wave.size(),
            "successCount", successCount, "failureCount", wave.size() - successCount, "failed", abort);

        if (abort) {
            String error = state.result(firstFailed).error();
            throw new FlowExecutionException("Step %s failed: %s".formatted(firstFailed, error),
                state.runId(), firstFailed, state.orderedResults());
        }
    }

    /**
     * Run one step to a result. Never throws.
     */
    private StepResult runStep(StepDefinition step, Map<String, StepResult> results, FlowRunState state,
                               FlowRequest request, Semaphore semaphore) {
        Instant startedAt = Instant.now();

        if (step.hasCondition()) {
            ConditionResult condition = conditionEvaluator.evaluateStepCondition(step, results, request, state.flow());
            emit("flow.step.condition.evaluated", request, state, "stepId", step.id(), "condition", step.condition(),
                "shouldExecute", condition.shouldExecute(), "error", condition.error());
            if (!condition.shouldExecute()) {
                String reason = condition.error() != null
                    ? condition.error()
                    : "Condition \"%s\" evaluated to false".formatted(step.condition());
                emit("flow.step.skipped", request, state, "stepId", step.id(), "condition", step.condition(),
                    "reason", reason);
                return StepResult.skipped(step.id(), reason, startedAt, Instant.now());
            }
        }

        emit("flow.step.queued", request, state, "stepId", step.id(), "agent", step.agent(),
            "dependencies", step.dependsOn(), "inputSource", step.input().source().value());
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(step, "Interrupted while waiting to start", e, startedAt, state, request);
        }

        try {
            emit("flow.step.started", request, state, "stepId", step.id(), "agent", step.agent(),
                "type", step.type().value());
            TransformPipeline.PreparedInput input = transformPipeline.prepare(step, request, results);
            emit("flow.step.transform.applied", request, state, "stepId", step.id(),
                "transformName", input.transformName(), "inputSize", input.rawInput().length(),
                "outputSize", input.prompt().length(), "durationMs", input.transformDuration().toMillis());
            var stepRequest = new StepRequest(input.prompt(), Map.of(), request.traceId(), request.requestId());
            emit("flow.step.input.prepared", request, state, "stepId", step.id(),
                "inputSource", step.input().source().value(), "promptLength", input.prompt().length());

            AgentResult result = invoke(step, stepRequest, state, request);
            Instant completedAt = Instant.now();
            emit("flow.step.completed", request, state, "stepId", step.id(), "agent", step.agent(),
                "success", true, "durationMs", Duration.between(startedAt, completedAt).toMillis(),
                "outputLength", result.content().length(), "hasThought", result.thought() != null);
            return StepResult.succeeded(step.id(), result, startedAt, completedAt);
        } catch (Throwable e) {
            return failed(step, errorMessage(e), e, startedAt, state, request);
        } finally {
            semaphore.release();
        }
    }

    private StepResult failed(StepDefinition step, String error, Throwable cause, Instant startedAt,
                              FlowRunState state, FlowRequest request) {
        Instant completedAt = Instant.now();
        Throwable root = unwrap(cause);
        log.debug("Step '{}' failed in run {}", step.id(), state.runId(), root);
        emit("flow.step.failed", request, state, "stepId", step.id(), "agent", step.agent(), "error", error,
            "errorType", root.getClass().getSimpleName(),
            "durationMs", Duration.between(startedAt, completedAt).toMillis());
        return StepResult.failed(step.id(), error, startedAt, completedAt);
    }

    private AgentResult invoke(StepDefinition step, StepRequest stepRequest, FlowRunState state, FlowRequest request)
            throws Exception {
        if (step.kind() instanceof StepKind.Gate gate && gateEvaluator != null) {
            return gate.loop() != null
                ? runFeedbackLoop(step, gate, stepRequest, state, request)
                : runGate(step, gate.evaluate(), stepRequest, state, request);
        }
        return await(agentExecutor.run(step.agent(), stepRequest));
    }

    /**
     * Judge the step's input; on {@code retry}, have the step's agent revise it with the
     * gate's feedback and judge again.
     */
    private AgentResult runGate(StepDefinition step, GateConfig config, StepRequest stepRequest,
                                FlowRunState state, FlowRequest request) throws Exception {
        String content = stepRequest.userPrompt();
        for (int attempt = 0; ; attempt++) {
            GateResult gate = gateEvaluator.evaluate(config, content, request.userPrompt(), attempt);
            emit("flow.gate.evaluated", request, state, "stepId", step.id(), "attempt", gate.attempts(),
                "score", gate.score(), "passed", gate.passed(), "action", gate.action().value(),
                "error", gate.error());

            switch (gate.action()) {
                case PASSED -> {
                    return AgentResult.of(content);
                }
                case CONTINUED_WITH_WARNING -> {
                    return new AgentResult(content, "Quality gate continued with warning: score %s below threshold %s"
                        .formatted(score(gate.score()), score(config.threshold())), content);
                }
                case HALTED -> throw new GateHaltedException(haltMessage(gate, config));
                case RETRY -> {
                    String revisionPrompt = content + "\n\n" + GateResult.formatFeedbackForRetry(gate);
                    var revision = new StepRequest(revisionPrompt, Map.of("gateAttempt", gate.attempts()),
                        stepRequest.traceId(), stepRequest.requestId());
                    content = await(agentExecutor.run(step.agent(), revision)).content();
                }
            }
        }
    }

    private AgentResult runFeedbackLoop(StepDefinition step, StepKind.Gate gate, StepRequest stepRequest,
                                        FlowRunState state, FlowRequest request) {
        GateConfig config = gate.evaluate();
        var loopConfig = new FeedbackLoop.Config(gate.loop().maxIterations(), gate.loop().targetScore(),
            config.agent(), config.criteria(), FeedbackLoop.Config.DEFAULT_MIN_IMPROVEMENT);
        var loop = new FeedbackLoop(gateEvaluator, new AgentImprovementAgent(agentExecutor, step.agent()));

        FeedbackLoop.Result result = loop.run(loopConfig, stepRequest.userPrompt(), request.userPrompt());
        emit("flow.gate.evaluated", request, state, "stepId", step.id(), "attempt", result.totalIterations(),
            "score", result.finalScore(), "passed", result.success(), "stopReason", result.stopReason().value());

        if (result.success()) {
            return AgentResult.of(result.finalContent());
        }
        String message = "Feedback loop stopped (%s) at score %s, target %s".formatted(
            result.stopReason().value(), score(result.finalScore()), score(loopConfig.targetScore()));
        if (config.onFail() == GateConfig.OnFail.CONTINUE_WITH_WARNING) {
            return new AgentResult(result.finalContent(), message, result.finalContent());
        }
        throw new GateHaltedException(message);
    }

    private static String haltMessage(GateResult gate, GateConfig config) {
        String message = "Quality gate halted at score %s (threshold %s) after %d attempt(s)".formatted(
            score(gate.score()), score(config.threshold()), gate.attempts());
        return gate.error() == null ? message : message + ": " + gate.error();
    }

    private static AgentResult await(CompletableFuture<AgentResult> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception cause ? cause : e;
        }
    }

    private void emit(String event, FlowRequest request, FlowRunState state, Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (state != null) {
            payload.put("flowRunId", state.runId());
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                payload.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        if (request.traceId() != null) {
            payload.put("traceId", request.traceId());
        }
        if (request.requestId() != null) {
            payload.put("requestId", request.requestId());
        }
        try {
            eventLogger.log(event, payload);
        } catch (RuntimeException e) {
            log.warn("Event logger failed on {}: {}", event, e.toString());
        }
    }

    private static ExecutorService newRunPool(String runId, int maxParallelism) {
        var counter = new AtomicInteger();
        String prefix = "flow-" + runId.substring(0, Math.min(8, runId.length())) + "-";
        ThreadFactory threads = task -> {
            Thread thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, maxParallelism), threads);
    }

    private static String errorMessage(Throwable error) {
        Throwable root = unwrap(error);
        return root.getMessage() != null ? root.getMessage() : root.toString();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String score(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
