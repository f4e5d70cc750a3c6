package dev.flows.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs an agent CLI as a child process per invocation. The prompt is written to stdin and the
 * process's stdout becomes the step content. The literal token {@code {agent}} in the command
 * line is replaced with the step's agent reference.
 */
public final class CommandAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandAgentExecutor.class);
    static final String AGENT_PLACEHOLDER = "{agent}";

    private final List<String> command;
    private final Path workingDir; // nullable: inherits the current directory
    private final ExecutorService executor;

    /**
     * @param executor runs each invocation and the task that feeds its stdin, so it needs at
     *                 least two threads per concurrent invocation (a cached pool fits)
     */
    public CommandAgentExecutor(List<String> command, Path workingDir, ExecutorService executor) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Agent command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<AgentResult> run(String agentId, StepRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return invoke(agentId, request);
            } catch (IOException e) {
                throw new CompletionException(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, executor);
    }

    private AgentResult invoke(String agentId, StepRequest request) throws IOException, InterruptedException {
        List<String> resolved = new ArrayList<>(command.size());
        for (String part : command) {
            resolved.add(part.replace(AGENT_PLACEHOLDER, agentId));
        }
        log.debug("Starting agent process for '{}': {}", agentId, resolved);

        var builder = new ProcessBuilder(resolved).redirectError(ProcessBuilder.Redirect.DISCARD);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        if (request.traceId() != null) {
            builder.environment().put("AGENT_FLOWS_TRACE_ID", request.traceId());
        }
        Process process = builder.start();

        // stdin is written while stdout drains; either pipe may fill first.
        byte[] prompt = request.userPrompt().getBytes(StandardCharsets.UTF_8);
        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> writePrompt(process, prompt), executor);

        String stdout;
        try (InputStream out = process.getInputStream()) {
            stdout = new String(out.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            process.destroyForcibly();
            throw e;
        }
        int exitCode = process.waitFor();
        if (exitCode != 0) {
            throw new IOException("Agent process for '%s' exited with code %d".formatted(agentId, exitCode));
        }
        try {
            writer.join();
        } catch (CompletionException e) {
            // The agent finished without consuming all of its input.
            log.debug("Agent '{}' closed stdin early: {}", agentId, e.getCause().getMessage());
        }
        return new AgentResult(stdout.strip(), null, stdout);
    }

    private static void writePrompt(Process process, byte[] prompt) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(prompt);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
