package dev.flows.backend;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;

/**
 * Picks the agent backend from layered configuration: environment variables first, then the
 * named configuration (a properties file), then the built-in default.
 */
public final class BackendResolver {

    public static final String ENV_BACKEND = "AGENT_FLOWS_BACKEND";
    public static final String ENV_COMMAND = "AGENT_FLOWS_COMMAND";
    public static final String ENV_ECHO_PREFIX = "AGENT_FLOWS_ECHO_PREFIX";

    public static final String PROP_BACKEND = "backend";
    public static final String PROP_COMMAND = "command";
    public static final String PROP_ECHO_PREFIX = "echo.prefix";

    public static final String DEFAULT_BACKEND = "echo";

    private BackendResolver() {}

    /**
     * Resolve the backend configuration.
     *
     * @param env        environment variables (usually {@code System.getenv()})
     * @param named      named configuration, may be empty
     * @param workingDir working directory for process backends, nullable
     */
    public static BackendConfig resolve(Map<String, String> env, Properties named, Path workingDir) {
        String backend = pick(env.get(ENV_BACKEND), named.getProperty(PROP_BACKEND), DEFAULT_BACKEND);

        return switch (backend) {
            case "echo" -> new BackendConfig.Echo(
                pick(env.get(ENV_ECHO_PREFIX), named.getProperty(PROP_ECHO_PREFIX), ""));
            case "command" -> {
                String command = pick(env.get(ENV_COMMAND), named.getProperty(PROP_COMMAND), null);
                if (command == null) {
                    throw new IllegalArgumentException(
                        "Backend 'command' requires %s or '%s' in the configuration file"
                            .formatted(ENV_COMMAND, PROP_COMMAND));
                }
                yield new BackendConfig.Command(splitCommand(command), workingDir);
            }
            default -> throw new IllegalArgumentException(
                "Unknown backend '%s'. Valid backends: echo, command".formatted(backend));
        };
    }

    /**
     * Build the executor for a resolved configuration.
     */
    public static AgentExecutor create(BackendConfig config, ExecutorService executor) {
        if (config instanceof BackendConfig.Echo echo) {
            return new EchoAgentExecutor(echo.prefix());
        }
        if (config instanceof BackendConfig.Command cmd) {
            return new CommandAgentExecutor(cmd.command(), cmd.workingDir(), executor);
        }
        throw new IllegalArgumentException("Unsupported backend: " + config);
    }

    static List<String> splitCommand(String command) {
        return Arrays.stream(command.trim().split("\\s+"))
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static String pick(String fromEnv, String fromNamed, String fallback) {
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        if (fromNamed != null && !fromNamed.isBlank()) {
            return fromNamed.trim();
        }
        return fallback;
    }
}
