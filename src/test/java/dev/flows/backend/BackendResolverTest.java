package dev.flows.backend;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendResolverTest {

    @Test
    void defaultsToEcho() {
        BackendConfig config = BackendResolver.resolve(Map.of(), new Properties(), null);

        assertThat(config).isEqualTo(new BackendConfig.Echo(""));
    }

    @Test
    void environmentWinsOverConfigFile() {
        var named = new Properties();
        named.setProperty(BackendResolver.PROP_BACKEND, "command");
        named.setProperty(BackendResolver.PROP_COMMAND, "from-file");

        BackendConfig config = BackendResolver.resolve(
            Map.of(BackendResolver.ENV_COMMAND, "agent-cli --agent {agent}"), named, Path.of("/work"));

        assertThat(config).isInstanceOfSatisfying(BackendConfig.Command.class, cmd -> {
            assertThat(cmd.command()).containsExactly("agent-cli", "--agent", "{agent}");
            assertThat(cmd.workingDir()).isEqualTo(Path.of("/work"));
        });
    }

    @Test
    void configFileIsUsedWhenEnvironmentIsSilent() {
        var named = new Properties();
        named.setProperty(BackendResolver.PROP_ECHO_PREFIX, "dry-run ");

        assertThat(BackendResolver.resolve(Map.of(BackendResolver.ENV_BACKEND, " "), named, null))
            .isEqualTo(new BackendConfig.Echo("dry-run "));
    }

    @Test
    void commandBackendRequiresACommand() {
        assertThatThrownBy(() -> BackendResolver.resolve(Map.of(BackendResolver.ENV_BACKEND, "command"),
            new Properties(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(BackendResolver.ENV_COMMAND);
    }

    @Test
    void unknownBackendIsRejected() {
        assertThatThrownBy(() -> BackendResolver.resolve(Map.of(BackendResolver.ENV_BACKEND, "carrier-pigeon"),
            new Properties(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown backend 'carrier-pigeon'. Valid backends: echo, command");
    }

    @Test
    void createsMatchingExecutor() {
        var pool = Executors.newSingleThreadExecutor();
        try {
            assertThat(BackendResolver.create(new BackendConfig.Echo(""), pool)).isInstanceOf(EchoAgentExecutor.class);
            assertThat(BackendResolver.create(new BackendConfig.Command(List.of("cat"), null), pool))
                .isInstanceOf(CommandAgentExecutor.class);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void splitsCommandOnWhitespace() {
        assertThat(BackendResolver.splitCommand("  run   --fast  ")).containsExactly("run", "--fast");
    }
}
