package dev.flows.backend;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolved agent backend. Each form carries only the fields it needs.
 */
public sealed interface BackendConfig {

    String name();

    /** Deterministic echo, no I/O. */
    record Echo(String prefix) implements BackendConfig {
        @Override
        public String name() { return "echo"; }
    }

    /** Agent CLI spawned as a child process. */
    record Command(List<String> command, Path workingDir) implements BackendConfig {
        public Command {
            command = command == null ? List.of() : List.copyOf(command);
        }

        @Override
        public String name() { return "command"; }
    }
}
