package dev.flows;

import dev.flows.cli.FlowsCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = FlowsCli.commandLine(System.getenv()).execute(args);
        System.exit(exitCode);
    }
}
