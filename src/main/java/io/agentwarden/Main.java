package io.agentwarden;

import io.agentwarden.cli.AgentWardenCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentWardenCommand()).execute(args);
        System.exit(code);
    }
}
