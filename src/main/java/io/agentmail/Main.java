package io.agentmail;

import io.agentmail.cli.AgentMailCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentMailCommand()).execute(args);
        System.exit(code);
    }
}
