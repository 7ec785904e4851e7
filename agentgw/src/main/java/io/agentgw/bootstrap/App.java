package io.agentgw.bootstrap;

import io.agentgw.cli.AgentGatewayCommand;
import picocli.CommandLine;

public final class App {
    private App() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentGatewayCommand()).execute(args);
        System.exit(code);
    }
}
