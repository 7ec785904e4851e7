package io.agentgw.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "agentgw",
        mixinStandardHelpOptions = true,
        versionProvider = GatewayCommand.VersionProvider.class,
        description = "Agent gateway CLI",
        subcommands = {
                GatewayCommand.class
        }
)
public final class AgentGatewayCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: gateway");
    }
}
