package com.switchboard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Switchboard.
 */
@Command(
        name = "switchboard",
        mixinStandardHelpOptions = true,
        version = "Switchboard 0.1.0",
        description = "Supervisor/specialist orchestration with an outreach sequence engine",
        subcommands = {
                UnitsCommand.class,
                ExecuteCommand.class,
                SequenceCommand.class,
                CycleCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchboardCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Usage from the parsed command model so subcommands keep the factory that built them
        spec.commandLine().usage(System.out);
    }
}
