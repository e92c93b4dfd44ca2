package com.switchboard.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_ERROR = 1;

    private final SwitchboardCommand switchboardCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwitchboardCommand switchboardCommand, IFactory factory) {
        this.switchboardCommand = switchboardCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli would return at once.
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = commandLine(switchboardCommand, factory).execute(args);
    }

    /**
     * Builds the command line used by the runner. Exceptions escaping a command are reported on
     * the console and mapped to exit code 1 instead of a stack trace.
     */
    static CommandLine commandLine(SwitchboardCommand command, IFactory factory) {
        CommandLine commandLine = new CommandLine(command, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.debug("Command {} failed", cmd.getCommandName(), ex);
            ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
            return EXIT_ERROR;
        });
        return commandLine;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
