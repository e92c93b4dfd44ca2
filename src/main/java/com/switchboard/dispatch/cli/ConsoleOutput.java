package com.switchboard.dispatch.cli;

import com.switchboard.core.model.Report;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Switchboard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWITCHBOARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHBOARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void report(Report report) {
        String status = switch (report.status()) {
            case COMPLETED -> "@|fg(green),bold COMPLETED|@";
            case PENDING -> "@|fg(cyan),bold PENDING|@";
            case BLOCKED -> "@|fg(yellow),bold BLOCKED|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold [" + report.unitId() + "]|@ " + status + " " + report.taskId()));
        if (report.reason() != null) {
            System.out.println("  reason: " + report.reason());
        }
        for (Map.Entry<String, Object> entry : report.data().entrySet()) {
            if (!"reason".equals(entry.getKey())) {
                System.out.println("  " + entry.getKey() + ": " + entry.getValue());
            }
        }
        for (String error : report.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + error));
        }
    }
}
