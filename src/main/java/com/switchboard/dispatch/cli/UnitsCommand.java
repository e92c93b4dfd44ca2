package com.switchboard.dispatch.cli;

import com.switchboard.core.model.UnitRole;
import com.switchboard.core.registry.UnitRegistry;
import com.switchboard.core.unit.CapabilityUnit;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Locale;

/**
 * CLI command: switchboard units [--role SUPERVISOR|LEAF]
 */
@Command(name = "units", mixinStandardHelpOptions = true, description = "List registered units")
@Component
public class UnitsCommand implements Runnable {

    @Option(names = {"--role", "-r"}, description = "Only units with this role (SUPERVISOR or LEAF)")
    private String role;

    private final UnitRegistry registry;

    public UnitsCommand(UnitRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        UnitRole filter = null;
        if (role != null) {
            try {
                filter = UnitRole.valueOf(role.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Unknown role: " + role);
                return;
            }
        }

        System.out.printf("  %-22s %-11s %-14s %s%n", "UNIT", "ROLE", "STATUS", "REPORTS TO");
        System.out.println("  " + "-".repeat(64));
        for (String id : registry.listIds(filter)) {
            CapabilityUnit unit = registry.resolve(id).orElseThrow();
            System.out.printf("  %-22s %-11s %-14s %s%n", id, unit.identity().role(), unit.status(),
                    unit.identity().reportsTo() != null ? unit.identity().reportsTo() : "-");
        }
    }
}
