package com.switchboard.dispatch.cli;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.registry.UnitRegistry;
import com.switchboard.core.supervisor.Supervisor;
import com.switchboard.core.unit.CapabilityUnit;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard cycle [supervisor-id...]
 * <p>
 * Runs one operating cycle (mutations, then incoming requests) on the named supervisors, or on
 * every supervisor when none is named.
 */
@Command(name = "cycle", mixinStandardHelpOptions = true, description = "Run a supervisor cycle")
@Component
public class CycleCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Supervisor IDs (default: all)")
    private List<String> supervisorIds;

    private final UnitRegistry registry;

    public CycleCommand(UnitRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<String> targets = supervisorIds == null || supervisorIds.isEmpty()
                ? registry.listIds(UnitRole.SUPERVISOR)
                : supervisorIds;

        int exit = 0;
        for (String id : targets) {
            Optional<CapabilityUnit> unit = registry.resolve(id);
            if (unit.isEmpty() || !(unit.get() instanceof Supervisor supervisor)) {
                ConsoleOutput.error(id + " is not a registered supervisor");
                exit = 2;
                continue;
            }
            Report report = supervisor.runCycle();
            ConsoleOutput.report(report);
            if (report.isUnsuccessful()) {
                exit = Math.max(exit, 1);
            }
        }
        return exit;
    }
}
