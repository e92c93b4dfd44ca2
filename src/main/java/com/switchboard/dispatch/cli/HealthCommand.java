package com.switchboard.dispatch.cli;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard health
 * <p>
 * Exits 1 when any component is DOWN. DEGRADED components are listed but do not fail the check.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<String> down = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    degraded.add(check.component());
                }
                case DOWN -> {
                    ConsoleOutput.error(label);
                    down.add(check.component());
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (!down.isEmpty()) {
            ConsoleOutput.error("Overall: down (" + String.join(", ", down) + ")");
            return 1;
        }
        if (!degraded.isEmpty()) {
            ConsoleOutput.warn("Overall: degraded (" + String.join(", ", degraded) + ")");
        } else {
            ConsoleOutput.success("Overall: operational");
        }
        return 0;
    }
}
