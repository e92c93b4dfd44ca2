package com.switchboard.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.registry.UnitRegistry;
import com.switchboard.core.unit.CapabilityUnit;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard execute &lt;unit-id&gt; --payload '{...}'
 */
@Command(name = "execute", mixinStandardHelpOptions = true, description = "Send a command to a unit")
@Component
public class ExecuteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Unit ID, e.g. ORCHESTRATOR")
    private String unitId;

    @Option(names = {"--payload", "-p"}, description = "JSON object payload", defaultValue = "{}")
    private String payload;

    private final UnitRegistry registry;
    private final ObjectMapper objectMapper;

    public ExecuteCommand(UnitRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<CapabilityUnit> unit = registry.resolve(unitId);
        if (unit.isEmpty()) {
            ConsoleOutput.error("Unknown unit: " + unitId);
            return 2;
        }

        Map<String, Object> body;
        try {
            body = objectMapper.readValue(payload, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Payload is not a JSON object: " + e.getOriginalMessage());
            return 2;
        }

        Report report = unit.get().execute(UnitMessage.command("cli", unitId, body));
        ConsoleOutput.report(report);
        return report.isUnsuccessful() ? 1 : 0;
    }
}
