package com.switchboard.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.Report;
import com.switchboard.core.outreach.Lead;
import com.switchboard.core.outreach.SequenceDefinition;
import com.switchboard.core.outreach.SequenceEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard sequence &lt;sequence.json&gt; --lead-id ... [--deferred]
 * <p>
 * Reads a sequence document from a file and runs it against the lead described by the options.
 */
@Command(name = "sequence", mixinStandardHelpOptions = true, description = "Run an outreach sequence")
@Component
public class SequenceCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the sequence JSON document")
    private File file;

    @Option(names = "--lead-id", required = true, description = "Lead ID")
    private String leadId;

    @Option(names = "--name", description = "Lead name")
    private String name;

    @Option(names = "--email", description = "Lead email address")
    private String email;

    @Option(names = "--phone", description = "Lead phone number")
    private String phone;

    @Option(names = "--company", description = "Lead company")
    private String company;

    @Option(names = "--deferred", description = "Honour step delays; later steps wait for resume-due")
    private boolean deferred;

    private final SequenceEngine sequenceEngine;
    private final ObjectMapper objectMapper;

    public SequenceCommand(SequenceEngine sequenceEngine, ObjectMapper objectMapper) {
        this.sequenceEngine = sequenceEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SequenceDefinition definition;
        try {
            definition = objectMapper.readValue(file, SequenceDefinition.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read sequence " + file + ": " + e.getMessage());
            return 2;
        }

        Lead lead = new Lead(leadId, name, email, phone, company, false, false, Map.of());
        ConsoleOutput.info("Running " + definition.sequenceId() + " for lead " + leadId
                + (deferred ? " (deferred)" : ""));

        Report report = deferred
                ? sequenceEngine.startSequence(definition, lead)
                : sequenceEngine.executeSequence(definition, lead);
        ConsoleOutput.report(report);
        return report.isUnsuccessful() ? 1 : 0;
    }
}
