package com.switchboard.core.outreach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryStepTrigger implements StepTrigger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStepTrigger.class);

    private final Map<String, ScheduledStep> scheduled = new ConcurrentHashMap<>();

    @Override
    public void schedule(ScheduledStep step) {
        scheduled.put(key(step.sequenceId(), step.leadId()), step);
        log.debug("Scheduled step {} of {} for {} at {}", step.stepNumber(), step.sequenceId(), step.leadId(), step.dueAt());
    }

    @Override
    public List<ScheduledStep> takeDue(Instant now) {
        List<ScheduledStep> due = new ArrayList<>();
        for (var entry : scheduled.entrySet()) {
            if (!entry.getValue().dueAt().isAfter(now) && scheduled.remove(entry.getKey(), entry.getValue())) {
                due.add(entry.getValue());
            }
        }
        due.sort(Comparator.comparing(ScheduledStep::dueAt));
        return due;
    }

    @Override
    public boolean cancel(String sequenceId, String leadId) {
        ScheduledStep removed = scheduled.remove(key(sequenceId, leadId));
        if (removed != null) {
            log.debug("Cancelled step {} of {} for {}", removed.stepNumber(), sequenceId, leadId);
        }
        return removed != null;
    }

    @Override
    public List<ScheduledStep> pending() {
        List<ScheduledStep> all = new ArrayList<>(scheduled.values());
        all.sort(Comparator.comparing(ScheduledStep::dueAt));
        return all;
    }

    private static String key(String sequenceId, String leadId) {
        return sequenceId + "|" + leadId;
    }
}
