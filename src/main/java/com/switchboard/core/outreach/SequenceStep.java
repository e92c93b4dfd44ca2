package com.switchboard.core.outreach;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a sequence.
 *
 * @param stepNumber         1-based position, strictly increasing within a sequence
 * @param channel            primary channel
 * @param delayHours         hours to wait after the previous step before this one is due
 * @param template           message template with {@code {{name}}} placeholders
 * @param variables          step-level template variables; these win over lead fields
 * @param fallbackChannel    channel tried when the primary attempt FAILS, or null
 * @param fallbackDelayHours recorded with the step; the fallback itself is attempted immediately
 */
public record SequenceStep(
    int stepNumber,
    Channel channel,
    int delayHours,
    String template,
    Map<String, Object> variables,
    Channel fallbackChannel,
    Integer fallbackDelayHours
) {

    public SequenceStep {
        variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
    }

    public static SequenceStep of(int stepNumber, Channel channel, String template) {
        return new SequenceStep(stepNumber, channel, 0, template, Map.of(), null, null);
    }
}
