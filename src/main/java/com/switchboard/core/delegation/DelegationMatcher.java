package com.switchboard.core.delegation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.DelegationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the unit a message should be delegated to from a supervisor's rules.
 * <p>
 * The payload is rendered to lower-case JSON and each rule's keywords are searched for as
 * substrings. Rules are tried in descending priority; {@link List#sort} is stable, so on equal
 * priority the rule declared first wins.
 */
@Component
public class DelegationMatcher {

    private static final Logger log = LoggerFactory.getLogger(DelegationMatcher.class);

    private final ObjectMapper objectMapper;

    public DelegationMatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<String> resolve(List<DelegationRule> rules, Map<String, Object> payload) {
        if (rules == null || rules.isEmpty()) {
            return Optional.empty();
        }
        String text = searchableText(payload);

        List<DelegationRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingInt(DelegationRule::priority).reversed());

        for (DelegationRule rule : ordered) {
            for (String keyword : rule.triggerKeywords()) {
                if (!keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                    log.debug("Keyword '{}' matched rule for {}", keyword, rule.delegateTo());
                    return Optional.of(rule.delegateTo());
                }
            }
        }
        return Optional.empty();
    }

    private String searchableText(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(payload).toLowerCase(Locale.ROOT);
        } catch (JsonProcessingException e) {
            log.debug("Payload not serializable as JSON, matching on toString(): {}", e.getMessage());
            return payload.toString().toLowerCase(Locale.ROOT);
        }
    }
}
