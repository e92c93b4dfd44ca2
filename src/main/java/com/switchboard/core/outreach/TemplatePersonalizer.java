package com.switchboard.core.outreach;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{name}}} placeholders. Lookup order, lowest precedence first: lead fields, lead
 * attributes, step variables. Unknown placeholders are left in place.
 */
@Component
public class TemplatePersonalizer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    public String personalize(String template, Lead lead, Map<String, Object> stepVariables) {
        if (template == null) {
            return "";
        }
        Map<String, Object> variables = variables(lead, stepVariables);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = variables.get(matcher.group(1));
            String replacement = value != null ? value.toString() : matcher.group(0);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public List<String> unresolved(String text) {
        List<String> names = new ArrayList<>();
        if (text == null) {
            return names;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static Map<String, Object> variables(Lead lead, Map<String, Object> stepVariables) {
        Map<String, Object> vars = new LinkedHashMap<>();
        putIfPresent(vars, "leadId", lead.id());
        putIfPresent(vars, "name", lead.name());
        if (lead.name() != null && !lead.name().isBlank()) {
            vars.put("firstName", lead.name().trim().split("\\s+")[0]);
        }
        putIfPresent(vars, "email", lead.email());
        putIfPresent(vars, "phone", lead.phone());
        putIfPresent(vars, "company", lead.company());
        lead.attributes().forEach((k, v) -> putIfPresent(vars, k, v));
        if (stepVariables != null) {
            stepVariables.forEach((k, v) -> putIfPresent(vars, k, v));
        }
        return vars;
    }

    private static void putIfPresent(Map<String, Object> vars, String key, Object value) {
        if (value != null) {
            vars.put(key, value);
        }
    }
}
