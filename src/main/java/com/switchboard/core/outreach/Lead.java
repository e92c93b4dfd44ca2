package com.switchboard.core.outreach;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The target of a sequence.
 *
 * @param doNotContact true when the CRM already flags the lead; the suppression list is checked too
 * @param unsubscribed true when the CRM already records an unsubscribe
 * @param attributes   free-form fields available to templates
 */
public record Lead(
    String id,
    String name,
    String email,
    String phone,
    String company,
    boolean doNotContact,
    boolean unsubscribed,
    Map<String, Object> attributes
) {

    public Lead {
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    public static Lead of(String id, String name, String email, String phone) {
        return new Lead(id, name, email, phone, null, false, false, Map.of());
    }
}
