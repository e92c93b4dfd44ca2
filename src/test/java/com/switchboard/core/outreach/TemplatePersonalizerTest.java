package com.switchboard.core.outreach;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TemplatePersonalizer}.
 */
class TemplatePersonalizerTest {

    private final TemplatePersonalizer personalizer = new TemplatePersonalizer();

    private final Lead lead = new Lead("lead-1", "Ana Maria Lima", "ana@example.com", null, "Acme",
            false, false, Map.of("plan", "pro", "company", "Acme Corp"));

    @Test
    @DisplayName("lead fields, attributes and step variables fill placeholders")
    void fillsPlaceholders() {
        String out = personalizer.personalize("Hi {{firstName}} from {{ company }}, your {{plan}} plan ({{product}})",
                lead, Map.of("product", "Switchboard"));

        assertEquals("Hi Ana from Acme Corp, your pro plan (Switchboard)", out);
    }

    @Test
    @DisplayName("step variables win over lead fields")
    void stepVariablesWin() {
        assertEquals("Hi Boss", personalizer.personalize("Hi {{name}}", lead, Map.of("name", "Boss")));
    }

    @Test
    @DisplayName("unknown placeholders are left in place and reported")
    void unknownPlaceholders() {
        String out = personalizer.personalize("Call {{phone}} about {{offer}}", lead, Map.of());

        assertEquals("Call {{phone}} about {{offer}}", out);
        assertEquals(List.of("phone", "offer"), personalizer.unresolved(out));
    }

    @Test
    void replacementsAreLiteral() {
        assertEquals("Price: $5 \\o/", personalizer.personalize("Price: {{price}}", lead,
                Map.of("price", "$5 \\o/")));
    }

    @Test
    void nullTemplateIsEmpty() {
        assertEquals("", personalizer.personalize(null, lead, null));
        assertTrue(personalizer.unresolved(null).isEmpty());
    }
}
