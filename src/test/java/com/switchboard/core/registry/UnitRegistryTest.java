package com.switchboard.core.registry;

import com.switchboard.core.SwarmFixture;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.model.UnitStatus;
import com.switchboard.core.supervisor.ContentSupervisor;
import com.switchboard.core.supervisor.OrchestratorSupervisor;
import com.switchboard.core.unit.CapabilityUnit;
import com.switchboard.core.unit.PlaceholderUnit;
import com.switchboard.core.unit.RecordingUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link UnitRegistry}.
 */
class UnitRegistryTest {

    private SwarmFixture fixture;
    private ContentSupervisor content;
    private OrchestratorSupervisor orchestrator;
    private PlaceholderUnit copywriter;
    private PlaceholderUnit subjectLines;

    @BeforeEach
    void setUp() {
        fixture = new SwarmFixture();
        content = new ContentSupervisor(fixture.context);
        orchestrator = new OrchestratorSupervisor(fixture.context);
        copywriter = new PlaceholderUnit(UnitId.COPYWRITER.identity());
        subjectLines = new PlaceholderUnit(UnitId.SUBJECT_LINE_WRITER.identity());
    }

    private UnitRegistry registry() {
        // deliberately out of catalog order
        return new UnitRegistry(List.of(subjectLines, copywriter, content, orchestrator));
    }

    // -- construction ------------------------------------------------------

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("units are ordered by catalog declaration")
        void orderedByCatalog() {
            assertEquals(List.of("ORCHESTRATOR", "CONTENT_MANAGER", "COPYWRITER", "SUBJECT_LINE_WRITER"),
                    registry().listIds());
        }

        @Test
        @DisplayName("each unit is handed to the supervisor it reports to")
        void wiresOwners() {
            registry();

            List<String> contentUnits = content.units().stream().map(CapabilityUnit::id).toList();
            assertEquals(List.of("COPYWRITER", "SUBJECT_LINE_WRITER"), contentUnits);
            assertEquals(List.of("CONTENT_MANAGER"),
                    orchestrator.units().stream().map(CapabilityUnit::id).toList());
        }

        @Test
        @DisplayName("every unit is initialized once")
        void initializesUnits() {
            RecordingUnit email = new RecordingUnit("EMAIL_CHANNEL", UnitStatus.OPERATIONAL, "OUTREACH_MANAGER");

            UnitRegistry registry = new UnitRegistry(List.of(content, email));

            assertTrue(content.isInitialized());
            assertEquals(1, email.initializations());
            assertEquals(2, registry.all().size());
        }

        @Test
        @DisplayName("an id outside the catalog is rejected")
        void unknownId() {
            RecordingUnit rogue = new RecordingUnit("ROGUE", UnitStatus.OPERATIONAL, null);

            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> new UnitRegistry(List.of(rogue)));
            assertTrue(ex.getMessage().contains("ROGUE"));
        }

        @Test
        @DisplayName("two units with the same id are rejected")
        void duplicateId() {
            PlaceholderUnit again = new PlaceholderUnit(UnitId.COPYWRITER.identity());

            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> new UnitRegistry(List.of(copywriter, again)));
            assertTrue(ex.getMessage().startsWith("Duplicate unit id"));
        }
    }

    // -- lookup ------------------------------------------------------------

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void resolvesKnownUnit() {
            assertSame(copywriter, registry().resolve("COPYWRITER").orElseThrow());
        }

        @Test
        void unknownOrNullIsEmpty() {
            UnitRegistry registry = registry();
            assertTrue(registry.resolve("NOPE").isEmpty());
            assertTrue(registry.resolve(null).isEmpty());
            // a valid catalog id that was not registered
            assertTrue(registry.resolve("SMS_CHANNEL").isEmpty());
        }

        @Test
        void validIdsComeFromTheCatalog() {
            UnitRegistry registry = registry();
            assertTrue(registry.isValidId("PHONE_CHANNEL"));
            assertFalse(registry.isValidId("phone_channel"));
            assertFalse(registry.isValidId(" "));
        }

        @Test
        void listsByRole() {
            UnitRegistry registry = registry();
            assertEquals(List.of("ORCHESTRATOR", "CONTENT_MANAGER"), registry.listIds(UnitRole.SUPERVISOR));
            assertEquals(List.of("COPYWRITER", "SUBJECT_LINE_WRITER"), registry.listIds(UnitRole.LEAF));
            assertEquals(4, registry.listIds(null).size());
        }
    }
}
