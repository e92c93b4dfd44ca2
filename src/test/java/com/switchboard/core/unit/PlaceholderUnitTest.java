package com.switchboard.core.unit;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.ReportStatus;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.model.UnitStatus;
import com.switchboard.core.registry.UnitId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AbstractCapabilityUnit} and {@link PlaceholderUnit}.
 */
class PlaceholderUnitTest {

    private static UnitIdentity identity(UnitStatus status) {
        return new UnitIdentity("EMAIL_CHANNEL", "Email", UnitRole.LEAF, status, "OUTREACH_MANAGER", Set.of());
    }

    @Test
    @DisplayName("placeholders must not claim to be executable")
    void rejectsExecutableStatus() {
        assertThrows(IllegalArgumentException.class, () -> new PlaceholderUnit(identity(UnitStatus.OPERATIONAL)));
    }

    @Test
    @DisplayName("calling a non-executable unit directly fails without running it")
    void directCallFails() {
        PlaceholderUnit unit = new PlaceholderUnit(UnitId.LINKEDIN_CHANNEL.identity());

        Report report = unit.execute(UnitMessage.command("TEST", "LINKEDIN_CHANNEL", Map.of()));

        assertEquals(ReportStatus.FAILED, report.status());
        assertEquals("Unit LINKEDIN_CHANNEL is STUB and cannot execute", report.errors().get(0));
        assertEquals(ReportStatus.FAILED, unit.handleSignal(Signal.of("ping", "TEST", Map.of())).status());
        assertFalse(unit.selfReport().hasRealLogic());
    }

    @Test
    @DisplayName("exceptions thrown by a unit become FAILED reports")
    void exceptionsBecomeFailedReports() {
        AbstractCapabilityUnit unit = new AbstractCapabilityUnit(identity(UnitStatus.OPERATIONAL)) {
            @Override
            protected Report doExecute(UnitMessage message) {
                throw new IllegalStateException("template missing");
            }
        };

        Report report = unit.execute(UnitMessage.command("TEST", "EMAIL_CHANNEL", Map.of()));

        assertEquals(ReportStatus.FAILED, report.status());
        assertEquals("IllegalStateException: template missing", report.errors().get(0));
    }

    @Test
    void initializeRunsOnce() {
        int[] calls = {0};
        AbstractCapabilityUnit unit = new AbstractCapabilityUnit(identity(UnitStatus.VERIFIED)) {
            @Override
            protected void onInitialize() {
                calls[0]++;
            }

            @Override
            protected Report doExecute(UnitMessage message) {
                return Report.completed(message.id(), id(), Map.of());
            }
        };

        unit.initialize();
        unit.initialize();

        assertEquals(1, calls[0]);
        assertTrue(unit.isInitialized());
        assertEquals(ReportStatus.COMPLETED,
                unit.handleSignal(Signal.of("ping", "TEST", Map.of())).status());
    }
}
