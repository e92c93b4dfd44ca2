package com.switchboard.core.health;

import com.switchboard.core.control.SwarmControl;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.registry.UnitId;
import com.switchboard.core.registry.UnitRegistry;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreException;
import com.switchboard.core.unit.CapabilityUnit;
import com.switchboard.core.unit.RecordingUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private SharedStore store;
    private UnitRegistry registry;
    private SwarmControl swarmControl;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        store = mock(SharedStore.class);
        registry = mock(UnitRegistry.class);
        swarmControl = new SwarmControl();
        when(store.backend()).thenReturn("memory");
        when(store.query(anyString(), any())).thenReturn(List.of());
        service = new HealthCheckService(store, registry, swarmControl);
    }

    private static List<CapabilityUnit> units(UnitId... ids) {
        return Arrays.stream(ids)
                .map(id -> (CapabilityUnit) new RecordingUnit(id.name(), id.identity().status(), id.identity().reportsTo()))
                .toList();
    }

    private HealthStatus component(String name) {
        return service.checkAll().stream()
                .filter(s -> name.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns store, registry and swarm components")
    void checkAllReturnsAllComponents() {
        when(registry.all()).thenReturn(List.of());

        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("store", "registry", "swarm"), components);
    }

    @Test
    @DisplayName("Store reachable -> store UP with backend")
    void storeUp() {
        when(registry.all()).thenReturn(List.of());

        HealthStatus status = component("store");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("memory", status.metadata().get("backend"));
    }

    @Test
    @DisplayName("Store error -> store DOWN")
    void storeDown() {
        when(registry.all()).thenReturn(List.of());
        when(store.query(anyString(), any())).thenThrow(new StoreException("connection refused"));

        HealthStatus status = component("store");
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("Full catalog registered -> registry UP")
    void registryUp() {
        when(registry.all()).thenReturn(units(UnitId.values()));
        when(registry.listIds(UnitRole.SUPERVISOR)).thenReturn(List.of("ORCHESTRATOR", "OUTREACH_MANAGER", "CONTENT_MANAGER"));

        HealthStatus status = component("registry");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("3", status.metadata().get("supervisors"));
        long executable = Arrays.stream(UnitId.values()).filter(id -> id.identity().status().isExecutable()).count();
        assertEquals(String.valueOf(executable), status.metadata().get("executable"));
    }

    @Test
    @DisplayName("Missing units -> registry DEGRADED")
    void registryDegraded() {
        when(registry.all()).thenReturn(units(UnitId.ORCHESTRATOR, UnitId.EMAIL_CHANNEL));

        HealthStatus status = component("registry");
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertTrue(status.detail().startsWith("2 of "));
    }

    @Test
    @DisplayName("Global pause -> swarm DEGRADED")
    void swarmPaused() {
        when(registry.all()).thenReturn(List.of());
        assertEquals(HealthStatus.Status.UP, component("swarm").status());

        swarmControl.pauseAll("maintenance");
        assertEquals(HealthStatus.Status.DEGRADED, component("swarm").status());
    }
}
