package com.switchboard.core.health;

import com.switchboard.core.control.SwarmControl;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.registry.UnitId;
import com.switchboard.core.registry.UnitRegistry;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreQuery;
import com.switchboard.core.unit.CapabilityUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SharedStore store;
    private final UnitRegistry registry;
    private final SwarmControl swarmControl;

    public HealthCheckService(SharedStore store, UnitRegistry registry, SwarmControl swarmControl) {
        this.store = store;
        this.registry = registry;
        this.swarmControl = swarmControl;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkRegistry());
        results.add(checkSwarm());
        return results;
    }

    private HealthStatus checkStore() {
        try {
            store.query("health", StoreQuery.builder().limit(1).build());
            return new HealthStatus("store", HealthStatus.Status.UP,
                    "Shared store reachable (" + store.backend() + ")", Map.of("backend", store.backend()));
        } catch (Exception e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of("backend", store.backend()));
        }
    }

    private HealthStatus checkRegistry() {
        List<CapabilityUnit> units = registry.all();
        long executable = units.stream().filter(u -> u.status().isExecutable()).count();
        int supervisors = registry.listIds(UnitRole.SUPERVISOR).size();
        Map<String, String> metadata = Map.of(
                "units", String.valueOf(units.size()),
                "executable", String.valueOf(executable),
                "supervisors", String.valueOf(supervisors));

        if (units.size() < UnitId.values().length) {
            return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                    units.size() + " of " + UnitId.values().length + " catalogued units registered", metadata);
        }
        return new HealthStatus("registry", HealthStatus.Status.UP,
                units.size() + " units registered, " + executable + " executable", metadata);
    }

    private HealthStatus checkSwarm() {
        if (swarmControl.isGloballyPaused()) {
            return new HealthStatus("swarm", HealthStatus.Status.DEGRADED, "Swarm is paused", Map.of());
        }
        return new HealthStatus("swarm", HealthStatus.Status.UP, "Swarm running", Map.of());
    }
}
