package com.switchboard.dispatch.api;

import com.switchboard.core.model.MessageType;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.Urgency;
import com.switchboard.core.registry.UnitRegistry;
import com.switchboard.core.supervisor.Supervisor;
import com.switchboard.core.unit.CapabilityUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for the unit catalog and for sending work to units.
 */
@RestController
@RequestMapping("/api/v1/units")
public class UnitController {

    private static final Logger log = LoggerFactory.getLogger(UnitController.class);

    private final UnitRegistry registry;

    public UnitController(UnitRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/v1/units
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listUnits() {
        return ResponseEntity.ok(registry.all().stream().map(UnitController::describe).toList());
    }

    /**
     * GET /api/v1/units/{id}. Supervisors include their capability report.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getUnit(@PathVariable String id) {
        Optional<CapabilityUnit> unit = registry.resolve(id);
        if (unit.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "Unknown unit: " + id));
        }
        Map<String, Object> body = describe(unit.get());
        body.put("selfReport", unit.get().selfReport());
        if (unit.get() instanceof Supervisor supervisor) {
            body.put("capabilityReport", supervisor.capabilityReport());
            body.put("pendingRequests", supervisor.pendingRequests());
        }
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/units/{id}/execute. The report is returned with 200 whatever its status.
     */
    @PostMapping("/{id}/execute")
    public ResponseEntity<?> execute(@PathVariable String id, @RequestBody ExecuteRequest request) {
        Optional<CapabilityUnit> unit = registry.resolve(id);
        if (unit.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "Unknown unit: " + id));
        }
        Urgency priority;
        try {
            priority = request.priority() != null
                    ? Urgency.valueOf(request.priority().toUpperCase(Locale.ROOT))
                    : Urgency.NORMAL;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid priority: " + request.priority()));
        }
        if (!unit.get().status().isExecutable()) {
            return ResponseEntity.status(409).body(Map.of("error",
                    "Unit " + id + " is " + unit.get().status() + " and cannot execute"));
        }

        String messageId = "api_" + UUID.randomUUID();
        UnitMessage message = new UnitMessage(messageId, MessageType.COMMAND,
                request.from() != null ? request.from() : "api", id, request.payload(),
                priority, true, messageId, Instant.now());
        log.info("Executing {} on {}", messageId, id);
        Report report = unit.get().execute(message);
        return ResponseEntity.ok(report);
    }

    /**
     * POST /api/v1/units/{id}/cycle. Supervisors only.
     */
    @PostMapping("/{id}/cycle")
    public ResponseEntity<?> cycle(@PathVariable String id) {
        Optional<CapabilityUnit> unit = registry.resolve(id);
        if (unit.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "Unknown unit: " + id));
        }
        if (!(unit.get() instanceof Supervisor supervisor)) {
            return ResponseEntity.badRequest().body(Map.of("error", id + " is not a supervisor"));
        }
        return ResponseEntity.ok(supervisor.runCycle());
    }

    private static Map<String, Object> describe(CapabilityUnit unit) {
        UnitIdentity identity = unit.identity();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", identity.id());
        map.put("displayName", identity.displayName());
        map.put("role", identity.role().name());
        map.put("status", identity.status().name());
        map.put("reportsTo", identity.reportsTo());
        map.put("capabilities", identity.capabilities().stream().sorted().toList());
        return map;
    }
}
