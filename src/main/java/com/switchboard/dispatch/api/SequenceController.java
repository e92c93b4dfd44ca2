package com.switchboard.dispatch.api;

import com.switchboard.core.model.Report;
import com.switchboard.core.outreach.SequenceEngine;
import com.switchboard.core.outreach.SequenceExecution;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for outreach sequences.
 */
@RestController
@RequestMapping("/api/v1/sequences")
public class SequenceController {

    private final SequenceEngine sequenceEngine;

    public SequenceController(SequenceEngine sequenceEngine) {
        this.sequenceEngine = sequenceEngine;
    }

    /**
     * POST /api/v1/sequences/execute
     */
    @PostMapping("/execute")
    public ResponseEntity<?> execute(@RequestBody SequenceRequest request) {
        if (request.sequence() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "sequence is required"));
        }
        if (request.lead() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "lead is required"));
        }
        Report report = Boolean.TRUE.equals(request.deferred())
                ? sequenceEngine.startSequence(request.sequence(), request.lead())
                : sequenceEngine.executeSequence(request.sequence(), request.lead());
        return ResponseEntity.ok(report);
    }

    /**
     * POST /api/v1/sequences/resume-due
     */
    @PostMapping("/resume-due")
    public ResponseEntity<List<Report>> resumeDue() {
        return ResponseEntity.ok(sequenceEngine.resumeDue());
    }

    /**
     * GET /api/v1/sequences/{sequenceId}/leads/{leadId}
     */
    @GetMapping("/{sequenceId}/leads/{leadId}")
    public ResponseEntity<?> execution(@PathVariable String sequenceId, @PathVariable String leadId) {
        Optional<SequenceExecution> execution = sequenceEngine.execution(sequenceId, leadId);
        if (execution.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error",
                    "No execution for sequence " + sequenceId + " and lead " + leadId));
        }
        return ResponseEntity.ok(execution.get());
    }
}
