package com.switchboard.dispatch.api;

import com.switchboard.core.model.MutationDirective;
import com.switchboard.core.mutation.MutationPipeline;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StorePriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for submitting mutation directives.
 */
@RestController
@RequestMapping("/api/v1/directives")
public class DirectiveController {

    private static final Logger log = LoggerFactory.getLogger(DirectiveController.class);

    private final MutationPipeline mutationPipeline;

    public DirectiveController(MutationPipeline mutationPipeline) {
        this.mutationPipeline = mutationPipeline;
    }

    /**
     * POST /api/v1/directives. The directive is applied on its owner's next cycle.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody DirectiveRequest request) {
        if (request.type() == null || request.type().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "type is required"));
        }
        MutationDirective directive;
        StorePriority priority;
        try {
            priority = request.priority() != null
                    ? StorePriority.valueOf(request.priority().toUpperCase(Locale.ROOT))
                    : StorePriority.MEDIUM;
            directive = new MutationDirective(
                    request.id() != null ? request.id() : "directive_" + UUID.randomUUID(),
                    request.type().toUpperCase(Locale.ROOT),
                    request.targetDomain(),
                    request.parameters(),
                    request.reason(),
                    request.confidence() != null ? request.confidence() : 50,
                    request.sourceAgent() != null ? request.sourceAgent() : "api");
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        StoreEntry entry = mutationPipeline.submit(directive, priority);
        log.info("Accepted directive {} ({})", directive.id(), directive.type());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("directiveId", directive.id());
        body.put("type", directive.type());
        body.put("processed", entry.booleanValue("processed"));
        body.put("version", entry.version());
        return ResponseEntity.accepted().body(body);
    }
}
