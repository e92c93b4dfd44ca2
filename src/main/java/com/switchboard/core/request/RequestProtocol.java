package com.switchboard.core.request;

import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.CrossSupervisorRequest;
import com.switchboard.core.model.MessageType;
import com.switchboard.core.model.RequestReceipt;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.Urgency;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.store.StoreQuery;
import com.switchboard.core.store.WriteOptions;
import com.switchboard.core.transport.MessageTransport;
import com.switchboard.core.transport.TransportAck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request/response channel between supervisors.
 * <p>
 * A request goes out over the {@link MessageTransport} and is also mirrored into the store under
 * {@code xreq_<messageId>}. Receivers read unresponded mirrors at the start of every cycle, so a
 * missed transport delivery never loses a request.
 */
@Service
public class RequestProtocol {

    private static final Logger log = LoggerFactory.getLogger(RequestProtocol.class);

    static final String REQUEST_TAG = "cross-supervisor-request";
    static final String KEY_PREFIX = "xreq_";

    private final MessageTransport transport;
    private final SharedStore store;
    private final SwitchboardMetrics metrics;
    private final Clock clock;

    public RequestProtocol(MessageTransport transport, SharedStore store, SwitchboardMetrics metrics, Clock clock) {
        this.transport = transport;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RequestReceipt requestFromSupervisor(CrossSupervisorRequest request) {
        if (request.fromSupervisor() == null || request.toSupervisor() == null) {
            return RequestReceipt.failed("Request needs both fromSupervisor and toSupervisor");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestType", request.requestType());
        payload.put("description", request.description());
        payload.put("urgency", request.urgency().name());
        payload.put("payload", request.payload());
        if (request.deadline() != null) {
            payload.put("deadline", request.deadline().toString());
        }
        UnitMessage message = transport
                .createMessage(MessageType.COMMAND, request.fromSupervisor(), request.toSupervisor(), payload)
                .withPriority(request.urgency());

        boolean delivered = false;
        try {
            TransportAck ack = transport.send(message);
            delivered = ack.delivered();
            if (!delivered) {
                log.warn("Request {} to {} not delivered ({}); relying on store pickup",
                        message.id(), request.toSupervisor(), ack.reason());
            }
        } catch (RuntimeException e) {
            log.warn("Transport failed for request {} to {}: {}", message.id(), request.toSupervisor(), e.getMessage());
        }

        String key = KEY_PREFIX + message.id();
        try {
            store.write(StoreCategory.CROSS_AGENT, key, mirrorValue(request, key), request.fromSupervisor(),
                    WriteOptions.of(StorePriority.fromUrgency(request.urgency()), REQUEST_TAG, "to:" + request.toSupervisor()));
        } catch (RuntimeException e) {
            log.error("Could not mirror request {} from {}: {}", key, request.fromSupervisor(), e.getMessage(), e);
            metrics.recordCrossSupervisorRequest(request.requestType(), delivered);
            return new RequestReceipt(false, null, delivered, e.getMessage());
        }
        metrics.recordCrossSupervisorRequest(request.requestType(), delivered);
        log.info("{} requested {} from {} ({})", request.fromSupervisor(), request.requestType(), request.toSupervisor(), key);
        return new RequestReceipt(true, key, delivered, null);
    }

    /**
     * Unresponded requests addressed to the supervisor, highest priority first.
     */
    public List<CrossSupervisorRequest> readIncomingRequests(String supervisorId) {
        List<StoreEntry> entries = store.query(supervisorId, StoreQuery.builder()
                .category(StoreCategory.CROSS_AGENT)
                .tags("to:" + supervisorId)
                .sortBy(StoreQuery.SortBy.PRIORITY, true)
                .limit(Integer.MAX_VALUE)
                .build());
        List<CrossSupervisorRequest> requests = new ArrayList<>();
        for (StoreEntry entry : entries) {
            if ("REQUEST".equals(entry.stringValue("messageType"))
                    && supervisorId.equals(entry.stringValue("toAgent"))
                    && !entry.booleanValue("responded")) {
                requests.add(toRequest(entry));
            }
        }
        return requests;
    }

    /**
     * Marks a mirrored request as answered so it drops out of {@link #readIncomingRequests}.
     *
     * @return false if no such request exists
     */
    public boolean respond(String requestKey, String responderId, Map<String, Object> response) {
        Optional<StoreEntry> existing = store.read(StoreCategory.CROSS_AGENT, requestKey, responderId);
        if (existing.isEmpty()) {
            log.warn("{} tried to respond to unknown request {}", responderId, requestKey);
            return false;
        }
        Map<String, Object> value = new LinkedHashMap<>(existing.get().value());
        value.put("responded", true);
        value.put("respondedBy", responderId);
        value.put("respondedAt", clock.instant().toString());
        value.put("response", response != null ? response : Map.of());
        store.write(StoreCategory.CROSS_AGENT, requestKey, value, responderId, WriteOptions.defaults());
        return true;
    }

    private Map<String, Object> mirrorValue(CrossSupervisorRequest request, String key) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("requestId", key);
        value.put("fromAgent", request.fromSupervisor());
        value.put("toAgent", request.toSupervisor());
        value.put("messageType", "REQUEST");
        value.put("subject", request.requestType());
        value.put("description", request.description());
        value.put("urgency", request.urgency().name());
        value.put("body", request.payload());
        value.put("requiresResponse", true);
        value.put("responded", false);
        value.put("responseDeadline", request.deadline() != null ? request.deadline().toString() : null);
        return value;
    }

    @SuppressWarnings("unchecked")
    private static CrossSupervisorRequest toRequest(StoreEntry entry) {
        Object body = entry.value().get("body");
        return new CrossSupervisorRequest(
                entry.key(),
                entry.stringValue("fromAgent"),
                entry.stringValue("toAgent"),
                entry.stringValue("subject"),
                entry.stringValue("description"),
                parseUrgency(entry.stringValue("urgency")),
                body instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(),
                parseInstant(entry.stringValue("responseDeadline")));
    }

    private static Urgency parseUrgency(String value) {
        if (value == null) {
            return Urgency.NORMAL;
        }
        try {
            return Urgency.valueOf(value);
        } catch (IllegalArgumentException e) {
            return Urgency.NORMAL;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable deadline '{}'", value);
            return null;
        }
    }
}
