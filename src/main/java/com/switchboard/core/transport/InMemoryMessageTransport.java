package com.switchboard.core.transport;

import com.switchboard.core.control.SwarmControl;
import com.switchboard.core.model.MessageType;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.Urgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process message transport.
 * <p>
 * Each message id is delivered at most once per recipient. Messages for a paused recipient are
 * queued and flushed when {@link SwarmControl} reports it resumed; once the queue is full further
 * messages are dropped and acknowledged as {@link TransportAck.Outcome#DROPPED}. Handler
 * exceptions are caught and reported as {@link TransportAck.Outcome#HANDLER_FAILED}.
 */
@Service
public class InMemoryMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageTransport.class);

    private static final int SEEN_CAPACITY = 10_000;
    static final int HELD_CAPACITY = 10_000;

    private final ConcurrentHashMap<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final BlockingQueue<UnitMessage> held;
    private final Set<String> seen = Collections.newSetFromMap(Collections.synchronizedMap(
            new LinkedHashMap<>(256, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > SEEN_CAPACITY;
                }
            }));

    private final SwarmControl swarmControl;
    private final Clock clock;

    @Autowired
    public InMemoryMessageTransport(SwarmControl swarmControl, Clock clock) {
        this(swarmControl, clock, HELD_CAPACITY);
    }

    InMemoryMessageTransport(SwarmControl swarmControl, Clock clock, int heldCapacity) {
        this.swarmControl = swarmControl;
        this.clock = clock;
        this.held = new LinkedBlockingQueue<>(heldCapacity);
        swarmControl.onResume(unitId -> flushHeld());
    }

    @Override
    public UnitMessage createMessage(MessageType type, String from, String to, Map<String, Object> payload) {
        String id = "msg_" + UUID.randomUUID();
        return new UnitMessage(id, type, from, to, payload, Urgency.NORMAL, type != MessageType.EVENT,
                id, clock.instant());
    }

    @Override
    public TransportAck send(UnitMessage message) {
        log.debug("Sending {} {} from {} to {}", message.type(), message.id(), message.from(), message.to());
        return dispatch(message, message.to());
    }

    @Override
    public List<TransportAck> broadcast(UnitMessage message) {
        List<TransportAck> acks = new ArrayList<>();
        for (String recipient : List.copyOf(handlers.keySet())) {
            if (!recipient.equals(message.from())) {
                acks.add(dispatch(message.redirectTo(recipient), recipient));
            }
        }
        return acks;
    }

    @Override
    public Registration register(String unitId, MessageHandler handler) {
        handlers.put(unitId, handler);
        log.debug("Registered transport handler for {}", unitId);
        return () -> handlers.remove(unitId, handler);
    }

    /**
     * Number of messages waiting for a paused recipient.
     */
    public int heldCount() {
        return held.size();
    }

    private TransportAck dispatch(UnitMessage message, String recipient) {
        MessageHandler handler = handlers.get(recipient);
        if (handler == null) {
            log.warn("No handler registered for {}; message {} not delivered", recipient, message.id());
            return TransportAck.notDelivered(message.id(), recipient, TransportAck.Outcome.NO_HANDLER,
                    "No handler registered for " + recipient);
        }
        if (swarmControl.isPaused(recipient)) {
            if (!held.offer(message)) {
                log.warn("Held queue full ({} messages); dropping message {} for paused {}",
                        held.size(), message.id(), recipient);
                return TransportAck.notDelivered(message.id(), recipient, TransportAck.Outcome.DROPPED,
                        recipient + " is paused and the held queue is full");
            }
            log.info("Recipient {} paused; holding message {}", recipient, message.id());
            return TransportAck.notDelivered(message.id(), recipient, TransportAck.Outcome.QUEUED,
                    recipient + " is paused");
        }
        if (!seen.add(recipient + "|" + message.id())) {
            log.debug("Dropping duplicate message {} for {}", message.id(), recipient);
            return TransportAck.notDelivered(message.id(), recipient, TransportAck.Outcome.DUPLICATE,
                    "Message " + message.id() + " already delivered");
        }
        return deliverSafely(handler, message, recipient);
    }

    private TransportAck deliverSafely(MessageHandler handler, UnitMessage message, String recipient) {
        try {
            Report report = handler.handle(message);
            return TransportAck.delivered(message.id(), recipient, report);
        } catch (Exception e) {
            log.warn("Handler for {} threw processing message {}: {}", recipient, message.id(), e.getMessage(), e);
            return TransportAck.notDelivered(message.id(), recipient, TransportAck.Outcome.HANDLER_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void flushHeld() {
        int pending = held.size();
        for (int i = 0; i < pending; i++) {
            UnitMessage message = held.poll();
            if (message == null) {
                break;
            }
            TransportAck ack = dispatch(message, message.to());
            if (ack.outcome() != TransportAck.Outcome.QUEUED) {
                log.info("Flushed held message {} to {}: {}", message.id(), message.to(), ack.outcome());
            }
        }
    }
}
