package com.switchboard.core.transport;

import com.switchboard.core.model.MessageType;
import com.switchboard.core.model.UnitMessage;

import java.util.List;
import java.util.Map;

/**
 * Point-to-point and broadcast delivery of {@link UnitMessage}s between units.
 * Implementations never throw on delivery problems; they report them in the {@link TransportAck}.
 */
public interface MessageTransport {

    UnitMessage createMessage(MessageType type, String from, String to, Map<String, Object> payload);

    TransportAck send(UnitMessage message);

    /**
     * Delivers the message to every registered handler except the sender.
     */
    List<TransportAck> broadcast(UnitMessage message);

    Registration register(String unitId, MessageHandler handler);

    /**
     * Handle for removing a handler registration.
     */
    @FunctionalInterface
    interface Registration {
        void unregister();
    }
}
