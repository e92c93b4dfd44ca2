package com.switchboard.core.transport;

import com.switchboard.core.model.Report;

/**
 * Acknowledgement of a single delivery attempt.
 *
 * @param messageId id of the message sent
 * @param recipient unit the delivery was addressed to
 * @param outcome   what happened to the message
 * @param report    handler report when delivered, otherwise null
 * @param reason    explanation when not delivered
 */
public record TransportAck(String messageId, String recipient, Outcome outcome, Report report, String reason) {

    public enum Outcome { DELIVERED, QUEUED, DROPPED, DUPLICATE, NO_HANDLER, HANDLER_FAILED }

    public boolean delivered() {
        return outcome == Outcome.DELIVERED;
    }

    static TransportAck delivered(String messageId, String recipient, Report report) {
        return new TransportAck(messageId, recipient, Outcome.DELIVERED, report, null);
    }

    static TransportAck notDelivered(String messageId, String recipient, Outcome outcome, String reason) {
        return new TransportAck(messageId, recipient, outcome, null, reason);
    }
}
