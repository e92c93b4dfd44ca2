package com.switchboard.core.outreach;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.SelfAssessment;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.unit.AbstractCapabilityUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Leaf unit that sends one message over one channel through the {@link ChannelGateway}.
 * <p>
 * Payload fields read: {@code body}, {@code subject}, {@code leadId}, {@code sequenceId},
 * {@code stepNumber} and the channel's address field. A missing address is BLOCKED; a rejected or
 * failed send is FAILED.
 */
public abstract class ChannelUnit extends AbstractCapabilityUnit {

    public static final String MISSING_CONTACT_ADDRESS = "MISSING_CONTACT_ADDRESS";

    private final Channel channel;
    private final ChannelGateway gateway;

    protected ChannelUnit(UnitIdentity identity, Channel channel, ChannelGateway gateway) {
        super(identity);
        this.channel = channel;
        this.gateway = gateway;
    }

    public Channel channel() {
        return channel;
    }

    /**
     * Payload field holding the contact address for this channel.
     */
    protected abstract String addressField();

    /**
     * Channel-specific check of the body; returns an error or null.
     */
    protected String checkBody(String body) {
        return null;
    }

    @Override
    protected Report doExecute(UnitMessage message) {
        Map<String, Object> payload = message.payload();
        Object address = payload.get(addressField());
        if (address == null || address.toString().isBlank()) {
            return Report.blocked(message.id(), id(),
                    Map.of("reason", MISSING_CONTACT_ADDRESS, "channel", channel.name()),
                    List.of("Lead " + payload.get("leadId") + " has no " + addressField() + " for " + channel));
        }
        String body = payload.get("body") != null ? payload.get("body").toString() : "";
        String subject = payload.get("subject") != null ? payload.get("subject").toString() : null;

        String bodyError = checkBody(body);
        if (bodyError != null) {
            return Report.failed(message.id(), id(), bodyError);
        }

        DeliveryReceipt receipt;
        try {
            receipt = gateway.send(channel, address.toString(), subject, body, payload);
        } catch (RuntimeException e) {
            log.warn("{} gateway error for message {}: {}", channel, message.id(), e.getMessage());
            return Report.failed(message.id(), id(), channel + " gateway error: " + e.getMessage());
        }
        if (!receipt.accepted()) {
            return Report.failed(message.id(), id(), channel + " provider rejected message: " + receipt.error());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("channel", channel.name());
        data.put("address", address.toString());
        data.put("providerMessageId", receipt.providerMessageId());
        data.put("body", body);
        if (subject != null) {
            data.put("subject", subject);
        }
        return Report.completed(message.id(), id(), data);
    }

    @Override
    public SelfAssessment selfReport() {
        return new SelfAssessment(true, 100);
    }
}
