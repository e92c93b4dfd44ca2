package com.switchboard.core.outreach;

import java.util.Map;

/**
 * Boundary to the email/SMS providers. Implementations may throw; channel units turn that into a
 * FAILED report.
 */
public interface ChannelGateway {

    DeliveryReceipt send(Channel channel, String address, String subject, String body, Map<String, Object> metadata);
}
