package com.switchboard.core.outreach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Dry-run gateway: logs the message and accepts it without contacting any provider.
 */
@Component
public class LoggingChannelGateway implements ChannelGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingChannelGateway.class);

    @Override
    public DeliveryReceipt send(Channel channel, String address, String subject, String body,
                                Map<String, Object> metadata) {
        String id = "dryrun_" + UUID.randomUUID();
        log.info("[dry-run] {} to {} ({} chars){}", channel, address, body.length(),
                subject != null && !subject.isBlank() ? " subject='" + subject + "'" : "");
        return DeliveryReceipt.accepted(id);
    }
}
