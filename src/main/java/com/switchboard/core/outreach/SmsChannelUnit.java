package com.switchboard.core.outreach;

import com.switchboard.core.registry.UnitId;
import org.springframework.stereotype.Component;

@Component
public class SmsChannelUnit extends ChannelUnit {

    /** Ten concatenated segments. */
    static final int MAX_BODY_LENGTH = 1600;

    public SmsChannelUnit(ChannelGateway gateway) {
        super(UnitId.SMS_CHANNEL.identity(), Channel.SMS, gateway);
    }

    @Override
    protected String addressField() {
        return "phone";
    }

    @Override
    protected String checkBody(String body) {
        if (body.length() > MAX_BODY_LENGTH) {
            return "SMS body is " + body.length() + " characters; limit is " + MAX_BODY_LENGTH;
        }
        return null;
    }
}
