package com.switchboard.core.outreach;

import com.switchboard.core.registry.UnitId;
import org.springframework.stereotype.Component;

@Component
public class EmailChannelUnit extends ChannelUnit {

    public EmailChannelUnit(ChannelGateway gateway) {
        super(UnitId.EMAIL_CHANNEL.identity(), Channel.EMAIL, gateway);
    }

    @Override
    protected String addressField() {
        return "email";
    }
}
