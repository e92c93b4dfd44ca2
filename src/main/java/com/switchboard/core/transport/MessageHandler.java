package com.switchboard.core.transport;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitMessage;

@FunctionalInterface
public interface MessageHandler {

    Report handle(UnitMessage message);
}
