package com.switchboard.core.model;

public enum MessageType {
    COMMAND,
    EVENT,
    QUERY
}
