package com.switchboard.core.outreach;

public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    HOSTILE
}
