package com.switchboard.dispatch.api;

import java.util.Map;

/**
 * Request body for POST /api/v1/units/{id}/execute.
 *
 * @param from     sender id recorded on the message; defaults to "api"
 * @param priority LOW, NORMAL, HIGH or CRITICAL
 */
public record ExecuteRequest(
    Map<String, Object> payload,
    String from,
    String priority
) {}
