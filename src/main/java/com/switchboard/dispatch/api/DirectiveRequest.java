package com.switchboard.dispatch.api;

import java.util.Map;

/**
 * Request body for POST /api/v1/directives. A missing id is generated.
 */
public record DirectiveRequest(
    String id,
    String type,
    String targetDomain,
    Map<String, Object> parameters,
    String reason,
    Integer confidence,
    String sourceAgent,
    String priority
) {}
