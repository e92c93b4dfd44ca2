package com.switchboard.dispatch.api;

import com.switchboard.core.outreach.Lead;
import com.switchboard.core.outreach.SequenceDefinition;

/**
 * Request body for POST /api/v1/sequences/execute.
 *
 * @param deferred honour step delays instead of running every step now
 */
public record SequenceRequest(
    SequenceDefinition sequence,
    Lead lead,
    Boolean deferred
) {}
