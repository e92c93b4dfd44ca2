package com.switchboard.core.supervisor;

import com.switchboard.core.control.SwarmControl;
import com.switchboard.core.delegation.DelegationMatcher;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.mutation.MutationPipeline;
import com.switchboard.core.qualitygate.QualityGate;
import com.switchboard.core.request.RequestProtocol;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.transport.MessageTransport;
import org.springframework.stereotype.Component;

/**
 * Collaborators every supervisor needs, grouped so subclasses take one constructor argument.
 */
@Component
public record SupervisorContext(
    DelegationMatcher matcher,
    QualityGate qualityGate,
    MutationPipeline mutationPipeline,
    RequestProtocol requestProtocol,
    MessageTransport transport,
    SwarmControl swarmControl,
    SharedStore store,
    SwitchboardMetrics metrics
) {}
