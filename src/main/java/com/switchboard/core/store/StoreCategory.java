package com.switchboard.core.store;

/**
 * Namespaces of the shared store.
 */
public enum StoreCategory {
    INSIGHT,      // discovered knowledge or outcomes
    SIGNAL,       // alerts and flags that need attention
    CONTENT,
    PROFILE,      // lead and audience profiles, suppression flags
    STRATEGY,     // mutation directives
    WORKFLOW,     // execution state, audit logs, contact history
    PERFORMANCE,
    CONTEXT,
    CROSS_AGENT   // requests and escalations between units
}
