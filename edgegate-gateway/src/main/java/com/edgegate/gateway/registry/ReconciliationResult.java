package com.edgegate.gateway.registry;

import lombok.Value;

/**
 * Outcome of one reconciliation pass
 */
@Value
public class ReconciliationResult {
    int added;
    int removed;
    int evicted;
}
