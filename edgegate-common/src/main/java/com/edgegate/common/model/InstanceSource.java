package com.edgegate.common.model;

/**
 * How an instance entered the catalog
 */
public enum InstanceSource {
    /** Pushed through the registration endpoint or API */
    REGISTRATION,
    /** Pulled from the discovery backend during reconciliation */
    DISCOVERY
}
