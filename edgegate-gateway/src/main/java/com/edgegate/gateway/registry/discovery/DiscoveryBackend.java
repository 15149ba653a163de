package com.edgegate.gateway.registry.discovery;

import com.edgegate.common.model.ServiceInstance;

import java.util.List;
import java.util.Map;

/**
 * Source of truth for which instances exist. The registry pulls from it during
 * reconciliation; health is tracked by the gateway itself.
 */
public interface DiscoveryBackend {

    String name();

    Map<String, List<ServiceInstance>> listAllServices();

    default void register(ServiceInstance instance) {
        throw new UnsupportedOperationException(name() + " discovery backend does not accept registrations");
    }

    default void deregister(ServiceInstance instance) {
        throw new UnsupportedOperationException(name() + " discovery backend does not accept deregistrations");
    }
}
