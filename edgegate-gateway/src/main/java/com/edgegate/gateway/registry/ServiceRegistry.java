package com.edgegate.gateway.registry;

import com.edgegate.common.model.ServiceInstance;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live catalog of service instances and their health
 */
public interface ServiceRegistry {

    /**
     * Insert or update an instance, keyed by (serviceName, id).
     * @throws com.edgegate.common.exception.InvalidInstanceException if address or port is missing
     */
    ServiceInstance register(ServiceInstance instance);

    /**
     * Remove an instance by id from whichever service holds it; absent ids are ignored
     * @return whether anything was removed
     */
    boolean deregister(String instanceId);

    boolean deregister(String serviceName, String instanceId);

    /**
     * Healthy instances of a service, empty when there are none
     */
    List<ServiceInstance> listHealthy(String serviceName);

    List<ServiceInstance> listInstances(String serviceName);

    /**
     * One healthy instance chosen uniformly at random
     * @throws com.edgegate.common.exception.ServiceUnavailableException if none is healthy
     */
    ServiceInstance pick(String serviceName);

    Set<String> serviceNames();

    /**
     * Record a probe outcome. Returns the updated instance, or empty if it was removed meanwhile.
     */
    Optional<ServiceInstance> recordProbe(String serviceName, String instanceId, boolean healthy, Instant checkedAt);

    Map<String, List<ServiceInstance>> snapshot();
}
