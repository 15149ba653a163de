package com.edgegate.gateway.registry;

import com.edgegate.common.exception.InvalidInstanceException;
import com.edgegate.common.model.InstanceSource;
import com.edgegate.common.model.ServiceInstance;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.registry.discovery.DiscoveryBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Slow loop that brings the catalog in line with the discovery backend.
 *
 * - newly reported instances are added unhealthy and probed right away
 * - discovery-sourced instances the backend stopped reporting are removed
 * - instances that missed maxMissedChecks probes in a row are evicted
 */
@Slf4j
@Service
public class RegistryReconciler {

    private final ServiceRegistry registry;
    private final DiscoveryBackend discoveryBackend;
    private final HealthCheckScheduler healthCheckScheduler;
    private final GatewayProperties.Registry config;

    public RegistryReconciler(ServiceRegistry registry, DiscoveryBackend discoveryBackend,
                              HealthCheckScheduler healthCheckScheduler, GatewayProperties properties) {
        this.registry = registry;
        this.discoveryBackend = discoveryBackend;
        this.healthCheckScheduler = healthCheckScheduler;
        this.config = properties.getRegistry();
        log.info("Registry reconciler using {} discovery backend, interval {}",
                discoveryBackend.name(), config.getReconcileInterval());
    }

    @Scheduled(fixedDelayString = "${edgegate.registry.reconcile-interval:PT60S}")
    public void scheduledReconcile() {
        ReconciliationResult result = reconcile();
        if (result.getAdded() + result.getRemoved() + result.getEvicted() > 0) {
            log.info("Reconciliation: added={}, removed={}, evicted={}",
                    result.getAdded(), result.getRemoved(), result.getEvicted());
        }
    }

    public ReconciliationResult reconcile() {
        Map<String, List<ServiceInstance>> current = registry.snapshot();
        Map<String, ServiceInstance> known = new HashMap<>();
        current.values().stream().flatMap(Collection::stream).forEach(i -> known.put(keyOf(i), i));

        List<ServiceInstance> added = new ArrayList<>();
        int removed = 0;

        Map<String, List<ServiceInstance>> reported = pullBackend();
        if (reported != null) {
            Set<String> reportedKeys = new HashSet<>();
            for (List<ServiceInstance> instances : reported.values()) {
                for (ServiceInstance instance : instances) {
                    ServiceInstance discovered = instance.toBuilder().source(InstanceSource.DISCOVERY).build();
                    reportedKeys.add(keyOf(discovered));
                    try {
                        ServiceInstance existing = known.get(keyOf(discovered));
                        if (existing != null) {
                            if (locationChanged(existing, discovered)) {
                                registry.register(discovered);
                            }
                        } else {
                            added.add(registry.register(discovered.toBuilder().healthy(false).build()));
                        }
                    } catch (InvalidInstanceException e) {
                        log.warn("Skipping invalid instance from {} backend: {}", discoveryBackend.name(), e.getMessage());
                    }
                }
            }

            for (List<ServiceInstance> instances : current.values()) {
                for (ServiceInstance instance : instances) {
                    if (instance.getSource() == InstanceSource.DISCOVERY && !reportedKeys.contains(keyOf(instance))) {
                        if (registry.deregister(instance.getServiceName(), instance.getId())) {
                            removed++;
                        }
                    }
                }
            }
        }

        int evicted = 0;
        for (List<ServiceInstance> instances : registry.snapshot().values()) {
            for (ServiceInstance instance : instances) {
                if (instance.getConsecutiveFailedChecks() >= config.getMaxMissedChecks()) {
                    log.warn("Evicting instance {} of service {} after {} failed health checks",
                            instance.getId(), instance.getServiceName(), instance.getConsecutiveFailedChecks());
                    if (registry.deregister(instance.getServiceName(), instance.getId())) {
                        evicted++;
                    }
                }
            }
        }

        if (!added.isEmpty()) {
            healthCheckScheduler.probeAll(added).block();
        }

        return new ReconciliationResult(added.size(), removed, evicted);
    }

    private Map<String, List<ServiceInstance>> pullBackend() {
        try {
            return discoveryBackend.listAllServices();
        } catch (RuntimeException e) {
            log.warn("Discovery backend {} unavailable, keeping current catalog: {}",
                    discoveryBackend.name(), e.getMessage());
            return null;
        }
    }

    private static boolean locationChanged(ServiceInstance existing, ServiceInstance reported) {
        return !Objects.equals(existing.getAddress(), reported.getAddress())
                || !Objects.equals(existing.getPort(), reported.getPort())
                || !Objects.equals(existing.getTags(), reported.getTags())
                || !Objects.equals(existing.getMetadata(), reported.getMetadata())
                || existing.getSource() != reported.getSource();
    }

    private static String keyOf(ServiceInstance instance) {
        return instance.getServiceName() + "/" + instance.getId();
    }
}
