package com.edgegate.gateway.registry;

import com.edgegate.common.exception.InvalidInstanceException;
import com.edgegate.common.exception.ServiceUnavailableException;
import com.edgegate.common.model.ServiceInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Service catalog held in memory.
 *
 * Each service maps to an immutable id -> instance map. Writers replace the whole
 * map for one service inside {@link ConcurrentHashMap#compute}, which serializes
 * writers per service only; readers take the current map without locking.
 */
@Slf4j
@Component
public class InMemoryServiceRegistry implements ServiceRegistry {

    private final ConcurrentHashMap<String, Map<String, ServiceInstance>> catalog = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;

    public InMemoryServiceRegistry(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public ServiceInstance register(ServiceInstance instance) {
        validate(instance);

        AtomicReference<ServiceInstance> stored = new AtomicReference<>();
        catalog.compute(instance.getServiceName(), (service, current) -> {
            Map<String, ServiceInstance> next = copyOf(current);
            ServiceInstance existing = next.get(instance.getId());
            ServiceInstance merged = existing == null
                    ? instance
                    : instance.toBuilder()
                            .healthy(existing.isHealthy())
                            .lastHealthCheck(existing.getLastHealthCheck())
                            .consecutiveFailedChecks(existing.getConsecutiveFailedChecks())
                            .build();
            next.put(instance.getId(), merged);
            stored.set(merged);
            return Collections.unmodifiableMap(next);
        });

        log.info("Registered instance {} of service {} at {}",
                instance.getId(), instance.getServiceName(), instance.getHostAndPort());
        return stored.get();
    }

    @Override
    public boolean deregister(String instanceId) {
        boolean removed = false;
        for (String serviceName : catalog.keySet()) {
            removed |= deregister(serviceName, instanceId);
        }
        if (!removed) {
            log.debug("Deregister ignored, instance {} not found", instanceId);
        }
        return removed;
    }

    @Override
    public boolean deregister(String serviceName, String instanceId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        catalog.computeIfPresent(serviceName, (service, current) -> {
            if (!current.containsKey(instanceId)) {
                return current;
            }
            Map<String, ServiceInstance> next = copyOf(current);
            next.remove(instanceId);
            removed.set(true);
            return next.isEmpty() ? null : Collections.unmodifiableMap(next);
        });
        if (removed.get()) {
            log.info("Deregistered instance {} of service {}", instanceId, serviceName);
        }
        return removed.get();
    }

    @Override
    public List<ServiceInstance> listHealthy(String serviceName) {
        return instancesOf(serviceName).stream()
                .filter(ServiceInstance::isHealthy)
                .collect(Collectors.toList());
    }

    @Override
    public List<ServiceInstance> listInstances(String serviceName) {
        return new ArrayList<>(instancesOf(serviceName));
    }

    @Override
    public ServiceInstance pick(String serviceName) {
        List<ServiceInstance> healthy = listHealthy(serviceName);
        if (healthy.isEmpty()) {
            log.warn("No healthy instance available for service {}", serviceName);
            throw new ServiceUnavailableException(serviceName);
        }
        return healthy.get(ThreadLocalRandom.current().nextInt(healthy.size()));
    }

    @Override
    public Set<String> serviceNames() {
        return Collections.unmodifiableSet(new TreeSet<>(catalog.keySet()));
    }

    @Override
    public Optional<ServiceInstance> recordProbe(String serviceName, String instanceId, boolean healthy, Instant checkedAt) {
        AtomicReference<ServiceInstance> before = new AtomicReference<>();
        AtomicReference<ServiceInstance> after = new AtomicReference<>();

        catalog.computeIfPresent(serviceName, (service, current) -> {
            ServiceInstance existing = current.get(instanceId);
            if (existing == null) {
                return current;
            }
            Map<String, ServiceInstance> next = copyOf(current);
            ServiceInstance updated = existing.withProbeResult(healthy, checkedAt);
            next.put(instanceId, updated);
            before.set(existing);
            after.set(updated);
            return Collections.unmodifiableMap(next);
        });

        ServiceInstance previous = before.get();
        if (previous != null && previous.isHealthy() != healthy) {
            log.info("Instance {} of service {} is now {}", instanceId, serviceName, healthy ? "HEALTHY" : "UNHEALTHY");
            eventPublisher.publishEvent(new InstanceHealthChangedEvent(serviceName, instanceId, healthy, checkedAt));
        }
        return Optional.ofNullable(after.get());
    }

    @Override
    public Map<String, List<ServiceInstance>> snapshot() {
        Map<String, List<ServiceInstance>> result = new TreeMap<>();
        catalog.forEach((service, instances) -> result.put(service, new ArrayList<>(instances.values())));
        return result;
    }

    private List<ServiceInstance> instancesOf(String serviceName) {
        Map<String, ServiceInstance> instances = catalog.get(serviceName);
        return instances == null ? Collections.emptyList() : new ArrayList<>(instances.values());
    }

    private static Map<String, ServiceInstance> copyOf(Map<String, ServiceInstance> current) {
        return current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
    }

    private static void validate(ServiceInstance instance) {
        if (instance == null) {
            throw new InvalidInstanceException("Instance is required");
        }
        if (isBlank(instance.getServiceName()) || isBlank(instance.getId())) {
            throw new InvalidInstanceException("Instance requires serviceName and id");
        }
        if (isBlank(instance.getAddress())) {
            throw new InvalidInstanceException("Instance " + instance.getId() + " has no address");
        }
        if (instance.getPort() == null || instance.getPort() <= 0 || instance.getPort() > 65535) {
            throw new InvalidInstanceException("Instance " + instance.getId() + " has no valid port");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
