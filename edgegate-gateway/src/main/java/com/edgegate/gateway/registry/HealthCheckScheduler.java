package com.edgegate.gateway.registry;

import com.edgegate.common.model.ServiceInstance;
import com.edgegate.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Periodically probes every registered instance and records the outcome.
 * A failed probe only marks the instance unhealthy; removal is left to
 * {@link RegistryReconciler}.
 */
@Slf4j
@Service
public class HealthCheckScheduler {

    private final ServiceRegistry registry;
    private final HealthProbe healthProbe;
    private final GatewayProperties.Registry config;
    private final Clock clock;

    public HealthCheckScheduler(ServiceRegistry registry, HealthProbe healthProbe,
                                GatewayProperties properties, Clock clock) {
        this.registry = registry;
        this.healthProbe = healthProbe;
        this.config = properties.getRegistry();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${edgegate.registry.health-check-interval:PT30S}")
    public void checkAll() {
        List<ServiceInstance> instances = registry.snapshot().values().stream()
                .flatMap(Collection::stream)
                .collect(Collectors.toList());

        if (instances.isEmpty()) {
            log.trace("No instances to health check");
            return;
        }

        log.debug("Health checking {} instances", instances.size());
        Long healthy = probeAll(instances).block();
        log.debug("Health check complete: {}/{} healthy", healthy, instances.size());
    }

    /**
     * Probe the given instances concurrently and record each outcome
     * @return number of healthy instances
     */
    public Mono<Long> probeAll(Collection<ServiceInstance> instances) {
        return Flux.fromIterable(instances)
                .flatMap(this::probeAndRecord, config.getProbeConcurrency())
                .filter(Boolean::booleanValue)
                .count();
    }

    public Mono<Boolean> probeAndRecord(ServiceInstance instance) {
        return healthProbe.probe(instance)
                .doOnNext(healthy -> registry.recordProbe(
                        instance.getServiceName(), instance.getId(), healthy, clock.instant()));
    }
}
