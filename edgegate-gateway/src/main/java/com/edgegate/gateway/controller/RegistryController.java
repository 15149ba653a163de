package com.edgegate.gateway.controller;

import com.edgegate.common.model.InstanceSource;
import com.edgegate.common.model.ServiceInstance;
import com.edgegate.gateway.registry.HealthCheckScheduler;
import com.edgegate.gateway.registry.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registration push and catalog inspection.
 * Registered instances start unhealthy and are probed before the response is sent.
 */
@Slf4j
@RestController
@RequestMapping("/registry")
public class RegistryController {

    private final ServiceRegistry registry;
    private final HealthCheckScheduler healthCheckScheduler;

    public RegistryController(ServiceRegistry registry, HealthCheckScheduler healthCheckScheduler) {
        this.registry = registry;
        this.healthCheckScheduler = healthCheckScheduler;
    }

    /**
     * POST /registry/instances
     */
    @PostMapping("/instances")
    public Mono<ResponseEntity<ServiceInstance>> register(@RequestBody ServiceInstance instance) {
        ServiceInstance registered = registry.register(instance.toBuilder()
                .source(InstanceSource.REGISTRATION)
                .healthy(false)
                .build());

        return healthCheckScheduler.probeAndRecord(registered)
                .map(healthy -> registry.listInstances(registered.getServiceName()).stream()
                        .filter(candidate -> candidate.getId().equals(registered.getId()))
                        .findFirst()
                        .orElse(registered))
                .map(current -> ResponseEntity.status(HttpStatus.CREATED).body(current));
    }

    /**
     * DELETE /registry/instances/{id}
     */
    @DeleteMapping("/instances/{id}")
    public ResponseEntity<Void> deregister(@PathVariable("id") String id) {
        registry.deregister(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /registry/services
     */
    @GetMapping("/services")
    public ResponseEntity<Map<String, Object>> listServices() {
        Map<String, Object> services = new LinkedHashMap<>();
        registry.snapshot().forEach((name, instances) -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("instances", instances.size());
            summary.put("healthy", instances.stream().filter(ServiceInstance::isHealthy).count());
            services.put(name, summary);
        });
        return ResponseEntity.ok(services);
    }

    /**
     * GET /registry/services/{name}
     */
    @GetMapping("/services/{name}")
    public ResponseEntity<List<ServiceInstance>> listInstances(@PathVariable("name") String name) {
        List<ServiceInstance> instances = registry.listInstances(name);
        if (instances.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(instances);
    }
}
