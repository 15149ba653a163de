package com.edgegate.gateway.registry.discovery;

import com.edgegate.common.model.InstanceSource;
import com.edgegate.common.model.ServiceInstance;
import com.edgegate.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovery backed by the {@code edgegate.registry.static-instances} configuration list,
 * plus whatever is registered at runtime.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "edgegate.registry.discovery-backend", havingValue = "static", matchIfMissing = true)
public class StaticDiscoveryBackend implements DiscoveryBackend {

    private final Map<String, ServiceInstance> instances = new ConcurrentHashMap<>();

    public StaticDiscoveryBackend(GatewayProperties properties) {
        for (GatewayProperties.StaticInstance configured : properties.getRegistry().getStaticInstances()) {
            ServiceInstance instance = ServiceInstance.builder()
                    .id(configured.getId() != null
                            ? configured.getId()
                            : configured.getServiceName() + "-" + configured.getAddress() + ":" + configured.getPort())
                    .serviceName(configured.getServiceName())
                    .address(configured.getAddress())
                    .port(configured.getPort())
                    .tags(configured.getTags())
                    .metadata(configured.getMetadata())
                    .source(InstanceSource.DISCOVERY)
                    .build();
            instances.put(instance.getId(), instance);
        }
        log.info("Static discovery backend loaded {} instances", instances.size());
    }

    @Override
    public String name() {
        return "static";
    }

    @Override
    public Map<String, List<ServiceInstance>> listAllServices() {
        Map<String, List<ServiceInstance>> result = new TreeMap<>();
        for (ServiceInstance instance : instances.values()) {
            result.computeIfAbsent(instance.getServiceName(), k -> new ArrayList<>()).add(instance);
        }
        return result;
    }

    @Override
    public void register(ServiceInstance instance) {
        instances.put(instance.getId(), instance.toBuilder().source(InstanceSource.DISCOVERY).build());
    }

    @Override
    public void deregister(ServiceInstance instance) {
        instances.remove(instance.getId());
    }
}
