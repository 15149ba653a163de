package com.edgegate.gateway.registry.discovery;

import com.edgegate.common.model.InstanceSource;
import com.edgegate.common.model.ServiceInstance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cloud.client.discovery.DiscoveryClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only discovery through Spring Cloud's {@link DiscoveryClient} (Consul in production).
 * Instances register themselves with the discovery server, not through the gateway.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "edgegate.registry.discovery-backend", havingValue = "spring-cloud")
public class SpringCloudDiscoveryBackend implements DiscoveryBackend {

    static final String TAGS_METADATA_KEY = "tags";

    private final DiscoveryClient discoveryClient;

    @Override
    public String name() {
        return "spring-cloud";
    }

    @Override
    public Map<String, List<ServiceInstance>> listAllServices() {
        Map<String, List<ServiceInstance>> result = new TreeMap<>();
        for (String serviceId : discoveryClient.getServices()) {
            List<ServiceInstance> instances = new ArrayList<>();
            for (org.springframework.cloud.client.ServiceInstance discovered : discoveryClient.getInstances(serviceId)) {
                instances.add(toInstance(serviceId, discovered));
            }
            result.put(serviceId, instances);
        }
        log.debug("Discovery client reported {} services", result.size());
        return result;
    }

    private static ServiceInstance toInstance(String serviceId, org.springframework.cloud.client.ServiceInstance discovered) {
        Map<String, String> metadata = discovered.getMetadata() != null ? discovered.getMetadata() : Map.of();
        String id = discovered.getInstanceId() != null
                ? discovered.getInstanceId()
                : serviceId + "-" + discovered.getHost() + ":" + discovered.getPort();

        List<String> tags = metadata.containsKey(TAGS_METADATA_KEY)
                ? Arrays.stream(metadata.get(TAGS_METADATA_KEY).split(","))
                        .map(String::trim)
                        .filter(tag -> !tag.isEmpty())
                        .collect(Collectors.toList())
                : List.of();

        return ServiceInstance.builder()
                .id(id)
                .serviceName(serviceId)
                .address(discovered.getHost())
                .port(discovered.getPort())
                .tags(tags)
                .metadata(metadata)
                .source(InstanceSource.DISCOVERY)
                .build();
    }
}
