package com.edgegate.gateway.registry;

import com.edgegate.common.model.ServiceInstance;
import com.edgegate.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * HTTP health probe: GET on the service's health endpoint, healthy on any 2xx.
 * Probe failures never propagate; they only yield {@code false}.
 */
@Slf4j
@Component
public class HealthProbe {

    private final WebClient webClient;
    private final GatewayProperties.Registry config;

    public HealthProbe(WebClient webClient, GatewayProperties properties) {
        this.webClient = webClient;
        this.config = properties.getRegistry();
    }

    public Mono<Boolean> probe(ServiceInstance instance) {
        String url = instance.getBaseUrl() + config.healthEndpointFor(instance.getServiceName());

        return webClient.get()
                .uri(url)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful()))
                .timeout(config.getHealthCheckTimeout())
                .doOnNext(healthy -> {
                    if (!healthy) {
                        log.debug("Health probe for {} returned non-2xx", instance.getId());
                    }
                })
                .onErrorResume(e -> {
                    log.debug("Health probe for {} at {} failed: {}", instance.getId(), url, e.toString());
                    return Mono.just(false);
                });
    }
}
