package com.edgegate.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.client.discovery.EnableDiscoveryClient;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * EdgeGate API Gateway Application.
 *
 * Responsibilities:
 * - Service registry with active health checks and discovery reconciliation
 * - Per-route circuit breakers
 * - Request forwarding with bounded retries and header rewriting
 * - Global, per-service and per-caller rate limiting
 * - Authenticated realtime channel subscriptions and broadcast
 *
 * Architecture:
 * - Spring WebFlux (reactive)
 * - Consul service discovery (optional)
 * - In-memory rate limit windows and breaker state
 */
@SpringBootApplication
@EnableDiscoveryClient
@EnableScheduling
@ConfigurationPropertiesScan
public class ApiGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiGatewayApplication.class, args);
    }
}
