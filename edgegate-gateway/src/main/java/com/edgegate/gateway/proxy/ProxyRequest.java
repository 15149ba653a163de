package com.edgegate.gateway.proxy;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.time.Duration;

/**
 * Inbound request as seen by the proxy, with the API prefix already removed from the path
 */
@Value
@Builder(toBuilder = true)
public class ProxyRequest {
    HttpMethod method;

    /**
     * Raw (still encoded) path forwarded to the instance
     */
    String path;
    String rawQuery;

    @Builder.Default
    HttpHeaders headers = new HttpHeaders();

    byte[] body;

    String clientAddress;
    String scheme;
    String host;

    /**
     * Route pattern the path matched; part of the breaker key
     */
    String routeTemplate;

    boolean idempotent;

    /**
     * Per-attempt deadline; null uses the configured request timeout
     */
    Duration timeout;
}
