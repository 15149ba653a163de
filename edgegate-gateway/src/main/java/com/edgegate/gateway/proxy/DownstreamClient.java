package com.edgegate.gateway.proxy;

import com.edgegate.common.model.ServiceInstance;
import com.edgegate.common.util.ForwardedHeaders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Single HTTP exchange with one instance. No retries, no breaker; 5xx becomes
 * {@link DownstreamServerException}, everything else is returned as-is.
 */
@Slf4j
@Component
public class DownstreamClient {

    private static final byte[] EMPTY = new byte[0];

    private final WebClient webClient;

    public DownstreamClient(WebClient webClient) {
        this.webClient = webClient;
    }

    public Mono<ProxyResponse> exchange(ServiceInstance instance, ProxyRequest request, HttpHeaders outboundHeaders) {
        URI target = targetUri(instance, request);
        log.trace("Forwarding {} {} to {}", request.getMethod(), request.getPath(), instance.getId());

        WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                .uri(target)
                .headers(headers -> headers.addAll(outboundHeaders));

        WebClient.RequestHeadersSpec<?> ready = request.getBody() != null && request.getBody().length > 0
                ? spec.bodyValue(request.getBody())
                : spec;

        return ready.exchangeToMono(response -> response.bodyToMono(byte[].class)
                .defaultIfEmpty(EMPTY)
                .flatMap(body -> {
                    HttpHeaders headers = ForwardedHeaders.sanitize(response.headers().asHttpHeaders());
                    headers.remove(HttpHeaders.CONTENT_LENGTH);
                    ProxyResponse proxied = new ProxyResponse(response.statusCode().value(), headers, body);
                    if (response.statusCode().is5xxServerError()) {
                        return Mono.error(new DownstreamServerException(instance.getServiceName(), proxied));
                    }
                    return Mono.just(proxied);
                }));
    }

    static URI targetUri(ServiceInstance instance, ProxyRequest request) {
        StringBuilder uri = new StringBuilder(instance.getBaseUrl());
        String path = request.getPath();
        if (path == null || path.isEmpty()) {
            uri.append('/');
        } else {
            if (!path.startsWith("/")) {
                uri.append('/');
            }
            uri.append(path);
        }
        if (request.getRawQuery() != null && !request.getRawQuery().isEmpty()) {
            uri.append('?').append(request.getRawQuery());
        }
        return URI.create(uri.toString());
    }
}
