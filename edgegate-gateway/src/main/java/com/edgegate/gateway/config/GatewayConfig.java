package com.edgegate.gateway.config;

import com.edgegate.common.security.JwtTokenProvider;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

/**
 * Shared infrastructure beans: clock, outbound HTTP client, token verification.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Client for health probes and proxied calls. Follows no redirects; the
     * caller sees the downstream's 3xx as-is.
     */
    @Bean
    public WebClient webClient(WebClient.Builder builder, GatewayProperties properties) {
        GatewayProperties.Proxy proxy = properties.getProxy();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) proxy.getConnectTimeout().toMillis())
                .followRedirect(false);

        log.info("Outbound HTTP client: connectTimeout={}, maxBodyBytes={}",
                proxy.getConnectTimeout(), proxy.getMaxBodyBytes());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(proxy.getMaxBodyBytes()))
                .build();
    }

    @Bean
    public JwtTokenProvider jwtTokenProvider(
            @Value("${edgegate.jwt.secret}") String secret,
            @Value("${edgegate.jwt.expiration-seconds:3600}") long expirationSeconds,
            @Value("${edgegate.jwt.issuer:edgegate}") String issuer) {
        return new JwtTokenProvider(secret, expirationSeconds, issuer);
    }
}
