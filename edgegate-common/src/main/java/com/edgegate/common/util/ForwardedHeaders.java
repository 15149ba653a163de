package com.edgegate.common.util;

import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Header rewriting for proxied requests and responses.
 */
public final class ForwardedHeaders {

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_FORWARDED_PROTO = "X-Forwarded-Proto";
    public static final String X_FORWARDED_HOST = "X-Forwarded-Host";

    /**
     * Headers that only make sense for a single transport hop (RFC 7230 section 6.1)
     */
    public static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "transfer-encoding",
            "upgrade",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "trailers");

    private ForwardedHeaders() {
    }

    /**
     * Copy headers, dropping hop-by-hop headers and any header the
     * {@code Connection} header names. Host is dropped too; the client sets it
     * for the target.
     */
    public static HttpHeaders sanitize(HttpHeaders source) {
        HttpHeaders result = new HttpHeaders();
        if (source == null) {
            return result;
        }

        List<String> connectionScoped = new ArrayList<>();
        List<String> connection = source.get(HttpHeaders.CONNECTION);
        if (connection != null) {
            for (String value : connection) {
                for (String token : value.split(",")) {
                    String name = token.trim().toLowerCase(Locale.ROOT);
                    if (!name.isEmpty()) {
                        connectionScoped.add(name);
                    }
                }
            }
        }

        source.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || connectionScoped.contains(lower) || "host".equals(lower)) {
                return;
            }
            result.put(name, new ArrayList<>(values));
        });
        return result;
    }

    /**
     * Append the client address to X-Forwarded-For and set proto/host.
     */
    public static void applyForwarded(HttpHeaders headers, String clientAddress, String proto, String host) {
        if (clientAddress != null && !clientAddress.isEmpty()) {
            String existing = headers.getFirst(X_FORWARDED_FOR);
            headers.set(X_FORWARDED_FOR, existing == null || existing.isEmpty()
                    ? clientAddress
                    : existing + ", " + clientAddress);
        }
        if (proto != null) {
            headers.set(X_FORWARDED_PROTO, proto);
        }
        if (host != null) {
            headers.set(X_FORWARDED_HOST, host);
        }
    }
}
