package com.edgegate.common.util;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

public class ForwardedHeadersTest {

    @Test
    void testHopByHopHeadersAreStripped() {
        HttpHeaders source = new HttpHeaders();
        source.add("Connection", "keep-alive, X-Session-Hint");
        source.add("Keep-Alive", "timeout=5");
        source.add("Transfer-Encoding", "chunked");
        source.add("Upgrade", "h2c");
        source.add("Proxy-Authorization", "Basic abc");
        source.add("TE", "trailers");
        source.add("Trailer", "Expires");
        source.add("X-Session-Hint", "sticky");
        source.add("Host", "gateway.local");
        source.add("Accept", "application/json");
        source.add("Authorization", "Bearer token");

        HttpHeaders result = ForwardedHeaders.sanitize(source);

        assertEquals(2, result.size());
        assertEquals("application/json", result.getFirst("Accept"));
        assertEquals("Bearer token", result.getFirst("Authorization"));
        assertNull(result.getFirst("X-Session-Hint"));
        assertNull(result.getFirst("Host"));
    }

    @Test
    void testForwardedHeadersAppendClientAddress() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ForwardedHeaders.X_FORWARDED_FOR, "203.0.113.7");

        ForwardedHeaders.applyForwarded(headers, "10.0.0.5", "https", "api.example.com");

        assertEquals("203.0.113.7, 10.0.0.5", headers.getFirst(ForwardedHeaders.X_FORWARDED_FOR));
        assertEquals("https", headers.getFirst(ForwardedHeaders.X_FORWARDED_PROTO));
        assertEquals("api.example.com", headers.getFirst(ForwardedHeaders.X_FORWARDED_HOST));
    }

    @Test
    void testForwardedForStartsChainWhenAbsent() {
        HttpHeaders headers = new HttpHeaders();

        ForwardedHeaders.applyForwarded(headers, "10.0.0.5", "http", null);

        assertEquals("10.0.0.5", headers.getFirst(ForwardedHeaders.X_FORWARDED_FOR));
        assertNull(headers.getFirst(ForwardedHeaders.X_FORWARDED_HOST));
    }
}
