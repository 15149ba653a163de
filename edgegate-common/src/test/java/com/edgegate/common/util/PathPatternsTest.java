package com.edgegate.common.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PathPatternsTest {

    @Test
    void testDoubleWildcardMatchesPrefixAndDescendants() {
        assertTrue(PathPatterns.matches("/pricing", "/pricing/**"));
        assertTrue(PathPatterns.matches("/pricing/quotes/42", "/pricing/**"));
        assertFalse(PathPatterns.matches("/pricingx", "/pricing/**"));
    }

    @Test
    void testSingleWildcardMatchesOneSegment() {
        assertTrue(PathPatterns.matches("/users/42", "/users/*"));
        assertFalse(PathPatterns.matches("/users/42/orders", "/users/*"));
        assertFalse(PathPatterns.matches("/users/", "/users/*"));
    }

    @Test
    void testExactPattern() {
        assertTrue(PathPatterns.matches("/health", " /health "));
        assertFalse(PathPatterns.matches("/health/live", "/health"));
        assertFalse(PathPatterns.matches(null, "/health"));
    }

    @Test
    void testStripVersionPrefix() {
        assertEquals("/price", PathPatterns.stripPrefix("/api/v1/price", "/api/v1"));
        assertEquals("/price", PathPatterns.stripPrefix("/api/v1/price", "/api/v1/"));
        assertEquals("/", PathPatterns.stripPrefix("/api/v1", "/api/v1"));
        assertEquals("/api/v10/price", PathPatterns.stripPrefix("/api/v10/price", "/api/v1"));
        assertEquals("/price", PathPatterns.stripPrefix("/price", ""));
    }
}
