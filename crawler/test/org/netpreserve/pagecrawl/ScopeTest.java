package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTest {
    @Test
    void testStrictMatching() {
        String base = "https://example.com/financial-apis";
        assertTrue(Scope.isUnderBasePath("https://example.com/financial-apis", base, true));
        assertTrue(Scope.isUnderBasePath("https://example.com/financial-apis/overview", base, true));
        assertFalse(Scope.isUnderBasePath("https://example.com/financial-apis-blog", base, true));
        assertTrue(Scope.isUnderBasePath("https://example.com/financial-apis-blog", base, false));
    }

    @Test
    void testRootMatchesWholeHost() {
        assertTrue(Scope.isUnderBasePath("https://example.com/anything/at/all", "https://example.com/", true));
        assertFalse(Scope.isUnderBasePath("https://other.com/", "https://example.com/", true));
        assertFalse(Scope.isUnderBasePath("https://sub.example.com/", "https://example.com/", true));
        assertFalse(Scope.isUnderBasePath("https://example.com:8443/", "https://example.com/", true));
    }

    @Test
    void testUnderscoreHost() {
        String base = UrlCanonicalizer.canonicalize("https://dev_docs.example.com/api");
        assertTrue(Scope.isUnderBasePath("https://dev_docs.example.com/api/intro", base, true));
        assertFalse(Scope.isUnderBasePath("https://docs.example.com/api/intro", base, true));
    }

    @Test
    void testTargetFor() {
        var scope = new Scope(List.of("https://example.com/docs", "https://example.com/"), true);
        assertEquals("https://example.com/docs", scope.targetFor("https://example.com/docs/intro"));
        assertEquals("https://example.com/", scope.targetFor("https://example.com/docs-old"));
        assertNull(scope.targetFor("https://elsewhere.org/docs"));
        assertTrue(scope.isInternal("https://example.com/blog"));
        assertFalse(scope.isInternal("https://elsewhere.org/"));
    }
}
