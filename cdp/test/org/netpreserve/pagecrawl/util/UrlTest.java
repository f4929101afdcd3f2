package org.netpreserve.pagecrawl.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlTest {
    @Test
    void resolve() {
        var base = new Url("https://example.com/docs/guide?x=1#top");
        assertEquals("https://example.com/docs/intro", base.resolve("intro").toString());
        assertEquals("https://example.com/api", base.resolve("/api").toString());
        assertEquals("https://other.org/", base.resolve("//other.org/").toString());
        assertEquals("https://example.com/docs/guide?y=2", base.resolve("?y=2").toString());
        assertEquals("https://example.com/docs/guide?x=1#sec", base.resolve("#sec").toString());
        assertEquals("https://example.com/docs/a%20b", base.resolve("a b").toString());
        assertEquals("https://example.com/x", new Url("https://example.com").resolve("x").toString());
        assertNull(new Url("not a url").resolve("x"));
    }

    @Test
    void components() {
        var url = new Url("http://Example.com:8080/a/b?q=1#f");
        assertEquals("http", url.scheme());
        assertEquals("Example.com", url.host());
        assertEquals(8080, url.port());
        assertEquals("/a/b", url.path());
        assertEquals("q=1", url.query());
        assertEquals("http://Example.com:8080", url.origin().toString());
        assertEquals("http://Example.com:8080/sitemap.xml", url.withPath("/sitemap.xml").toString());
        assertEquals("http://Example.com:8080/a/b?q=1", url.withoutFragment().toString());
        assertTrue(url.isHttp());
        assertEquals("", new Url("https://example.com").path());
    }

    @Test
    void invalid() {
        var url = new Url("http://[::1/");
        assertFalse(url.isValid());
        assertNull(url.host());
        assertEquals("", url.path());
        assertFalse(new Url("mailto:someone@example.com").isHttp());
    }
}
