package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlCanonicalizerTest {
    @Test
    void testCanonicalize() {
        assertEquals("https://example.com/a/b", UrlCanonicalizer.canonicalize("http://WWW.Example.com:80/a/b/?q=1#frag"));
        assertEquals("https://example.com/", UrlCanonicalizer.canonicalize("https://example.com"));
        assertEquals("https://example.com/", UrlCanonicalizer.canonicalize("https://www.www.example.com///"));
        assertEquals("https://example.com:8080/x", UrlCanonicalizer.canonicalize("http://example.com:8080/x"));
        assertEquals("https://example.com/docs", UrlCanonicalizer.canonicalize("https://example.com:443/docs/"));
    }

    @Test
    void testHostsOutsideUriGrammar() {
        assertEquals("https://my_host.example/docs", UrlCanonicalizer.canonicalize("http://My_Host.example/docs/"));
        assertEquals("https://my_host.example:8443/", UrlCanonicalizer.canonicalize("https://user@www.my_host.example:8443"));
        assertEquals("https://xn--bcher-kva.example/buch", UrlCanonicalizer.canonicalize("https://bücher.example/buch"));
        assertNull(UrlCanonicalizer.canonicalize("https://my_host.example:http/"));
    }

    @Test
    void testRejects() {
        assertNull(UrlCanonicalizer.canonicalize(null));
        assertNull(UrlCanonicalizer.canonicalize(""));
        assertNull(UrlCanonicalizer.canonicalize("   "));
        assertNull(UrlCanonicalizer.canonicalize("not a url"));
        assertNull(UrlCanonicalizer.canonicalize("ftp://example.com/file"));
        assertNull(UrlCanonicalizer.canonicalize("mailto:someone@example.com"));
        assertNull(UrlCanonicalizer.canonicalize("https://example.com/" + "a".repeat(UrlCanonicalizer.MAX_URL_LENGTH)));
    }

    @Test
    void testIdempotent() {
        for (String url : List.of("http://www.example.com/a/", "https://Docs.Example.com/api//",
                "http://example.com:8080/?x=1", "https://example.com/%7Euser/page#top", "https://Bücher.example/", "http://under_score.example/a/")) {
            String once = UrlCanonicalizer.canonicalize(url);
            assertNotNull(once, url);
            assertEquals(once, UrlCanonicalizer.canonicalize(once));
        }
    }
}
