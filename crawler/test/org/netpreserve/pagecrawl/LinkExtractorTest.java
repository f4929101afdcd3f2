package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkExtractorTest {
    private final Scope scope = new Scope(List.of("https://docs.example.com/api"), true);

    @Test
    void testInternalLinks() {
        var extractor = new LinkExtractor(scope, false, 1);
        var links = extractor.extract(List.of(
                "/api/intro",
                "/api/intro#frag",
                "intro/../reference/",
                "/api-blog/post",
                "mailto:docs@example.com",
                "javascript:void(0)",
                "#top",
                "/api/manual.pdf",
                "ftp://docs.example.com/api/file"
        ), "https://docs.example.com/api/", 0);
        assertEquals(List.of(
                new LinkExtractor.Link("https://docs.example.com/api/intro", 0),
                new LinkExtractor.Link("https://docs.example.com/api/reference", 0)), links);
    }

    @Test
    void testExternalLinksNeedFollowExternal() {
        var hrefs = List.of("https://other.org/page", "https://docs.example.com/api/x");
        var none = new LinkExtractor(scope, false, 1).extract(hrefs, "https://docs.example.com/api", 0);
        assertEquals(List.of(new LinkExtractor.Link("https://docs.example.com/api/x", 0)), none);

        var some = new LinkExtractor(scope, true, 1).extract(hrefs, "https://docs.example.com/api", 0);
        assertEquals(List.of(
                new LinkExtractor.Link("https://other.org/page", 1),
                new LinkExtractor.Link("https://docs.example.com/api/x", 0)), some);
    }

    @Test
    void testHopLimit() {
        var extractor = new LinkExtractor(scope, true, 1);
        // found on an external page which is already one hop out
        var links = extractor.extract(List.of("https://third.net/", "https://docs.example.com/api/back"),
                "https://other.org/page", 1);
        assertEquals(List.of(new LinkExtractor.Link("https://docs.example.com/api/back", 0)), links);

        var deeper = new LinkExtractor(scope, true, 2).extract(List.of("https://third.net/"),
                "https://other.org/page", 1);
        assertEquals(List.of(new LinkExtractor.Link("https://third.net/", 2)), deeper);
    }

    @Test
    void testHrefsFromHtml() {
        String html = """
                <html><body>
                <a href="/one">One</a>
                <a class='x' href='/two'>Two</a>
                <a href=/three>Three</a>
                <map><area shape="rect" href="/four"></map>
                <a name="nohref">none</a>
                </body></html>""";
        // the quoted pattern also matches area tags, so /four comes before the unquoted /three
        assertEquals(List.of("/one", "/two", "/four", "/three"), LinkExtractor.hrefsFromHtml(html));
        assertEquals(List.of(), LinkExtractor.hrefsFromHtml(null));
    }

    @Test
    void testDeniedExtensions() {
        assertTrue(LinkExtractor.hasDeniedExtension("/files/Report.PDF"));
        assertTrue(LinkExtractor.hasDeniedExtension("/sitemap.xml"));
        assertFalse(LinkExtractor.hasDeniedExtension("/docs/page.html"));
        assertFalse(LinkExtractor.hasDeniedExtension("/docs/"));
    }
}
