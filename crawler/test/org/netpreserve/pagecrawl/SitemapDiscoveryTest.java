package org.netpreserve.pagecrawl;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SitemapDiscoveryTest {
    private static final List<String> TARGETS = List.of("https://example.com/docs");
    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        serve("/sitemap.xml", """
                <?xml version="1.0" encoding="UTF-8"?>
                <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <sitemap><loc>%s/sitemap-docs.xml</loc></sitemap>
                  <sitemap><loc><![CDATA[%s/sitemap-blog.xml]]></loc></sitemap>
                  <sitemap><loc>%s/missing.xml</loc></sitemap>
                </sitemapindex>
                """.formatted(base, base, base));
        serve("/sitemap-docs.xml", """
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <url><loc>https://www.example.com/docs/</loc></url>
                  <url><loc>http://example.com/docs/intro/</loc></url>
                  <url><loc><![CDATA[https://example.com/docs/guide#setup]]></loc></url>
                  <url><loc>https://example.com/docs/feed.xml</loc></url>
                  <url><loc>https://example.com/docs-archive/old</loc></url>
                </urlset>
                """);
        serve("/sitemap-blog.xml", """
                <urlset><url><loc>https://example.com/blog/post</loc></url></urlset>
                """);
        server.start();
    }

    private void serve(String path, String body) {
        server.createContext(path, exchange -> {
            if (!exchange.getRequestURI().getPath().equals(path)) {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
                return;
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/xml");
            exchange.sendResponseHeaders(200, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private SitemapDiscovery discovery() {
        return new SitemapDiscovery(HttpClient.newHttpClient(), "pagecrawl-test");
    }

    @Test
    void testSitemapIndex() {
        List<String> urls = discovery().discoverFromSitemap(base + "/sitemap.xml", TARGETS, true);
        assertEquals(List.of("https://example.com/docs", "https://example.com/docs/intro",
                "https://example.com/docs/guide"), urls);
    }

    @Test
    void testNonStrictMatching() {
        List<String> urls = discovery().discoverFromSitemap(base + "/sitemap-docs.xml", TARGETS, false);
        assertTrue(urls.contains("https://example.com/docs-archive/old"));
    }

    @Test
    void testMissingSitemap() {
        assertEquals(List.of(), discovery().discoverFromSitemap(base + "/nothing-here.xml", TARGETS, true));
        assertEquals(List.of(), discovery().discoverFromSitemap("http://127.0.0.1:1/sitemap.xml", TARGETS, true));
    }

    @Test
    void testTargetsAlwaysIncluded() {
        // example.invalid never resolves so this exercises the fallback
        var targets = List.of("https://example.invalid/docs");
        assertEquals(targets, discovery().discoverSeedUrls(targets, true));
    }

    @Test
    void testParsing() {
        assertTrue(SitemapDiscovery.isSitemapIndex("<sitemapindex>"));
        assertFalse(SitemapDiscovery.isSitemapIndex("<urlset><url><loc>x</loc></url></urlset>"));
        assertEquals(List.of("https://a.example/1"), SitemapDiscovery.pageUrls(
                "<loc>https://a.example/1</loc><loc>ftp://a.example/2</loc><loc>https://a.example/s.xml</loc>"));
    }
}
