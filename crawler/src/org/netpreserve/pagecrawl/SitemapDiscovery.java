package org.netpreserve.pagecrawl;

import org.apache.commons.lang3.StringUtils;
import org.netpreserve.pagecrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seeds a crawl from {@code /sitemap.xml} on the first target's origin. Sitemap indexes are followed up to
 * {@link #MAX_DEPTH} levels deep. Only URLs under one of the targets are kept.
 */
public class SitemapDiscovery implements Discovery {
    private static final Logger log = LoggerFactory.getLogger(SitemapDiscovery.class);
    static final Duration FETCH_TIMEOUT = Duration.ofSeconds(10);
    static final Duration NESTED_FETCH_TIMEOUT = Duration.ofSeconds(5);
    static final Duration TOTAL_TIMEOUT = Duration.ofSeconds(30);
    static final int MAX_DEPTH = 2;
    private static final Pattern SITEMAP_INDEX = Pattern.compile("<sitemapindex|<sitemap>", Pattern.CASE_INSENSITIVE);
    private static final Pattern NESTED_SITEMAP = Pattern.compile(
            "<sitemap[^>]*>[\\s\\S]*?<loc>(?:<!\\[CDATA\\[)?(.*?)(?:]]>)?</loc>[\\s\\S]*?</sitemap>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LOC = Pattern.compile("<loc>(?:<!\\[CDATA\\[)?(.*?)(?:]]>)?</loc>",
            Pattern.CASE_INSENSITIVE);
    private final HttpClient httpClient;
    private final String userAgent;

    public SitemapDiscovery(HttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    @Override
    public List<String> discoverSeedUrls(List<String> targets, boolean strict) {
        var seeds = new LinkedHashSet<>(targets);
        if (targets.isEmpty()) return new ArrayList<>(seeds);
        Url origin = new Url(targets.get(0)).origin();
        if (origin == null) return new ArrayList<>(seeds);
        seeds.addAll(discoverFromSitemap(origin + "/sitemap.xml", targets, strict));
        return new ArrayList<>(seeds);
    }

    /**
     * Fetches the sitemap and returns the canonical form of every page URL in it that falls under a target. Returns
     * an empty list if the sitemap is missing or unreadable.
     */
    public List<String> discoverFromSitemap(String sitemapUrl, List<String> targets, boolean strict) {
        long deadline = System.nanoTime() + TOTAL_TIMEOUT.toNanos();
        List<String> urls;
        try {
            urls = fetchAndParse(sitemapUrl, 0, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during sitemap discovery");
            return List.of();
        }
        var filtered = new LinkedHashSet<String>();
        for (String url : urls) {
            String canonical = UrlCanonicalizer.canonicalize(url);
            if (canonical != null && Scope.isInternal(canonical, targets, strict)) filtered.add(canonical);
        }
        log.atInfo().addKeyValue("sitemap", sitemapUrl).addKeyValue("entries", urls.size())
                .addKeyValue("inScope", filtered.size()).log("Sitemap discovery finished");
        return new ArrayList<>(filtered);
    }

    private List<String> fetchAndParse(String sitemapUrl, int depth, long deadline) throws InterruptedException {
        if (System.nanoTime() - deadline >= 0) {
            log.info("Sitemap discovery time limit reached, skipping {}", sitemapUrl);
            return List.of();
        }
        if (depth > MAX_DEPTH) {
            log.info("Sitemap nesting limit reached, skipping {}", sitemapUrl);
            return List.of();
        }
        String xml = fetch(sitemapUrl, depth == 0 ? FETCH_TIMEOUT : NESTED_FETCH_TIMEOUT);
        if (xml == null) return List.of();

        if (isSitemapIndex(xml)) {
            List<String> nested = nestedSitemaps(xml);
            log.debug("Sitemap index {} lists {} sitemaps", sitemapUrl, nested.size());
            var urls = new ArrayList<String>();
            for (String nestedUrl : nested) {
                if (System.nanoTime() - deadline >= 0) {
                    log.info("Sitemap discovery time limit reached, skipping remaining nested sitemaps");
                    break;
                }
                urls.addAll(fetchAndParse(nestedUrl, depth + 1, deadline));
            }
            return urls;
        }
        return pageUrls(xml);
    }

    private String fetch(String url, Duration timeout) throws InterruptedException {
        try {
            var request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .build();
            var response = httpClient.send(request, BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.debug("Sitemap not found ({}): {}", response.statusCode(), url);
                return null;
            }
            return response.body();
        } catch (HttpTimeoutException e) {
            log.warn("Sitemap fetch timed out after {}ms: {}", timeout.toMillis(), url);
            return null;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Error fetching sitemap {}: {}", url, e.toString());
            return null;
        }
    }

    static boolean isSitemapIndex(String xml) {
        return SITEMAP_INDEX.matcher(xml).find();
    }

    static List<String> nestedSitemaps(String xml) {
        var urls = new ArrayList<String>();
        Matcher matcher = NESTED_SITEMAP.matcher(xml);
        while (matcher.find()) {
            String url = matcher.group(1).strip();
            if (isHttp(url)) urls.add(url);
        }
        return urls;
    }

    /**
     * Page URLs of a regular sitemap. Entries ending in .xml are sitemaps rather than pages and are skipped.
     */
    static List<String> pageUrls(String xml) {
        var urls = new ArrayList<String>();
        Matcher matcher = LOC.matcher(xml);
        while (matcher.find()) {
            String url = matcher.group(1).strip();
            if (isHttp(url) && !StringUtils.endsWithIgnoreCase(url, ".xml")) urls.add(url);
        }
        return urls;
    }

    private static boolean isHttp(String url) {
        return StringUtils.startsWithAny(url, "http://", "https://");
    }
}
