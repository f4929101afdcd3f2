package org.netpreserve.pagecrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for how the crawl should behave.
 *
 * @param workers         number of pages rendered concurrently (1-10)
 * @param pageLimit       maximum pages saved per target, null or 0 for no limit
 * @param strict          require a path segment boundary after the target path
 * @param skipCache       always render, even if the page was saved by an earlier job
 * @param isolated        render in a separate browser context without the default profile's cookies
 * @param followExternal  follow links leading outside the targets
 * @param maxHops         how many links deep to follow outside the targets (1-5)
 * @param waitFor         CSS selectors to wait for before extracting
 * @param selectorTimeout how long to wait for {@code waitFor} selectors
 * @param pageTimeout     deadline for rendering a single page
 * @param delay           pause between pages for each worker
 */
public record CrawlConfig(
        int workers,
        @Nullable Integer pageLimit,
        boolean strict,
        boolean skipCache,
        boolean isolated,
        boolean followExternal,
        int maxHops,
        List<String> waitFor,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration selectorTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pageTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration delay
) {
    public static final int DEFAULT_WORKERS = 5;
    public static final int MAX_WORKERS = 10;
    public static final int DEFAULT_MAX_HOPS = 1;
    public static final int MAX_HOPS = 5;

    public CrawlConfig {
        waitFor = waitFor == null ? List.of() : List.copyOf(waitFor);
    }

    public static CrawlConfig defaults() {
        return new CrawlConfig(DEFAULT_WORKERS, null, true, false, false, false, DEFAULT_MAX_HOPS, List.of(),
                Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofMillis(500));
    }

    /**
     * Returns a copy with out-of-range values clamped and missing durations defaulted.
     */
    public CrawlConfig normalized() {
        var defaults = defaults();
        int workers = Math.max(1, Math.min(this.workers, MAX_WORKERS));
        int maxHops = this.maxHops <= 0 ? DEFAULT_MAX_HOPS : Math.min(this.maxHops, MAX_HOPS);
        Integer pageLimit = this.pageLimit == null || this.pageLimit <= 0 ? null : this.pageLimit;
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout == null ? defaults.selectorTimeout : selectorTimeout,
                pageTimeout == null ? defaults.pageTimeout : pageTimeout,
                delay == null ? defaults.delay : delay);
    }

    public CrawlConfig withWorkers(int workers) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withPageLimit(@Nullable Integer pageLimit) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withStrict(boolean strict) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withSkipCache(boolean skipCache) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withIsolated(boolean isolated) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withFollowExternal(boolean followExternal, int maxHops) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withWaitFor(List<String> waitFor) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }

    public CrawlConfig withDelay(Duration delay) {
        return new CrawlConfig(workers, pageLimit, strict, skipCache, isolated, followExternal, maxHops, waitFor,
                selectorTimeout, pageTimeout, delay);
    }
}
