package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.render.RenderOptions;
import org.netpreserve.pagecrawl.render.RenderedPage;
import org.netpreserve.pagecrawl.render.Renderer;
import org.netpreserve.pagecrawl.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A thread that repeatedly takes a URL from the frontier, renders it and saves its content.
 */
class CrawlWorker {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorker.class);
    static final long PAUSE_POLL_MILLIS = 1000;
    static final long QUEUE_WAIT_MILLIS = 500;
    private final int id;
    private final CrawlJob job;
    private final Frontier frontier;
    private final Storage storage;
    private final Renderer renderer;
    private final LinkExtractor linkExtractor;
    private final ContentDeduplicator deduplicator;
    private final Diagnostics diagnostics;
    private final RenderOptions renderOptions;
    private Thread thread;
    private volatile Info info;

    CrawlWorker(int id, CrawlJob job, Frontier frontier, Storage storage, Renderer renderer,
                LinkExtractor linkExtractor, ContentDeduplicator deduplicator, Diagnostics diagnostics,
                RenderOptions renderOptions) {
        this.id = id;
        this.job = job;
        this.frontier = frontier;
        this.storage = storage;
        this.renderer = renderer;
        this.linkExtractor = linkExtractor;
        this.deduplicator = deduplicator;
        this.diagnostics = diagnostics;
        this.renderOptions = renderOptions;
        this.info = new Info(id, null, Instant.now());
    }

    public record Info(int id, @Nullable String url, Instant updateTime) {
    }

    int id() {
        return id;
    }

    Info info() {
        return info;
    }

    synchronized void start() {
        log.debug("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (InterruptedException e) {
                log.debug("Worker {} interrupted", id);
            } catch (RuntimeException e) {
                log.error("Worker crashed", e);
            } finally {
                // don't let a cancellation interrupt leak into job completion
                Thread.interrupted();
                job.workerExited(this);
            }
        }, "Worker-" + id);
        thread.start();
    }

    synchronized void interrupt() {
        if (thread != null) thread.interrupt();
    }

    void run() throws InterruptedException {
        while (!job.isCancelled()) {
            if (frontier.hasMetPageLimit()) break;
            if (job.isPaused()) {
                Thread.sleep(PAUSE_POLL_MILLIS);
                continue;
            }
            if (!frontier.canGrabMoreUrls()) break;

            FrontierUrl frontierUrl = frontier.takeNext();
            if (frontierUrl == null) {
                if (!frontier.hasInFlight()) break;
                Thread.sleep(QUEUE_WAIT_MILLIS);
                continue;
            }

            info = new Info(id, frontierUrl.url(), Instant.now());
            try {
                process(frontierUrl);
            } finally {
                info = new Info(id, null, Instant.now());
            }
            job.recordProgress();

            if (frontier.hasMetPageLimit()) break;
            long delay = job.config().delay().toMillis();
            if (delay > 0) Thread.sleep(delay);
        }
    }

    /**
     * Processes one URL and releases it from the frontier with its outcome. Failures are recorded, not thrown.
     */
    void process(FrontierUrl frontierUrl) throws InterruptedException {
        log.atDebug().addKeyValue("url", frontierUrl.url()).addKeyValue("depth", frontierUrl.depth())
                .addKeyValue("worker", id).log("Processing");
        try {
            FrontierUrl.State outcome = fetch(frontierUrl);
            frontier.release(frontierUrl, job.isCancelled() && outcome != FrontierUrl.State.COMPLETED
                    ? FrontierUrl.State.DROPPED : outcome, null);
        } catch (InterruptedException e) {
            frontier.release(frontierUrl, FrontierUrl.State.DROPPED, null);
            throw e;
        } catch (Exception e) {
            if (job.isCancelled()) {
                log.debug("Ignoring error after cancellation for {}: {}", frontierUrl.url(), e.toString());
                frontier.release(frontierUrl, FrontierUrl.State.DROPPED, null);
                return;
            }
            String detail = LogUtils.describe(e);
            log.atWarn().addKeyValue("url", frontierUrl.url()).addKeyValue("worker", id)
                    .log("Failed to process page: {}", detail);
            diagnostics.logError("crawler", e, Map.of(
                    "url", frontierUrl.url(),
                    "jobId", job.id(),
                    "workerId", id,
                    "action", "processUrl"));
            frontier.release(frontierUrl, FrontierUrl.State.FAILED, detail);
        }
    }

    private FrontierUrl.State fetch(FrontierUrl frontierUrl) throws Exception {
        if (!job.config().skipCache()) {
            try {
                FrontierUrl.State cached = processCached(frontierUrl);
                if (cached != null) return cached;
            } catch (SchemaMismatchException e) {
                log.warn("Cached copy of {} unusable, fetching fresh: {}", frontierUrl.url(), e.getMessage());
            }
        }
        return processFresh(frontierUrl);
    }

    /**
     * Reuses a page saved by an earlier job, if there is one.
     *
     * @return the outcome, or null if nothing usable is cached
     */
    private FrontierUrl.State processCached(FrontierUrl frontierUrl) throws Exception {
        PageRecord cached = storage.getPageByCanonicalUrl(frontierUrl.url());
        if (cached == null) return null;
        String jobId = job.id();
        String hash = cached.contentHash() != null ? cached.contentHash()
                : ContentDeduplicator.hash(ContentDeduplicator.clean(cached.content()));

        if (deduplicator.mergeIfDuplicate(jobId, hash, frontierUrl.url())) {
            pushLinks(frontierUrl, cachedLinks(frontierUrl, cached), frontierUrl.url());
            return FrontierUrl.State.DUPLICATE;
        }
        if (!frontier.hasCapacity(frontierUrl.target())) {
            pushLinks(frontierUrl, cachedLinks(frontierUrl, cached), frontierUrl.url());
            return FrontierUrl.State.DROPPED;
        }
        storage.savePage(jobId, frontierUrl.url(), frontierUrl.url(), cached.content(), cached.html(), hash,
                cached.metadata(), cached.markdown());
        log.atInfo().addKeyValue("url", frontierUrl.url()).addKeyValue("fromJob", cached.jobId())
                .log("Saved page from cache");
        pushLinks(frontierUrl, cachedLinks(frontierUrl, cached), frontierUrl.url());
        return FrontierUrl.State.COMPLETED;
    }

    /**
     * Links of a cached page come from its HTML. Pages cached without HTML are rendered once to find them.
     */
    private List<String> cachedLinks(FrontierUrl frontierUrl, PageRecord cached) throws Exception {
        if (cached.html() != null && !cached.html().isEmpty()) return LinkExtractor.hrefsFromHtml(cached.html());
        RenderedPage page = renderer.render(frontierUrl.url(), renderOptions);
        return linksOf(page);
    }

    private FrontierUrl.State processFresh(FrontierUrl frontierUrl) throws Exception {
        RenderedPage page = renderer.render(frontierUrl.url(), renderOptions);
        if (job.isCancelled()) return FrontierUrl.State.DROPPED;
        String baseUrl = page.url() == null || page.url().isEmpty() ? frontierUrl.url() : page.url();
        pushLinks(frontierUrl, linksOf(page), baseUrl);

        String text = ContentDeduplicator.clean(page.text());
        String hash = ContentDeduplicator.hash(text);
        if (deduplicator.mergeIfDuplicate(job.id(), hash, frontierUrl.url())) {
            return FrontierUrl.State.DUPLICATE;
        }
        // another worker may have filled the quota while we were rendering
        if (!frontier.hasCapacity(frontierUrl.target())) {
            log.debug("Page limit reached for {}, dropping {}", frontierUrl.target(), frontierUrl.url());
            return FrontierUrl.State.DROPPED;
        }
        storage.savePage(job.id(), frontierUrl.url(), frontierUrl.url(), text, page.html(), hash,
                page.metadata(), page.markdown());
        log.atInfo().addKeyValue("url", frontierUrl.url()).addKeyValue("length", text.length())
                .addKeyValue("worker", id).log("Saved page");
        return FrontierUrl.State.COMPLETED;
    }

    private static List<String> linksOf(RenderedPage page) {
        if (page.links() != null && !page.links().isEmpty()) return page.links();
        return LinkExtractor.hrefsFromHtml(page.html());
    }

    private void pushLinks(FrontierUrl from, List<String> hrefs, String baseUrl) {
        if (job.isCancelled()) return;
        var links = linkExtractor.extract(hrefs, baseUrl, from.depth());
        int added = frontier.addAll(links);
        if (added > 0) log.debug("Queued {} new URLs from {}", added, from.url());
    }
}
