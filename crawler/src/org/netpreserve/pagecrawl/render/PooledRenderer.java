package org.netpreserve.pagecrawl.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Renders pages on sessions borrowed from a {@link RendererPool}, waiting for content readiness before extracting.
 * A single deadline covers acquiring the session, loading the page and waiting. Once the page has loaded it is always
 * extracted, so a page that never settles yields whatever content it has when the deadline passes.
 */
public class PooledRenderer implements Renderer {
    private static final Logger log = LoggerFactory.getLogger(PooledRenderer.class);
    private final RendererPool pool;
    private final ReadinessDetector readinessDetector;

    public PooledRenderer(RendererPool pool, ReadinessDetector readinessDetector) {
        this.pool = pool;
        this.readinessDetector = readinessDetector;
    }

    @Override
    public RenderedPage render(String url, RenderOptions options) throws RenderException, InterruptedException {
        long deadline = System.nanoTime() + options.timeout().toNanos();
        RendererSession session = pool.acquire(options.isolated());
        try {
            log.atDebug().addKeyValue("url", url).addKeyValue("session", session.id()).log("Rendering");
            session.load(url, remaining(deadline, options));
            readinessDetector.await(session, Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
            long left = deadline - System.nanoTime();
            if (!options.waitForSelectors().isEmpty() && left > 0) {
                Duration selectorTimeout = min(options.selectorTimeout(), Duration.ofNanos(left));
                readinessDetector.waitForSelectors(session, options.waitForSelectors(), selectorTimeout);
            }
            RenderedPage page = session.extract();
            log.atDebug().addKeyValue("url", url).addKeyValue("textLength", page.text().length())
                    .addKeyValue("links", page.links().size()).log("Extracted page");
            return page;
        } finally {
            pool.release(session);
        }
    }

    private static Duration remaining(long deadline, RenderOptions options) throws RenderException {
        long nanos = deadline - System.nanoTime();
        if (nanos <= 0) {
            throw new RenderException("Render timeout after " + options.timeout().toMillis() + "ms");
        }
        return Duration.ofNanos(nanos);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public void close() {
        pool.teardownAll();
    }
}
