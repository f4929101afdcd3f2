package org.netpreserve.pagecrawl;

import org.netpreserve.pagecrawl.render.RenderException;
import org.netpreserve.pagecrawl.render.RenderOptions;
import org.netpreserve.pagecrawl.render.RenderedPage;
import org.netpreserve.pagecrawl.render.Renderer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * Serves a fixed set of pages. Unknown URLs render as a page with unique text and no links.
 */
class FakeRenderer implements Renderer {
    private final Map<String, Page> pages = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final Set<String> hanging = new HashSet<>();
    private final List<String> requested = new ArrayList<>();
    final CountDownLatch hangStarted = new CountDownLatch(1);
    private volatile boolean closed;

    record Page(String text, List<String> links) {
    }

    FakeRenderer page(String url, String text, String... links) {
        pages.put(url, new Page(text, List.of(links)));
        return this;
    }

    FakeRenderer failing(String url) {
        failing.add(url);
        return this;
    }

    FakeRenderer hanging(String url) {
        hanging.add(url);
        return this;
    }

    synchronized List<String> requested() {
        return new ArrayList<>(requested);
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public RenderedPage render(String url, RenderOptions options) throws RenderException, InterruptedException {
        synchronized (this) {
            requested.add(url);
        }
        if (failing.contains(url)) throw new RenderException("Navigation failed: net::ERR_CONNECTION_REFUSED");
        if (hanging.contains(url)) {
            hangStarted.countDown();
            Thread.sleep(60_000);
        }
        Page page = pages.getOrDefault(url, new Page("Content of " + url, List.of()));
        var html = new StringBuilder("<html><body><p>").append(page.text()).append("</p>");
        for (String link : page.links()) {
            html.append("<a href=\"").append(link).append("\">link</a>");
        }
        html.append("</body></html>");
        return new RenderedPage(url, html.toString(), page.text(), page.links(), PageMetadata.ofTitle(url), null);
    }

    @Override
    public void close() {
        closed = true;
    }
}
