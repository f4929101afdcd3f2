package org.netpreserve.pagecrawl.cdp;

import org.intellij.lang.annotations.Language;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.cdp.domains.Emulation;
import org.netpreserve.pagecrawl.cdp.domains.Network;
import org.netpreserve.pagecrawl.cdp.domains.Page;
import org.netpreserve.pagecrawl.cdp.domains.Runtime;
import org.netpreserve.pagecrawl.cdp.protocol.CDPException;
import org.netpreserve.pagecrawl.cdp.protocol.CDPSession;
import org.netpreserve.pagecrawl.cdp.protocol.CDPTimeoutException;
import org.netpreserve.pagecrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Drives a single browser tab: navigation, script evaluation and content extraction.
 */
public class Navigator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Navigator.class);
    private static final String bootstrapScript = loadResource("pagecrawl.js");
    private static final int EVAL_TIMEOUT_MILLIS = 5000;
    private final Emulation emulation;
    private final Page page;
    private final Runtime runtime;
    private final AtomicReference<Navigation> currentNavigation = new AtomicReference<>();
    private final CDPSession cdpSession;
    private volatile Page.LifecycleEvent lastLoadEvent;

    public record Navigation(Page.FrameId frameId, Network.LoaderId loaderId,
                             CompletableFuture<Network.MonotonicTime> loadEvent) {
        Navigation(Page.FrameId frameId, Network.LoaderId loaderId) {
            this(frameId, loaderId, new CompletableFuture<>());
        }
    }

    public Navigator(CDPSession cdpSession) {
        this.cdpSession = cdpSession;
        this.emulation = cdpSession.domain(Emulation.class);
        this.page = cdpSession.domain(Page.class);
        this.runtime = cdpSession.domain(Runtime.class);

        page.onLifecycleEvent(this::handleLifecycleEvent);
        page.enable();
        runtime.enable();
        page.setLifecycleEventsEnabled(true);
        page.addScriptToEvaluateOnNewDocument(bootstrapScript, null);
    }

    private void handleLifecycleEvent(Page.LifecycleEvent event) {
        if (event.name().equals("load")) lastLoadEvent = event;
        var navigation = currentNavigation.get();
        if (navigation == null) return;
        if (!navigation.frameId().equals(event.frameId())) return;
        if (!navigation.loaderId().equals(event.loaderId())) {
            log.trace("Ignoring lifecycle event for other loader {}", event);
            return;
        }
        if (event.name().equals("load")) {
            navigation.loadEvent().complete(event.timestamp());
        }
    }

    /**
     * Keeps the tab executing at full speed while it's not the focused window. Safe to call more than once.
     */
    public void keepActiveInBackground() {
        emulation.setFocusEmulationEnabled(true);
        try {
            page.setWebLifecycleState("active");
        } catch (CDPException e) {
            // older browsers lack this command, focus emulation alone is enough there
            log.debug("setWebLifecycleState unsupported: {}", e.getMessage());
        }
    }

    public void setUserAgent(String userAgent) {
        emulation.setUserAgentOverride(userAgent);
    }

    /**
     * Navigates the tab and waits for the load event.
     *
     * @throws NavigationFailedException   if the browser couldn't fetch the document
     * @throws NavigationTimedOutException if the load event didn't fire within {@code loadTimeout}
     */
    public Navigation navigateTo(Url url, Duration loadTimeout) throws NavigationException, InterruptedException {
        Page.Navigate result;
        try {
            result = page.navigate(url.toString());
        } catch (CDPTimeoutException e) {
            throw new NavigationTimedOutException(url, "Timed out waiting for Page.navigate");
        }
        if (result.errorText() != null) {
            throw new NavigationFailedException(url, result.errorText());
        }
        if (result.loaderId() == null) {
            // same-document navigation, there will be no load event
            return new Navigation(result.frameId(), null, CompletableFuture.completedFuture(null));
        }
        var navigation = new Navigation(result.frameId(), result.loaderId());
        var previous = currentNavigation.getAndSet(navigation);
        if (previous != null) {
            previous.loadEvent().completeExceptionally(new NavigationException(url, "Superseded by navigateTo()"));
        }
        // the load event may have been dispatched before we registered the navigation
        var early = lastLoadEvent;
        if (early != null && navigation.loaderId().equals(early.loaderId())) {
            navigation.loadEvent().complete(early.timestamp());
        }
        try {
            navigation.loadEvent().get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NavigationException navigationException) throw navigationException;
            throw new NavigationException(url, "Navigation aborted: " + e.getCause());
        } catch (TimeoutException e) {
            throw new NavigationTimedOutException(url, "Tab load timeout after " + loadTimeout.toMillis() + "ms");
        }
        return navigation;
    }

    @Override
    public void close() {
        var navigation = currentNavigation.getAndSet(null);
        if (navigation != null) {
            navigation.loadEvent().cancel(false);
        }
        cdpSession.close();
    }

    public boolean isAttached() {
        return cdpSession.isAttached();
    }

    public String targetId() {
        return cdpSession.targetId();
    }

    public <T> T eval(@Language("JavaScript") String script) {
        return evaluate(script);
    }

    @SuppressWarnings("unchecked")
    private <T> T evaluate(String script) {
        var evaluate = runtime.evaluate(script, EVAL_TIMEOUT_MILLIS, true, false, null);
        if (evaluate.exceptionDetails() != null) {
            var details = evaluate.exceptionDetails();
            String description = details.exception() != null && details.exception().value() != null ?
                    details.exception().value().asText() : details.text();
            throw new JavaScriptException(description);
        }
        return (T) evaluate.result().toJavaObject();
    }

    public String html() {
        String html = eval("document.documentElement ? document.documentElement.outerHTML : ''");
        return Objects.requireNonNullElse(html, "");
    }

    public @Nullable String title() {
        return eval("document.title");
    }

    /**
     * Returns the visible text of the main content region, falling back to the whole body.
     */
    public String extractText() {
        String text = eval("""
                (function() {
                    const main = document.querySelector('main, article, [role="main"], .content, #content');
                    const root = main || document.body;
                    return root ? root.innerText : '';
                })()
                """);
        return Objects.requireNonNullElse(text, "");
    }

    /**
     * Returns the raw href attribute of every anchor and image-map area, in document order.
     */
    public List<String> extractLinks() {
        List<String> hrefs = eval("""
                Array.from(document.querySelectorAll('a[href], area[href]'))
                    .map(el => el.getAttribute('href'))
                    .filter(href => href !== null)
                """);
        return hrefs == null ? List.of() : hrefs;
    }

    /**
     * Reads descriptive metadata from the document head. Absent values are omitted from the map.
     */
    public Map<String, Object> extractMetadata() {
        Map<String, Object> metadata = eval("""
                (function() {
                    const get = (selector, attr = 'content') => {
                        const el = document.querySelector(selector);
                        return el ? el[attr] || null : null;
                    };
                    const metadata = {
                        title: document.title || null,
                        description: get('meta[name="description"]'),
                        keywords: get('meta[name="keywords"]'),
                        author: get('meta[name="author"]'),
                        generator: get('meta[name="generator"]'),
                        ogTitle: get('meta[property="og:title"]'),
                        ogDescription: get('meta[property="og:description"]'),
                        ogType: get('meta[property="og:type"]'),
                        ogSiteName: get('meta[property="og:site_name"]'),
                        articleSection: get('meta[property="article:section"]'),
                        canonical: get('link[rel="canonical"]', 'href'),
                        language: document.documentElement ? document.documentElement.lang || null : null
                    };
                    const tags = Array.from(document.querySelectorAll('meta[property="article:tag"]'))
                        .map(tag => tag.content).filter(Boolean);
                    if (tags.length > 0) metadata.articleTags = tags;
                    for (const script of document.querySelectorAll('script[type="application/ld+json"]')) {
                        try {
                            const data = JSON.parse(script.textContent);
                            if (data && (data.headline || data.description || data.name)) {
                                metadata.jsonLd = {
                                    type: data['@type'] || null,
                                    headline: data.headline || null,
                                    description: data.description || null,
                                    name: data.name || null,
                                    author: (data.author && data.author.name) || null
                                };
                                break;
                            }
                        } catch (e) {
                            // not valid JSON, try the next block
                        }
                    }
                    for (const key of Object.keys(metadata)) {
                        if (metadata[key] === null) delete metadata[key];
                    }
                    return metadata;
                })()
                """);
        return metadata == null ? Map.of() : metadata;
    }

    private static String loadResource(String name) {
        try (InputStream stream = Navigator.class.getResourceAsStream(name)) {
            if (stream == null) throw new IllegalStateException("Missing resource " + name);
            return new String(stream.readAllBytes(), UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
