package org.netpreserve.pagecrawl.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.PageMetadata;
import org.netpreserve.pagecrawl.cdp.JavaScriptException;
import org.netpreserve.pagecrawl.cdp.NavigationException;
import org.netpreserve.pagecrawl.cdp.Navigator;
import org.netpreserve.pagecrawl.cdp.protocol.CDPException;
import org.netpreserve.pagecrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * A renderer session backed by one browser tab.
 */
public class CdpRendererSession implements RendererSession {
    private static final Logger log = LoggerFactory.getLogger(CdpRendererSession.class);
    private static final ObjectMapper json = new ObjectMapper().findAndRegisterModules();
    private final String id;
    private final Navigator navigator;
    private volatile boolean closed;

    public CdpRendererSession(String id, Navigator navigator, @Nullable String userAgent) {
        this.id = id;
        this.navigator = navigator;
        if (userAgent != null) navigator.setUserAgent(userAgent);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isAlive() {
        return !closed && navigator.isAttached();
    }

    @Override
    public void disableThrottling() throws RenderException {
        try {
            navigator.keepActiveInBackground();
        } catch (CDPException e) {
            throw new RenderException("Unable to disable throttling: " + e.getMessage(), e);
        }
    }

    @Override
    public void load(String url, Duration timeout) throws RenderException, InterruptedException {
        try {
            navigator.navigateTo(new Url(url), timeout);
        } catch (NavigationException e) {
            throw new RenderException(e.getMessage(), e);
        } catch (CDPException e) {
            throw new RenderException("Browser error loading " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T runProbe(Probe<T> probe) throws RenderException {
        try {
            Object value = navigator.eval(probe.script());
            return probe.reader().apply(value);
        } catch (JavaScriptException | CDPException e) {
            throw new RenderException("Probe " + probe.name() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public RenderedPage extract() throws RenderException {
        try {
            String url = Objects.requireNonNullElse(navigator.eval("location.href"), "");
            String html = navigator.html();
            String text = navigator.extractText();
            var links = navigator.extractLinks();
            PageMetadata metadata = json.convertValue(navigator.extractMetadata(), PageMetadata.class);
            return new RenderedPage(url, html, text, links, metadata, null);
        } catch (JavaScriptException | CDPException e) {
            throw new RenderException("Extraction failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new RenderException("Unreadable page metadata: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            navigator.close();
        } catch (CDPException e) {
            log.debug("Error closing tab {}: {}", id, e.getMessage());
        }
    }
}
