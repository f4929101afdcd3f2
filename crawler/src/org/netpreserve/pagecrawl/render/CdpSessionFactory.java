package org.netpreserve.pagecrawl.render;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.cdp.BrowserProcess;
import org.netpreserve.pagecrawl.cdp.Navigator;
import org.netpreserve.pagecrawl.cdp.domains.Browser;
import org.netpreserve.pagecrawl.cdp.protocol.CDPClosedException;
import org.netpreserve.pagecrawl.cdp.protocol.CDPException;
import org.netpreserve.pagecrawl.cdp.protocol.CDPTimeoutException;
import org.netpreserve.pagecrawl.config.BrowserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Opens browser tabs as renderer sessions. Restarts the browser when it has crashed or stopped responding; the pool
 * then discards the dead tabs of the old browser on its next acquire.
 */
public class CdpSessionFactory implements SessionFactory {
    private static final Logger log = LoggerFactory.getLogger(CdpSessionFactory.class);
    private final BrowserConfig config;
    private final AtomicInteger sessionCounter = new AtomicInteger();
    private volatile BrowserProcess browserProcess;
    private @Nullable String isolatedContextId;
    private boolean closed;

    public CdpSessionFactory(BrowserConfig config) throws IOException {
        this.config = config;
        start();
    }

    private void start() throws IOException {
        browserProcess = BrowserProcess.start(
                config.executable(),
                config.options(),
                null,
                config.shell());
    }

    private synchronized void restart(Throwable reason) {
        log.warn("Restarting browser after crash.", reason);
        isolatedContextId = null;
        browserProcess.close();
        try {
            start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public RendererSession create(boolean isolated) throws RenderException {
        synchronized (this) {
            if (closed) throw new RenderException("Browser has been shut down");
            if (!browserProcess.isAlive()) restart(new IOException("Browser process is no longer running"));
        }
        String id = (isolated ? "isolated-" : "tab-") + sessionCounter.incrementAndGet();
        try {
            Navigator navigator = restartOnError(browser -> browser.newWindow(isolated ? isolatedContext(browser) : null));
            return new CdpRendererSession(id, navigator, config.userAgent());
        } catch (CDPException | UncheckedIOException e) {
            throw new RenderException("Unable to open browser tab: " + e.getMessage(), e);
        }
    }

    /**
     * The isolated context is created on first use and shared by all isolated sessions.
     */
    private synchronized String isolatedContext(BrowserProcess browser) {
        if (isolatedContextId == null) {
            isolatedContextId = browser.createBrowserContext();
            log.info("Created isolated browser context {}", isolatedContextId);
        }
        return isolatedContextId;
    }

    public Browser.Version version() {
        return restartOnError(BrowserProcess::version);
    }

    public <T> T restartOnError(Function<BrowserProcess, T> body) {
        try {
            return body.apply(browserProcess);
        } catch (UncheckedIOException e) {
            if (e.getCause() != null && "Stream closed".equalsIgnoreCase(e.getCause().getMessage())) {
                restart(e);
                return body.apply(browserProcess);
            }
            throw e;
        } catch (CDPTimeoutException | CDPClosedException e) {
            restart(e);
            return body.apply(browserProcess);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (isolatedContextId != null) {
            try {
                browserProcess.disposeBrowserContext(isolatedContextId);
            } catch (CDPException e) {
                log.warn("Unable to dispose isolated browser context: {}", e.getMessage());
            }
            isolatedContextId = null;
        }
        browserProcess.close();
    }
}
