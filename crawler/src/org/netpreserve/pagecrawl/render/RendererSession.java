package org.netpreserve.pagecrawl.render;

import java.time.Duration;

/**
 * One long-lived rendering surface, such as a browser tab, that renders pages one at a time.
 */
public interface RendererSession {
    String id();

    /**
     * False once the underlying tab or browser has gone away.
     */
    boolean isAlive();

    /**
     * Stops the browser from throttling timers and rendering while the session isn't in the foreground.
     * Idempotent.
     */
    void disableThrottling() throws RenderException;

    /**
     * Navigates to {@code url} and waits for the load event.
     */
    void load(String url, Duration timeout) throws RenderException, InterruptedException;

    <T> T runProbe(Probe<T> probe) throws RenderException;

    /**
     * Reads the HTML, text, links and metadata of the currently loaded page.
     */
    RenderedPage extract() throws RenderException;

    void close();
}
