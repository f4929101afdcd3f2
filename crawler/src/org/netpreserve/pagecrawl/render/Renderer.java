package org.netpreserve.pagecrawl.render;

/**
 * Turns a URL into rendered content by executing the page's JavaScript.
 */
public interface Renderer extends AutoCloseable {
    RenderedPage render(String url, RenderOptions options) throws RenderException, InterruptedException;

    /**
     * Releases every browser resource. Safe to call more than once.
     */
    @Override
    void close();
}
