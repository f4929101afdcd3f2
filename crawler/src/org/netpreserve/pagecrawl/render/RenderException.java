package org.netpreserve.pagecrawl.render;

/**
 * A page could not be rendered. Affects only the URL being rendered.
 */
public class RenderException extends Exception {
    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
