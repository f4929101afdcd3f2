package org.netpreserve.pagecrawl.cdp;

/**
 * A script evaluated in the page threw.
 */
public class JavaScriptException extends RuntimeException {
    public JavaScriptException(String message) {
        super(message);
    }
}
