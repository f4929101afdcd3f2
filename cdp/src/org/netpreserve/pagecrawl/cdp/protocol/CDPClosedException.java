package org.netpreserve.pagecrawl.cdp.protocol;

/**
 * The connection to the browser was closed while a command was outstanding.
 */
public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        super(0, "CDP connection closed");
        actuallyFillInStackTrace();
    }
}
