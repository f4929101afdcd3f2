package org.netpreserve.pagecrawl.cdp.protocol;

/**
 * Error reported by the browser in response to a command.
 * <p>
 * Stack traces are only captured on the calling thread (see {@link #actuallyFillInStackTrace()}) since the
 * exception is created on the CDP event thread where the trace is meaningless.
 */
public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(message + " [" + code + "]");
        this.code = code;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    public void actuallyFillInStackTrace() {
        super.fillInStackTrace();
    }

    public int getCode() {
        return code;
    }
}
