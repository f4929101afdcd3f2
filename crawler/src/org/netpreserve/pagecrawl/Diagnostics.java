package org.netpreserve.pagecrawl;

import java.util.Map;

/**
 * Sink for errors worth keeping beyond the log. Implementations must never throw.
 */
public interface Diagnostics {
    void logError(String source, Throwable error, Map<String, Object> context);
}
