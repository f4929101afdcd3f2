package org.netpreserve.pagecrawl.render;

import java.time.Duration;
import java.util.List;

/**
 * @param timeout          deadline for the whole render: acquiring a session, loading, waiting and extracting
 * @param waitForSelectors CSS selectors that should all be present before extracting, may be empty
 * @param selectorTimeout  how long to wait for the selectors, bounded by the remaining deadline
 * @param isolated         render in a separate browser context that shares no cookies or storage
 */
public record RenderOptions(Duration timeout, List<String> waitForSelectors, Duration selectorTimeout,
                            boolean isolated) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public RenderOptions {
        waitForSelectors = waitForSelectors == null ? List.of() : List.copyOf(waitForSelectors);
    }

    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_TIMEOUT, List.of(), DEFAULT_TIMEOUT, false);
    }
}
