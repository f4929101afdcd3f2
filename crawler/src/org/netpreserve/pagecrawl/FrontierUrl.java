package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A URL waiting to be crawled, or being crawled, within one job.
 *
 * @param url    canonical URL
 * @param depth  0 for URLs under a target, otherwise the number of hops outside the targets
 * @param target the target the URL falls under, or null for external URLs
 */
public record FrontierUrl(
        @NotNull String url,
        int depth,
        @Nullable String target
) {
    public enum State {
        QUEUED, IN_FLIGHT, COMPLETED, DUPLICATE, DROPPED, FAILED
    }

    public boolean isExternal() {
        return target == null;
    }
}
