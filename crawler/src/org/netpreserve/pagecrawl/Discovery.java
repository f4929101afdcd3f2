package org.netpreserve.pagecrawl;

import java.util.List;

/**
 * Finds the initial URLs of a crawl.
 */
public interface Discovery {
    /**
     * Best-effort: the result always contains the targets themselves and falls back to only the targets when
     * discovery fails.
     *
     * @param targets canonical target URLs
     * @return canonical seed URLs, targets first
     */
    List<String> discoverSeedUrls(List<String> targets, boolean strict);
}
