package org.netpreserve.pagecrawl;

import java.util.List;

/**
 * Point-in-time counters for a running job.
 *
 * @param pagesFound     queued + in flight + completed
 * @param pagesProcessed pages whose unique content was saved
 * @param pagesFailed    URLs that failed to render or save
 * @param queueSize      URLs still waiting
 * @param inProgress     URLs currently being processed by a worker
 */
public record CrawlProgress(int pagesFound, int pagesProcessed, int pagesFailed, int queueSize,
                            List<String> inProgress) {
}
