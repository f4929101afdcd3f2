package org.netpreserve.pagecrawl;

import java.time.Instant;
import java.util.List;

/**
 * A stored crawl job.
 *
 * @param baseUrls          targets as given by the user
 * @param canonicalBaseUrls canonical form of the targets, computed once when the job was created
 * @param errors            one {@code url: detail} entry per failed URL
 */
public record JobRecord(
        String id,
        List<String> baseUrls,
        List<String> canonicalBaseUrls,
        Instant createdAt,
        Instant updatedAt,
        JobStatus status,
        int pagesFound,
        int pagesProcessed,
        int pagesFailed,
        List<String> errors
) {
}
