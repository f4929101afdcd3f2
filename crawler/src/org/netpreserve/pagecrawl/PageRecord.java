package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A page saved for a job. Later URLs with the same content hash in the same job are recorded in
 * {@code alternateUrls} instead of creating another record.
 */
public record PageRecord(
        String id,
        String jobId,
        String url,
        String canonicalUrl,
        String content,
        String format,
        String status,
        @Nullable String html,
        @Nullable String contentHash,
        int contentLength,
        List<String> alternateUrls,
        PageMetadata metadata,
        @Nullable String markdown,
        Instant extractedAt
) {
    public String title() {
        return metadata.title();
    }
}
