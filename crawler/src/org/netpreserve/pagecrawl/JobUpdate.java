package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Partial update of a {@link JobRecord}. Null fields are left unchanged.
 */
public record JobUpdate(
        @Nullable JobStatus status,
        @Nullable Integer pagesFound,
        @Nullable Integer pagesProcessed,
        @Nullable Integer pagesFailed,
        @Nullable List<String> errors
) {
    public static JobUpdate status(JobStatus status) {
        return new JobUpdate(status, null, null, null, null);
    }

    public static JobUpdate progress(CrawlProgress progress, List<String> errors) {
        return new JobUpdate(null, progress.pagesFound(), progress.pagesProcessed(), progress.pagesFailed(), errors);
    }

    public JobUpdate withStatus(JobStatus status) {
        return new JobUpdate(status, pagesFound, pagesProcessed, pagesFailed, errors);
    }
}
