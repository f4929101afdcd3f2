package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Persistent store for jobs and extracted pages.
 * <p>
 * Implementations may throw {@link SchemaMismatchException} when the underlying store is incompatible.
 */
public interface Storage {
    JobRecord createJob(List<String> baseUrls, List<String> canonicalBaseUrls);

    void updateJob(String jobId, JobUpdate update);

    @Nullable JobRecord getJob(String jobId);

    /**
     * Lists jobs, most recently created first.
     */
    List<JobRecord> listJobs();

    /**
     * Deletes a job along with all its pages.
     *
     * @return false if there was no such job
     */
    boolean deleteJob(String jobId);

    /**
     * Finds the most recently extracted page with this canonical URL in any job.
     */
    @Nullable PageRecord getPageByCanonicalUrl(String canonicalUrl);

    @Nullable PageRecord getPageByContentHash(String jobId, String contentHash);

    PageRecord savePage(String jobId, String url, String canonicalUrl, String text, @Nullable String html,
                        String contentHash, PageMetadata metadata, @Nullable String markdown);

    /**
     * Adds {@code url} to the page's alternate URLs unless it's already listed.
     */
    void appendAlternateUrl(String pageId, String url);

    List<PageRecord> listPages(String jobId);

    /**
     * Case-insensitive substring search over page URLs.
     */
    List<PageRecord> searchPages(String query);
}
