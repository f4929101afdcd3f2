package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards the single crawl this process may run at a time.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);
    private final Object lock = new Object();
    private @Nullable CrawlJob active;

    /**
     * Starts the job if no other job is running. The slot is freed when the job finishes.
     *
     * @return the id of the started job
     * @throws CrawlJob.BadStateException if another crawl is already in progress
     */
    public String start(CrawlJob job) throws CrawlJob.BadStateException {
        synchronized (lock) {
            if (active != null) throw new CrawlJob.BadStateException("A crawl is already in progress");
            active = job;
        }
        String jobId;
        try {
            jobId = job.start();
        } catch (CrawlJob.BadStateException | RuntimeException e) {
            release(job);
            throw e;
        }
        job.onFinish(() -> release(job));
        return jobId;
    }

    private void release(CrawlJob job) {
        synchronized (lock) {
            if (active == job) {
                active = null;
                log.debug("Released crawl slot of job {}", job.id());
            }
        }
    }

    public @Nullable CrawlJob active() {
        synchronized (lock) {
            return active;
        }
    }

    /**
     * Cancels the running job, if any.
     *
     * @return true if a job was cancelled
     */
    public boolean cancelActive() {
        CrawlJob job = active();
        if (job == null) return false;
        job.cancel();
        return true;
    }
}
