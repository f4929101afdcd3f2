package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.config.CrawlConfig;
import org.netpreserve.pagecrawl.render.RenderOptions;
import org.netpreserve.pagecrawl.render.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One crawl of a set of targets: seeds the frontier, runs the workers and records the outcome.
 * <p>
 * A job runs once. {@link #start()} returns as soon as the workers are running; the last worker to exit completes
 * the job, tears down the renderer and releases {@link #awaitCompletion(Duration)}.
 */
public class CrawlJob {
    private static final Logger log = LoggerFactory.getLogger(CrawlJob.class);
    private final List<String> targets;
    private final List<String> canonicalTargets;
    private final CrawlConfig config;
    private final Storage storage;
    private final Renderer renderer;
    private final Discovery discovery;
    private final Diagnostics diagnostics;
    private final Scope scope;
    private final Frontier frontier;
    private final LinkExtractor linkExtractor;
    private final ContentDeduplicator deduplicator;
    private final ProgressTracker progressTracker;
    private final List<CrawlWorker> workers = new ArrayList<>();
    private final List<Runnable> finishCallbacks = new ArrayList<>();
    private boolean finishCallbacksRun; // guarded by finishCallbacks
    private final Lock startStopLock = new ReentrantLock();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private volatile JobStatus status = JobStatus.PENDING;
    private volatile String jobId;
    private volatile boolean cancelled;
    private volatile boolean paused;
    private volatile @Nullable Consumer<CrawlProgress> progressListener;

    /**
     * @param targets target URLs as given by the user; invalid ones are ignored
     * @throws IllegalArgumentException if none of the targets is a valid http(s) URL
     */
    public CrawlJob(List<String> targets, CrawlConfig config, Storage storage, Renderer renderer,
                    Discovery discovery, Diagnostics diagnostics) {
        this.targets = List.copyOf(targets);
        var canonical = new LinkedHashSet<String>();
        for (String target : targets) {
            String canonicalTarget = UrlCanonicalizer.canonicalize(target);
            if (canonicalTarget == null) {
                log.warn("Ignoring invalid target URL: {}", target);
            } else {
                canonical.add(canonicalTarget);
            }
        }
        if (canonical.isEmpty()) throw new IllegalArgumentException("No valid target URLs: " + targets);
        this.canonicalTargets = List.copyOf(canonical);
        this.config = config.normalized();
        this.storage = storage;
        this.renderer = renderer;
        this.discovery = discovery;
        this.diagnostics = diagnostics;
        this.scope = new Scope(canonicalTargets, this.config.strict());
        this.frontier = new Frontier(scope, this.config.pageLimit());
        this.linkExtractor = new LinkExtractor(scope, this.config.followExternal(), this.config.maxHops());
        this.deduplicator = new ContentDeduplicator(storage);
        this.progressTracker = new ProgressTracker(frontier::progress, ProgressTracker.DEFAULT_INTERVAL);
    }

    /**
     * Creates the job record, seeds the frontier and launches the workers.
     *
     * @return the new job's id
     */
    public String start() throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Job busy " + status);
        try {
            if (status != JobStatus.PENDING) throw new BadStateException("Can only start a PENDING job");
            JobRecord record = storage.createJob(targets, canonicalTargets);
            jobId = record.id();
            status = JobStatus.IN_PROGRESS;
            storage.updateJob(jobId, JobUpdate.status(JobStatus.IN_PROGRESS));

            for (String target : canonicalTargets) {
                frontier.add(target, 0);
            }
            int discovered = 0;
            for (String seed : discoverSeeds()) {
                if (frontier.add(seed, 0)) discovered++;
            }
            log.atInfo().addKeyValue("jobId", jobId).addKeyValue("targets", canonicalTargets)
                    .addKeyValue("discovered", discovered).addKeyValue("workers", config.workers())
                    .log("Starting crawl");
            recordProgress();

            var options = new RenderOptions(config.pageTimeout(), config.waitFor(), config.selectorTimeout(),
                    config.isolated());
            for (int i = 1; i <= config.workers(); i++) {
                workers.add(new CrawlWorker(i, this, frontier, storage, renderer, linkExtractor, deduplicator,
                        diagnostics, options));
            }
            activeWorkers.set(workers.size());
            progressTracker.startSession();
            for (CrawlWorker worker : workers) {
                worker.start();
            }
            return jobId;
        } finally {
            startStopLock.unlock();
        }
    }

    private List<String> discoverSeeds() {
        try {
            return discovery.discoverSeedUrls(canonicalTargets, config.strict());
        } catch (RuntimeException e) {
            log.warn("Seed discovery failed, crawling from targets only", e);
            diagnostics.logError("discovery", e, Map.of("jobId", jobId, "action", "discoverSeedUrls"));
            return canonicalTargets;
        }
    }

    public void pause() {
        if (status != JobStatus.IN_PROGRESS || paused) return;
        paused = true;
        log.info("Paused job {}", jobId);
    }

    public void resume() {
        if (!paused) return;
        paused = false;
        log.info("Resumed job {}", jobId);
    }

    /**
     * Stops the job. Workers abandon the URLs they're processing and the job completes as
     * {@link JobStatus#INTERRUPTED}.
     */
    public void cancel() {
        if (cancelled || status.isFinished()) return;
        cancelled = true;
        paused = false;
        log.info("Cancelling job {}", jobId);
        List<CrawlWorker> running;
        startStopLock.lock();
        try {
            running = new ArrayList<>(workers);
        } finally {
            startStopLock.unlock();
        }
        for (CrawlWorker worker : running) {
            worker.interrupt();
        }
    }

    /**
     * Waits for the job to complete.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Called by each worker as it exits. The last one completes the job.
     */
    void workerExited(CrawlWorker worker) {
        int remaining = activeWorkers.decrementAndGet();
        log.debug("Worker {} exited, {} still running", worker.id(), remaining);
        if (remaining == 0) complete();
    }

    private void complete() {
        try {
            if (cancelled || !frontier.canGrabMoreUrls()) frontier.clearPending();
            CrawlProgress progress = frontier.progress();
            JobStatus finalStatus;
            if (cancelled) {
                finalStatus = JobStatus.INTERRUPTED;
            } else if (progress.pagesFailed() > 0) {
                finalStatus = JobStatus.COMPLETED_WITH_ERRORS;
            } else {
                finalStatus = JobStatus.COMPLETED;
            }
            try {
                storage.updateJob(jobId, JobUpdate.progress(progress, frontier.errors()).withStatus(finalStatus));
            } catch (RuntimeException e) {
                log.error("Failed to record final state of job {}", jobId, e);
            }
            status = finalStatus;
            try {
                renderer.close();
            } catch (RuntimeException e) {
                log.error("Failed to close renderer", e);
            }
            progressTracker.close();
            notifyProgress(progress);
            log.atInfo().addKeyValue("jobId", jobId).addKeyValue("status", finalStatus)
                    .addKeyValue("processed", progress.pagesProcessed())
                    .addKeyValue("failed", progress.pagesFailed())
                    .log("Crawl finished");
        } finally {
            runFinishCallbacks();
            finished.countDown();
        }
    }

    private void runFinishCallbacks() {
        List<Runnable> callbacks;
        synchronized (finishCallbacks) {
            finishCallbacksRun = true;
            callbacks = new ArrayList<>(finishCallbacks);
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Job completion callback failed", e);
            }
        }
    }

    /**
     * Writes the current counters to the job record and notifies the progress listener.
     */
    void recordProgress() {
        CrawlProgress progress = frontier.progress();
        try {
            storage.updateJob(jobId, JobUpdate.progress(progress, frontier.errors()));
        } catch (RuntimeException e) {
            log.warn("Failed to update job {}: {}", jobId, e.getMessage());
        }
        notifyProgress(progress);
    }

    private void notifyProgress(CrawlProgress progress) {
        var listener = progressListener;
        if (listener == null) return;
        try {
            listener.accept(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed", e);
        }
    }

    public void setProgressListener(@Nullable Consumer<CrawlProgress> listener) {
        this.progressListener = listener;
    }

    /**
     * Registers a callback run once the job has completed, before {@link #awaitCompletion(Duration)} returns. Runs
     * immediately if the job has already completed.
     */
    public void onFinish(Runnable callback) {
        synchronized (finishCallbacks) {
            if (!finishCallbacksRun) {
                finishCallbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    public CrawlProgress progress() {
        return frontier.progress();
    }

    /**
     * Failed URLs with their error details.
     */
    public Map<String, String> failures() {
        return frontier.failures();
    }

    public @Nullable String id() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public CrawlConfig config() {
        return config;
    }

    public List<String> canonicalTargets() {
        return canonicalTargets;
    }

    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
