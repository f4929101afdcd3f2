package org.netpreserve.pagecrawl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically logs the progress of a running job.
 */
public class ProgressTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    private final Supplier<CrawlProgress> progress;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        var thread = new Thread(runnable, "progress-tracker");
        thread.setDaemon(true);
        return thread;
    });
    private ScheduledFuture<?> snapshotTask;
    private volatile Instant sessionStartTime;

    public ProgressTracker(Supplier<CrawlProgress> progress, Duration interval) {
        this.progress = progress;
        this.interval = interval;
    }

    public synchronized void startSession() {
        if (snapshotTask != null) return;
        sessionStartTime = Instant.now();
        long millis = interval.toMillis();
        snapshotTask = scheduler.scheduleAtFixedRate(this::snapshot, millis, millis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stopSession() {
        if (snapshotTask == null) return;
        snapshotTask.cancel(false);
        snapshotTask = null;
        snapshot();
        sessionStartTime = null;
    }

    private void snapshot() {
        Instant start = sessionStartTime;
        if (start == null) return;
        try {
            CrawlProgress current = progress.get();
            log.atInfo()
                    .addKeyValue("found", current.pagesFound())
                    .addKeyValue("processed", current.pagesProcessed())
                    .addKeyValue("failed", current.pagesFailed())
                    .addKeyValue("queued", current.queueSize())
                    .addKeyValue("inProgress", current.inProgress().size())
                    .addKeyValue("runtimeSeconds", Duration.between(start, Instant.now()).toSeconds())
                    .log("Progress");
        } catch (RuntimeException e) {
            log.warn("Unable to snapshot progress", e);
        }
    }

    public Duration runtime() {
        Instant start = sessionStartTime;
        return start == null ? Duration.ZERO : Duration.between(start, Instant.now());
    }

    @Override
    public void close() {
        stopSession();
        scheduler.shutdownNow();
    }
}
