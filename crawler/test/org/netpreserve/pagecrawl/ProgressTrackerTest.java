package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {
    @Test
    void testPeriodicSnapshots() throws InterruptedException {
        var snapshots = new CountDownLatch(3);
        try (var tracker = new ProgressTracker(() -> {
            snapshots.countDown();
            return new CrawlProgress(1, 0, 0, 1, List.of());
        }, Duration.ofMillis(20))) {
            assertEquals(Duration.ZERO, tracker.runtime());
            tracker.startSession();
            assertTrue(snapshots.await(5, TimeUnit.SECONDS));
            assertFalse(tracker.runtime().isNegative());
            tracker.stopSession();
            assertEquals(Duration.ZERO, tracker.runtime());
        }
    }
}
