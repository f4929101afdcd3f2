package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;
import org.netpreserve.pagecrawl.config.CrawlConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JobRegistryTest {
    private static CrawlJob newJob(Storage storage, FakeRenderer renderer) {
        return new CrawlJob(List.of("https://example.com/"),
                CrawlConfig.defaults().withWorkers(1).withDelay(Duration.ZERO),
                storage, renderer, (targets, strict) -> targets, (source, error, context) -> {
        });
    }

    private static Storage mockStorage() {
        Storage storage = mock(Storage.class);
        when(storage.createJob(any(), any())).thenAnswer(invocation -> new JobRecord("job-" + System.nanoTime(),
                invocation.getArgument(0), invocation.getArgument(1), Instant.now(), Instant.now(),
                JobStatus.PENDING, 0, 0, 0, List.of()));
        when(storage.savePage(any(), any(), any(), any(), any(), any(), any(), any())).thenReturn(null);
        return storage;
    }

    @Test
    void testOnlyOneActiveJob() throws Exception {
        var storage = mockStorage();
        var slowRenderer = new FakeRenderer().hanging("https://example.com/");
        var registry = new JobRegistry();

        CrawlJob first = newJob(storage, slowRenderer);
        registry.start(first);
        assertSame(first, registry.active());
        assertTrue(slowRenderer.hangStarted.await(10, TimeUnit.SECONDS));

        var e = assertThrows(CrawlJob.BadStateException.class,
                () -> registry.start(newJob(storage, new FakeRenderer())));
        assertEquals("A crawl is already in progress", e.getMessage());

        assertTrue(registry.cancelActive());
        assertTrue(first.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(JobStatus.INTERRUPTED, first.status());
        assertNull(registry.active());
        assertFalse(registry.cancelActive());

        CrawlJob second = newJob(storage, new FakeRenderer());
        registry.start(second);
        assertTrue(second.awaitCompletion(Duration.ofSeconds(10)));
        assertEquals(JobStatus.COMPLETED, second.status());
        assertNull(registry.active());
    }

    @Test
    void testFailedStartFreesSlot() {
        Storage storage = mock(Storage.class);
        when(storage.createJob(any(), any())).thenThrow(new IllegalStateException("disk full"));
        var registry = new JobRegistry();
        assertThrows(IllegalStateException.class, () -> registry.start(newJob(storage, new FakeRenderer())));
        assertNull(registry.active());
    }
}
