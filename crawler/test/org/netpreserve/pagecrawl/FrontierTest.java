package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrontierTest {
    private static final String TARGET = "https://example.com/docs";

    private Frontier newFrontier(Integer pageLimit) {
        return new Frontier(new Scope(List.of(TARGET), true), pageLimit);
    }

    @Test
    void testAddIsExclusive() {
        Frontier frontier = newFrontier(null);
        assertTrue(frontier.add(TARGET + "/a", 0));
        assertFalse(frontier.add(TARGET + "/a", 0));
        assertEquals(FrontierUrl.State.QUEUED, frontier.state(TARGET + "/a"));

        FrontierUrl taken = frontier.takeNext();
        assertNotNull(taken);
        assertEquals(TARGET, taken.target());
        assertEquals(FrontierUrl.State.IN_FLIGHT, frontier.state(taken.url()));
        assertFalse(frontier.add(taken.url(), 0), "in-flight URL must not be re-queued");

        frontier.release(taken, FrontierUrl.State.COMPLETED, null);
        assertFalse(frontier.add(taken.url(), 0), "completed URL must not be re-queued");
        assertEquals(1, frontier.completedCount(TARGET));
        assertEquals(0, frontier.inFlightCount(TARGET));
        assertNull(frontier.takeNext());
    }

    @Test
    void testFifoOrder() {
        Frontier frontier = newFrontier(null);
        frontier.addAll(List.of(new LinkExtractor.Link(TARGET + "/1", 0), new LinkExtractor.Link(TARGET + "/2", 0),
                new LinkExtractor.Link(TARGET + "/1", 0)));
        assertEquals(2, frontier.queueSize());
        assertEquals(TARGET + "/1", frontier.takeNext().url());
        assertEquals(TARGET + "/2", frontier.takeNext().url());
    }

    @Test
    void testPageLimit() {
        Frontier frontier = newFrontier(1);
        frontier.add(TARGET + "/a", 0);
        frontier.add(TARGET + "/b", 0);
        frontier.add("https://external.org/", 1);
        assertTrue(frontier.canGrabMoreUrls());

        FrontierUrl a = frontier.takeNext();
        frontier.release(a, FrontierUrl.State.COMPLETED, null);
        assertFalse(frontier.hasCapacity(TARGET));
        assertTrue(frontier.hasMetPageLimit());

        // full targets are skipped but external URLs have no limit
        FrontierUrl next = frontier.takeNext();
        assertNotNull(next);
        assertEquals("https://external.org/", next.url());
        assertNull(next.target());
        assertNull(frontier.takeNext());
        assertEquals(FrontierUrl.State.QUEUED, frontier.state(TARGET + "/b"));
    }

    @Test
    void testFailuresAndProgress() {
        Frontier frontier = newFrontier(null);
        frontier.add(TARGET, 0);
        frontier.add(TARGET + "/broken", 0);
        frontier.add(TARGET + "/pending", 0);
        frontier.release(frontier.takeNext(), FrontierUrl.State.COMPLETED, null);
        FrontierUrl broken = frontier.takeNext();
        frontier.release(broken, FrontierUrl.State.FAILED, "RenderException: boom");

        CrawlProgress progress = frontier.progress();
        assertEquals(2, progress.pagesFound());
        assertEquals(1, progress.pagesProcessed());
        assertEquals(1, progress.pagesFailed());
        assertEquals(1, progress.queueSize());
        assertEquals(List.of(TARGET + "/broken: RenderException: boom"), frontier.errors());

        assertThrows(IllegalArgumentException.class,
                () -> frontier.release(broken, FrontierUrl.State.QUEUED, null));
    }

    @Test
    void testClearPending() {
        Frontier frontier = newFrontier(null);
        frontier.add(TARGET + "/a", 0);
        frontier.add(TARGET + "/b", 0);
        FrontierUrl inFlight = frontier.takeNext();
        frontier.clearPending();
        assertEquals(0, frontier.queueSize());
        assertFalse(frontier.hasInFlight());
        assertEquals(FrontierUrl.State.DROPPED, frontier.state(inFlight.url()));
        assertEquals(FrontierUrl.State.DROPPED, frontier.state(TARGET + "/b"));
        assertFalse(frontier.add(TARGET + "/b", 0));
    }
}
