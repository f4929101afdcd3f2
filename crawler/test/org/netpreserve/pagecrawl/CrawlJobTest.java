package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.pagecrawl.config.CrawlConfig;
import org.netpreserve.pagecrawl.db.Database;
import org.netpreserve.pagecrawl.db.DatabaseStorage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class CrawlJobTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private Database database;
    private DatabaseStorage storage;
    private final List<String> diagnosed = new CopyOnWriteArrayList<>();
    private final Diagnostics diagnostics = (source, error, context) -> diagnosed.add(source + " " + context.get("url"));
    private final Discovery targetsOnly = (targets, strict) -> targets;

    @BeforeEach
    void setUp() {
        database = Database.newDatabaseInMemory();
        storage = new DatabaseStorage(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static CrawlConfig config(int workers, Integer pageLimit) {
        return CrawlConfig.defaults().withWorkers(workers).withPageLimit(pageLimit).withDelay(Duration.ZERO);
    }

    private CrawlJob run(List<String> targets, CrawlConfig config, FakeRenderer renderer) throws Exception {
        var job = new CrawlJob(targets, config, storage, renderer, targetsOnly, diagnostics);
        job.start();
        assertTrue(job.awaitCompletion(TIMEOUT), "job did not finish");
        return job;
    }

    private Set<String> savedUrls(CrawlJob job) {
        return storage.listPages(job.id()).stream().map(PageRecord::canonicalUrl).collect(Collectors.toSet());
    }

    private PageRecord savedPage(CrawlJob job, String canonicalUrl) {
        return storage.listPages(job.id()).stream()
                .filter(page -> page.canonicalUrl().equals(canonicalUrl))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testStrictScopeWithPageLimit() throws Exception {
        var renderer = new FakeRenderer()
                .page("https://docs.example.com/api", "API docs",
                        "/api/intro", "/api/intro#frag", "/api-blog/post", "/api/guide");
        var job = run(List.of("https://docs.example.com/api"), config(1, 2), renderer);

        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(Set.of("https://docs.example.com/api", "https://docs.example.com/api/intro"), savedUrls(job));
        assertFalse(renderer.requested().contains("https://docs.example.com/api-blog/post"));
        assertTrue(renderer.isClosed());

        JobRecord record = storage.getJob(job.id());
        assertNotNull(record);
        assertEquals(JobStatus.COMPLETED, record.status());
        assertEquals(2, record.pagesProcessed());
        assertEquals(List.of("https://docs.example.com/api"), record.canonicalBaseUrls());
    }

    @Test
    void testDuplicateContentBecomesAlternateUrl() throws Exception {
        var renderer = new FakeRenderer()
                .page("https://example.com/", "Home", "/a", "/b")
                .page("https://example.com/a", "Same text")
                .page("https://example.com/b", "Same text\n\n\n");
        var job = run(List.of("https://example.com/"), config(1, null), renderer);

        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(Set.of("https://example.com/", "https://example.com/a"), savedUrls(job));
        PageRecord a = savedPage(job, "https://example.com/a");
        assertEquals(List.of("https://example.com/a", "https://example.com/b"), a.alternateUrls());
        assertEquals(2, job.progress().pagesProcessed());
    }

    @Test
    void testExactPageLimitWithOneWorker() throws Exception {
        String[] links = IntStream.range(0, 10).mapToObj(i -> "/p" + i).toArray(String[]::new);
        var renderer = new FakeRenderer().page("https://example.com/", "Home", links);
        var job = run(List.of("https://example.com/"), config(1, 3), renderer);

        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(3, storage.listPages(job.id()).size());
        assertEquals(0, job.progress().queueSize());
    }

    @Test
    void testConcurrentWorkersOvershootBoundedByWorkerCount() throws Exception {
        String[] links = IntStream.range(0, 30).mapToObj(i -> "/p" + i).toArray(String[]::new);
        var renderer = new FakeRenderer().page("https://example.com/", "Home", links);
        int workers = 4;
        var job = run(List.of("https://example.com/"), config(workers, 3), renderer);

        int saved = storage.listPages(job.id()).size();
        assertTrue(saved >= 3 && saved <= 3 + workers - 1, "saved " + saved);
        assertEquals(JobStatus.COMPLETED, job.status());
    }

    @Test
    void testExternalHopLimit() throws Exception {
        var renderer = new FakeRenderer()
                .page("https://example.com/", "Home", "https://other.org/one")
                .page("https://other.org/one", "One hop out", "https://third.net/two");
        var config = config(1, null).withFollowExternal(true, 1);
        var job = run(List.of("https://example.com/"), config, renderer);

        assertTrue(renderer.requested().contains("https://other.org/one"));
        assertFalse(renderer.requested().contains("https://third.net/two"));
        assertEquals(2, storage.listPages(job.id()).size());
    }

    @Test
    void testFailedPagesAreRecorded() throws Exception {
        var renderer = new FakeRenderer()
                .page("https://example.com/", "Home", "/broken", "/fine")
                .failing("https://example.com/broken");
        var job = run(List.of("https://example.com/"), config(2, null), renderer);

        assertEquals(JobStatus.COMPLETED_WITH_ERRORS, job.status());
        assertEquals("RenderException: Navigation failed: net::ERR_CONNECTION_REFUSED",
                job.failures().get("https://example.com/broken"));
        assertEquals(List.of("crawler https://example.com/broken"), diagnosed);

        JobRecord record = storage.getJob(job.id());
        assertEquals(1, record.pagesFailed());
        assertEquals(List.of("https://example.com/broken: RenderException: Navigation failed: " +
                             "net::ERR_CONNECTION_REFUSED"), record.errors());
    }

    @Test
    void testCancel() throws Exception {
        var renderer = new FakeRenderer()
                .page("https://example.com/", "Home", "/slow")
                .hanging("https://example.com/slow");
        var job = new CrawlJob(List.of("https://example.com/"), config(1, null), storage, renderer, targetsOnly,
                diagnostics);
        var progressUpdates = new ArrayList<CrawlProgress>();
        job.setProgressListener(progressUpdates::add);
        job.start();
        assertTrue(renderer.hangStarted.await(10, TimeUnit.SECONDS));

        job.cancel();
        assertTrue(job.awaitCompletion(TIMEOUT));
        assertEquals(JobStatus.INTERRUPTED, job.status());
        assertEquals(0, job.progress().pagesFailed());
        assertEquals(JobStatus.INTERRUPTED, storage.getJob(job.id()).status());
        assertTrue(diagnosed.isEmpty());
        assertFalse(progressUpdates.isEmpty());
    }

    @Test
    void testPauseAndResume() throws Exception {
        String[] links = IntStream.range(0, 20).mapToObj(i -> "/p" + i).toArray(String[]::new);
        var renderer = new FakeRenderer().page("https://example.com/", "Home", links);
        var config = config(1, null).withDelay(Duration.ofMillis(50));
        var job = new CrawlJob(List.of("https://example.com/"), config, storage, renderer, targetsOnly, diagnostics);
        job.start();

        long waitUntil = System.nanoTime() + TIMEOUT.toNanos();
        while (job.progress().pagesProcessed() < 2) {
            assertTrue(System.nanoTime() < waitUntil, "no progress before pausing");
            Thread.sleep(10);
        }
        job.pause();
        assertTrue(job.isPaused());
        Thread.sleep(300);
        int processedWhenPaused = job.progress().pagesProcessed();
        Thread.sleep(1200);
        assertEquals(processedWhenPaused, job.progress().pagesProcessed());
        assertEquals(JobStatus.IN_PROGRESS, job.status());
        assertTrue(processedWhenPaused < 21, "crawl finished before pausing took effect");

        job.resume();
        assertFalse(job.isPaused());
        assertTrue(job.awaitCompletion(TIMEOUT), "job did not finish after resuming");
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(21, storage.listPages(job.id()).size());
    }

    @Test
    void testSecondJobReusesCachedPages() throws Exception {
        var first = new FakeRenderer().page("https://example.com/", "Home", "/a").page("https://example.com/a", "A");
        run(List.of("https://example.com/"), config(1, null), first);
        assertEquals(2, first.requested().size());

        var second = new FakeRenderer();
        var job = run(List.of("https://example.com/"), config(1, null), second);
        assertEquals(List.of(), second.requested());
        assertEquals(Set.of("https://example.com/", "https://example.com/a"), savedUrls(job));
        assertEquals("A", savedPage(job, "https://example.com/a").content());

        var fresh = new FakeRenderer().page("https://example.com/", "Home v2");
        var third = run(List.of("https://example.com/"), config(1, null).withSkipCache(true), fresh);
        assertEquals(List.of("https://example.com/"), fresh.requested());
        assertEquals("Home v2", savedPage(third, "https://example.com/").content());
    }

    @Test
    void testDiscoveredSeedsAreQueued() throws Exception {
        var renderer = new FakeRenderer();
        Discovery discovery = (targets, strict) -> List.of(targets.get(0), "https://example.com/from-sitemap");
        var job = new CrawlJob(List.of("https://example.com/"), config(1, null), storage, renderer, discovery,
                diagnostics);
        job.start();
        assertTrue(job.awaitCompletion(TIMEOUT));
        assertEquals(List.of("https://example.com/", "https://example.com/from-sitemap"), renderer.requested());
    }

    @Test
    void testStartTwice() throws Exception {
        var job = run(List.of("https://example.com/"), config(1, null), new FakeRenderer());
        assertThrows(CrawlJob.BadStateException.class, job::start);
    }

    @Test
    void testRejectsInvalidTargets() {
        assertThrows(IllegalArgumentException.class, () -> new CrawlJob(List.of("not a url", "ftp://x/"),
                CrawlConfig.defaults(), storage, new FakeRenderer(), targetsOnly, diagnostics));
    }
}
