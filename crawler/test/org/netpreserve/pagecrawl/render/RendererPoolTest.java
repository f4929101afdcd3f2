package org.netpreserve.pagecrawl.render;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RendererPoolTest {
    private static class CountingFactory implements SessionFactory {
        final List<FakeSession> created = new ArrayList<>();
        boolean closed;
        boolean failThrottling;

        @Override
        public synchronized RendererSession create(boolean isolated) {
            var session = new FakeSession((isolated ? "isolated-" : "tab-") + (created.size() + 1));
            session.failThrottling = failThrottling;
            created.add(session);
            return session;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void testReusesReleasedSessions() throws RenderException {
        var factory = new CountingFactory();
        var pool = new RendererPool(factory);

        RendererSession first = pool.acquire(false);
        RendererSession second = pool.acquire(false);
        assertNotSame(first, second);
        assertEquals(2, pool.size());
        assertEquals(2, pool.inUse());

        pool.release(first);
        assertSame(first, pool.acquire(false));
        assertEquals(2, factory.created.size());
        assertEquals(1, factory.created.get(0).throttlingCalls.get(), "throttling bypass applied once");
    }

    @Test
    void testIsolatedSessionsAreSeparate() throws RenderException {
        var pool = new RendererPool(new CountingFactory());
        RendererSession normal = pool.acquire(false);
        pool.release(normal);
        RendererSession isolated = pool.acquire(true);
        assertNotSame(normal, isolated);
        assertEquals("isolated-2", isolated.id());
    }

    @Test
    void testDiscardsDeadSessions() throws RenderException {
        var factory = new CountingFactory();
        var pool = new RendererPool(factory);
        RendererSession session = pool.acquire(false);
        pool.release(session);
        factory.created.get(0).alive = false;

        RendererSession replacement = pool.acquire(false);
        assertNotSame(session, replacement);
        assertEquals(1, pool.size());
        assertTrue(factory.created.get(0).closed);
    }

    @Test
    void testTeardown() throws RenderException {
        var factory = new CountingFactory();
        var pool = new RendererPool(factory);
        pool.acquire(false);
        pool.acquire(true);
        pool.teardownAll();
        pool.teardownAll();
        assertTrue(factory.closed);
        assertTrue(factory.created.stream().allMatch(s -> s.closed));
        assertEquals(0, pool.size());
        assertThrows(RenderException.class, () -> pool.acquire(false));
    }

    @Test
    void testThrottlingFailureFailsAcquire() throws RenderException {
        var factory = new CountingFactory();
        factory.failThrottling = true;
        var pool = new RendererPool(factory);

        var e = assertThrows(RenderException.class, () -> pool.acquire(false));
        assertEquals("Target closed before debugger attached", e.getMessage());
        assertEquals(0, pool.size());
        assertTrue(factory.created.get(0).closed);

        factory.failThrottling = false;
        RendererSession session = pool.acquire(false);
        assertEquals("tab-2", session.id());
        assertEquals(1, pool.size());
    }

    @Test
    void testSessionHeldByOneWorkerAtATime() throws Exception {
        int threads = 8;
        var factory = new CountingFactory();
        var pool = new RendererPool(factory);
        Map<RendererSession, AtomicBoolean> held = new ConcurrentHashMap<>();
        var overlaps = new AtomicInteger();
        var maxSize = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        RendererSession session = pool.acquire(false);
                        var flag = held.computeIfAbsent(session, s -> new AtomicBoolean());
                        if (!flag.compareAndSet(false, true)) overlaps.incrementAndGet();
                        maxSize.accumulateAndGet(pool.size(), Math::max);
                        Thread.yield();
                        flag.set(false);
                        pool.release(session);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, overlaps.get(), "session handed to two workers at once");
        assertTrue(maxSize.get() <= threads, "pool grew to " + maxSize.get());
        assertEquals(0, pool.inUse());
        assertEquals(factory.created.size(), pool.size());
        assertTrue(factory.created.stream().allMatch(s -> s.throttlingCalls.get() == 1));
    }
}
