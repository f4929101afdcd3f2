package org.netpreserve.pagecrawl.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.pagecrawl.render.RenderException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class DatabaseDiagnosticsTest {
    private final Database database;
    private final DatabaseDiagnostics diagnostics;

    DatabaseDiagnosticsTest(Database database) {
        this.database = database;
        this.diagnostics = new DatabaseDiagnostics(database);
    }

    @BeforeEach
    void setUp() {
        diagnostics.clear();
    }

    @Test
    void testLogError() {
        diagnostics.logError("crawler", new RenderException("Navigation failed"),
                Map.of("url", "https://example.com/", "workerId", 2));
        assertEquals(1, diagnostics.count());

        ErrorLogEntry entry = diagnostics.recent(10).get(0);
        assertEquals("crawler", entry.source());
        assertEquals("RenderException: Navigation failed", entry.message());
        assertNotNull(entry.stack());
        assertTrue(entry.stack().contains("DatabaseDiagnosticsTest"));
        assertEquals("https://example.com/", entry.context().get("url"));
        assertEquals(2, entry.context().get("workerId"));
    }

    @Test
    void testReport() {
        diagnostics.logError("discovery", new IllegalStateException("sitemap unreachable"), Map.of());
        diagnostics.logError("crawler", new RenderException("timeout"), Map.of("url", "https://a.example/"));
        diagnostics.logError("crawler", new RenderException("crash"), Map.of());

        String report = diagnostics.report();
        assertTrue(report.startsWith("pagecrawl diagnostic report\n"));
        assertTrue(report.contains("Total errors: 3"));
        assertTrue(report.indexOf("[crawler] 2 errors") < report.indexOf("[discovery] 1 error"), report);
        assertTrue(report.contains("RenderException: timeout"));
    }

    @Test
    void testCleanup() {
        database.errorLog().insert(Instant.now().minus(Duration.ofDays(45)), "crawler", "old", null, "{}");
        diagnostics.logError("crawler", new RenderException("new"), Map.of());
        assertEquals(1, diagnostics.cleanup(DatabaseDiagnostics.DEFAULT_RETENTION));
        assertEquals(1, diagnostics.count());
        assertEquals("RenderException: new", diagnostics.recent(1).get(0).message());
    }
}
