package org.netpreserve.pagecrawl.db;

import org.netpreserve.pagecrawl.Diagnostics;
import org.netpreserve.pagecrawl.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps reported errors in the error_log table so they can be reviewed after the crawl.
 */
public class DatabaseDiagnostics implements Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(DatabaseDiagnostics.class);
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);
    private static final int REPORT_LIMIT = 500;
    private final ErrorLogDAO dao;

    public DatabaseDiagnostics(Database db) {
        this.dao = db.errorLog();
    }

    @Override
    public void logError(String source, Throwable error, Map<String, Object> context) {
        try {
            var buffer = new StringWriter();
            error.printStackTrace(new PrintWriter(buffer));
            dao.insert(Database.now(), source, LogUtils.describe(error), buffer.toString(), writeContext(context));
        } catch (RuntimeException e) {
            log.warn("Unable to record error from {}: {}", source, LogUtils.describe(error), e);
        }
    }

    private static String writeContext(Map<String, Object> context) {
        if (context == null || context.isEmpty()) return "{}";
        try {
            return Json.write(context);
        } catch (RuntimeException e) {
            Map<String, String> strings = new LinkedHashMap<>();
            context.forEach((key, value) -> strings.put(key, String.valueOf(value)));
            return Json.write(strings);
        }
    }

    /**
     * Most recent errors first.
     */
    public List<ErrorLogEntry> recent(int limit) {
        return dao.recent(limit);
    }

    public long count() {
        return dao.count();
    }

    public int clear() {
        return dao.clear();
    }

    /**
     * Deletes errors older than {@code retention}.
     *
     * @return number of entries deleted
     */
    public int cleanup(Duration retention) {
        int deleted = dao.deleteOlderThan(Database.now().minus(retention));
        if (deleted > 0) log.info("Removed {} error log entries older than {} days", deleted, retention.toDays());
        return deleted;
    }

    /**
     * Plain-text summary of recent errors grouped by source, for attaching to bug reports.
     */
    public String report() {
        List<ErrorLogEntry> entries = dao.recent(REPORT_LIMIT);
        Map<String, List<ErrorLogEntry>> bySource = new TreeMap<>();
        for (ErrorLogEntry entry : entries) {
            bySource.computeIfAbsent(entry.source(), k -> new ArrayList<>()).add(entry);
        }
        var out = new StringBuilder();
        out.append("pagecrawl diagnostic report\n");
        out.append("Generated: ").append(Instant.now()).append('\n');
        out.append("Total errors: ").append(dao.count()).append('\n');
        for (var group : bySource.entrySet()) {
            out.append('\n').append('[').append(group.getKey()).append("] ")
                    .append(group.getValue().size()).append(group.getValue().size() == 1 ? " error" : " errors")
                    .append('\n');
            for (ErrorLogEntry entry : group.getValue()) {
                out.append("  ").append(entry.timestamp()).append("  ").append(entry.message()).append('\n');
                if (!entry.context().isEmpty()) {
                    out.append("      ").append(entry.context()).append('\n');
                }
            }
        }
        return out.toString();
    }
}
