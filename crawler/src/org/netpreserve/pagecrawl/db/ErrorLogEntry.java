package org.netpreserve.pagecrawl.db;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted error.
 *
 * @param source  component that reported the error, e.g. {@code crawler}
 * @param message {@code ExceptionName: message}
 * @param context what was being done at the time (URL, job, worker...)
 */
public record ErrorLogEntry(
        long id,
        Instant timestamp,
        String source,
        String message,
        @Nullable String stack,
        Map<String, Object> context
) {
}
