package org.netpreserve.pagecrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(ErrorLogEntry.class)
public interface ErrorLogDAO {
    @SqlUpdate("INSERT INTO error_log (timestamp, source, message, stack, context) " +
               "VALUES (:timestamp, :source, :message, :stack, :context)")
    @GetGeneratedKeys
    long insert(Instant timestamp, String source, String message, String stack, String context);

    @SqlQuery("SELECT * FROM error_log ORDER BY timestamp DESC, id DESC LIMIT :limit")
    List<ErrorLogEntry> recent(int limit);

    @SqlQuery("SELECT COUNT(*) FROM error_log")
    long count();

    @SqlUpdate("DELETE FROM error_log")
    int clear();

    @SqlUpdate("DELETE FROM error_log WHERE timestamp < :cutoff")
    int deleteOlderThan(Instant cutoff);
}
