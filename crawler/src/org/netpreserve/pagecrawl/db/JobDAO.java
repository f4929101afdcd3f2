package org.netpreserve.pagecrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.pagecrawl.JobRecord;
import org.netpreserve.pagecrawl.JobStatus;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(JobRecord.class)
public interface JobDAO {
    @SqlUpdate("""
            INSERT INTO jobs (id, base_urls, canonical_base_urls, created_at, updated_at, status)
            VALUES (:id, :baseUrls, :canonicalBaseUrls, :createdAt, :createdAt, :status)""")
    void create(String id, String baseUrls, String canonicalBaseUrls, Instant createdAt, JobStatus status);

    @SqlUpdate("""
            UPDATE jobs
            SET status = coalesce(:status, status),
                pages_found = coalesce(:pagesFound, pages_found),
                pages_processed = coalesce(:pagesProcessed, pages_processed),
                pages_failed = coalesce(:pagesFailed, pages_failed),
                errors = coalesce(:errors, errors),
                updated_at = :updatedAt
            WHERE id = :id""")
    int update(String id, JobStatus status, Integer pagesFound, Integer pagesProcessed, Integer pagesFailed,
               String errors, Instant updatedAt);

    @SqlQuery("SELECT * FROM jobs WHERE id = ?")
    JobRecord find(String id);

    @SqlQuery("SELECT * FROM jobs ORDER BY created_at DESC, id DESC")
    List<JobRecord> list();

    @SqlUpdate("DELETE FROM jobs WHERE id = ?")
    int delete(String id);
}
