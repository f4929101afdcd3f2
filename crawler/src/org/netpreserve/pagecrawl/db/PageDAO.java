package org.netpreserve.pagecrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.pagecrawl.PageRecord;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(PageRecord.class)
public interface PageDAO {
    @SqlUpdate("""
            INSERT INTO pages (id, job_id, url, canonical_url, content, format, status, html, content_hash,
                               content_length, alternate_urls, metadata, markdown, extracted_at)
            VALUES (:id, :jobId, :url, :canonicalUrl, :content, 'text', 'success', :html, :contentHash,
                    :contentLength, :alternateUrls, :metadata, :markdown, :extractedAt)""")
    void create(String id, String jobId, String url, String canonicalUrl, String content, String html,
                String contentHash, int contentLength, String alternateUrls, String metadata, String markdown,
                Instant extractedAt);

    @SqlQuery("SELECT * FROM pages WHERE id = ?")
    PageRecord find(String id);

    @SqlQuery("SELECT * FROM pages WHERE canonical_url = ? ORDER BY extracted_at DESC, id DESC LIMIT 1")
    PageRecord findLatestByCanonicalUrl(String canonicalUrl);

    @SqlQuery("""
            SELECT * FROM pages
            WHERE job_id = :jobId AND content_hash = :contentHash
            ORDER BY extracted_at, id LIMIT 1""")
    PageRecord findByContentHash(String jobId, String contentHash);

    @SqlQuery("SELECT alternate_urls FROM pages WHERE id = ?")
    String alternateUrlsJson(String id);

    @SqlUpdate("UPDATE pages SET alternate_urls = :alternateUrls WHERE id = :id")
    int updateAlternateUrls(String id, String alternateUrls);

    @SqlQuery("SELECT * FROM pages WHERE job_id = ? ORDER BY extracted_at, id")
    List<PageRecord> listByJob(String jobId);

    @SqlQuery("""
            SELECT * FROM pages
            WHERE instr(lower(url), lower(:query)) > 0 OR instr(lower(canonical_url), lower(:query)) > 0
            ORDER BY extracted_at DESC, id DESC
            LIMIT :limit""")
    List<PageRecord> search(String query, int limit);

    @SqlQuery("SELECT COUNT(*) FROM pages WHERE job_id = ?")
    int countByJob(String jobId);
}
