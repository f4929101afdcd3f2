package org.netpreserve.pagecrawl.db;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.NoArgGenerator;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.JobRecord;
import org.netpreserve.pagecrawl.JobStatus;
import org.netpreserve.pagecrawl.JobUpdate;
import org.netpreserve.pagecrawl.PageMetadata;
import org.netpreserve.pagecrawl.PageRecord;
import org.netpreserve.pagecrawl.SchemaMismatchException;
import org.netpreserve.pagecrawl.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Storage} backed by the SQLite database.
 */
public class DatabaseStorage implements Storage {
    private static final Logger log = LoggerFactory.getLogger(DatabaseStorage.class);
    private static final int SEARCH_LIMIT = 100;
    private final Database db;
    private final NoArgGenerator idGenerator = Generators.timeBasedEpochGenerator();

    public DatabaseStorage(Database db) {
        this.db = db;
    }

    private String newId() {
        return idGenerator.generate().toString();
    }

    @Override
    public JobRecord createJob(List<String> baseUrls, List<String> canonicalBaseUrls) {
        String id = newId();
        db.jobs().create(id, Json.write(baseUrls), Json.write(canonicalBaseUrls), Database.now(), JobStatus.PENDING);
        log.atInfo().addKeyValue("jobId", id).addKeyValue("targets", canonicalBaseUrls).log("Created job");
        return db.jobs().find(id);
    }

    @Override
    public void updateJob(String jobId, JobUpdate update) {
        int rows = db.jobs().update(jobId, update.status(), update.pagesFound(), update.pagesProcessed(),
                update.pagesFailed(), update.errors() == null ? null : Json.write(update.errors()), Database.now());
        if (rows == 0) log.warn("Tried to update missing job {}", jobId);
    }

    @Override
    public @Nullable JobRecord getJob(String jobId) {
        return db.jobs().find(jobId);
    }

    @Override
    public List<JobRecord> listJobs() {
        return db.jobs().list();
    }

    @Override
    public boolean deleteJob(String jobId) {
        return db.inTransaction(dao -> {
            int pages = dao.pages().countByJob(jobId);
            boolean deleted = dao.jobs().delete(jobId) > 0;
            if (deleted) log.info("Deleted job {} with {} pages", jobId, pages);
            return deleted;
        });
    }

    @Override
    public @Nullable PageRecord getPageByCanonicalUrl(String canonicalUrl) {
        return db.pages().findLatestByCanonicalUrl(canonicalUrl);
    }

    @Override
    public @Nullable PageRecord getPageByContentHash(String jobId, String contentHash) {
        return db.pages().findByContentHash(jobId, contentHash);
    }

    @Override
    public PageRecord savePage(String jobId, String url, String canonicalUrl, String text, @Nullable String html,
                               String contentHash, PageMetadata metadata, @Nullable String markdown) {
        String id = newId();
        Instant now = Database.now();
        try {
            db.pages().create(id, jobId, url, canonicalUrl, text, html, contentHash, text.length(),
                    Json.write(List.of(url)), Json.write(metadata == null ? PageMetadata.EMPTY : metadata),
                    markdown, now);
        } catch (UnableToExecuteStatementException e) {
            if (isUniqueViolation(e)) {
                throw new SchemaMismatchException("Unable to save " + canonicalUrl + " for job " + jobId +
                                                  " due to a unique constraint on pages", e);
            }
            throw e;
        }
        return db.pages().find(id);
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLiteException sqliteException) {
                SQLiteErrorCode code = sqliteException.getResultCode();
                return code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                       || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY;
            }
        }
        return false;
    }

    @Override
    public void appendAlternateUrl(String pageId, String url) {
        db.useTransaction(dao -> {
            String json = dao.pages().alternateUrlsJson(pageId);
            if (json == null) {
                log.warn("Can't add alternate URL {} to missing page {}", url, pageId);
                return;
            }
            List<String> urls = new ArrayList<>(Json.read(json, Json.STRING_LIST));
            if (urls.contains(url)) return;
            urls.add(url);
            dao.pages().updateAlternateUrls(pageId, Json.write(urls));
        });
    }

    @Override
    public List<PageRecord> listPages(String jobId) {
        return db.pages().listByJob(jobId);
    }

    @Override
    public List<PageRecord> searchPages(String query) {
        if (query == null || query.isBlank()) return List.of();
        return db.pages().search(query.strip(), SEARCH_LIMIT);
    }
}
