package org.netpreserve.pagecrawl;

/**
 * The database was created by a different version of pagecrawl and doesn't have the columns or constraints this
 * version relies on.
 */
public class SchemaMismatchException extends RuntimeException {
    public static final String GUIDANCE = "Delete the job directory's db.sqlite3 (or point --job-dir at a new " +
                                          "directory) so the database is recreated with the current schema.";

    public SchemaMismatchException(String message) {
        super(message + ". " + GUIDANCE);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message + ". " + GUIDANCE, cause);
    }
}
