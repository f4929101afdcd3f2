package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Detects pages whose text has already been saved in the same job under another URL.
 * <p>
 * Only the cleaned text is hashed. Titles and other metadata are left out so that pages differing only in their
 * chrome still collide.
 */
public class ContentDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ContentDeduplicator.class);
    public static final String EMPTY_CONTENT = "No content extracted from this page.";
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+$", Pattern.MULTILINE);

    private final Storage storage;

    public ContentDeduplicator(Storage storage) {
        this.storage = storage;
    }

    /**
     * Collapses runs of blank lines, strips trailing whitespace from each line and trims the result.
     */
    public static String clean(@Nullable String text) {
        if (text == null) return EMPTY_CONTENT;
        String cleaned = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
        cleaned = TRAILING_WHITESPACE.matcher(cleaned).replaceAll("");
        cleaned = cleaned.strip();
        return cleaned.isEmpty() ? EMPTY_CONTENT : cleaned;
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes.
     */
    public static String hash(String text) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public @Nullable PageRecord findDuplicate(String jobId, String contentHash) {
        return storage.getPageByContentHash(jobId, contentHash);
    }

    /**
     * If the job already has a page with this hash, records {@code url} as one of its alternate URLs.
     *
     * @return true if the content was a duplicate
     */
    public boolean mergeIfDuplicate(String jobId, String contentHash, String url) {
        PageRecord existing = findDuplicate(jobId, contentHash);
        if (existing == null) return false;
        storage.appendAlternateUrl(existing.id(), url);
        log.atInfo().addKeyValue("url", url).addKeyValue("original", existing.url())
                .log("Duplicate content, added as alternate URL");
        return true;
    }
}
