package org.netpreserve.pagecrawl;

import org.apache.commons.lang3.StringUtils;
import org.netpreserve.pagecrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw hrefs of a page into frontier entries: filters out non-page links, canonicalizes, removes
 * duplicates and assigns each link a depth.
 * <p>
 * Internal links (under any target) always get depth 0. External links are kept only when following external links
 * is enabled and the new depth ({@code currentDepth + 1}) is within {@code maxHops}.
 */
public class LinkExtractor {
    private static final Logger log = LoggerFactory.getLogger(LinkExtractor.class);
    private static final String[] SKIPPED_PREFIXES = {"mailto:", "tel:", "javascript:", "data:", "#"};
    static final String[] DENIED_EXTENSIONS = {
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".xlsm", ".ppt", ".pptx", ".odt", ".ods", ".odp",
            ".zip", ".tar", ".gz", ".rar", ".7z", ".bz2",
            ".psd", ".ai", ".eps",
            ".mp4", ".avi", ".mov", ".wmv", ".flv", ".webm", ".mkv",
            ".mp3", ".wav", ".flac", ".aac", ".ogg",
            ".exe", ".dmg", ".pkg", ".deb", ".rpm", ".apk",
            ".csv", ".xml", ".json", ".sql", ".db"};
    private static final Pattern QUOTED_HREF = Pattern.compile("<a[^>]+href=[\"']([^\"']+)[\"'][^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UNQUOTED_HREF = Pattern.compile("<a[^>]+href=([^\\s>\"']+)[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AREA_HREF = Pattern.compile("<area[^>]+href=[\"']([^\"']+)[\"'][^>]*>",
            Pattern.CASE_INSENSITIVE);

    private final Scope scope;
    private final boolean followExternal;
    private final int maxHops;

    public record Link(String url, int depth) {
    }

    public LinkExtractor(Scope scope, boolean followExternal, int maxHops) {
        this.scope = scope;
        this.followExternal = followExternal;
        this.maxHops = maxHops;
    }

    /**
     * @param hrefs        link targets as found on the page, absolute or relative
     * @param pageUrl      URL of the page the links were found on, used to resolve relative links
     * @param currentDepth depth assigned to the page itself
     * @return links in first-seen order without duplicates
     */
    public List<Link> extract(List<String> hrefs, String pageUrl, int currentDepth) {
        var base = new Url(pageUrl);
        var seen = new LinkedHashSet<String>();
        var links = new ArrayList<Link>();
        int external = 0;
        for (String href : hrefs) {
            String canonical = toCanonical(href, base);
            if (canonical == null || !seen.add(canonical)) continue;
            if (scope.isInternal(canonical)) {
                links.add(new Link(canonical, 0));
            } else if (followExternal && currentDepth + 1 <= maxHops) {
                links.add(new Link(canonical, currentDepth + 1));
                external++;
            }
        }
        log.debug("Extracted {} links ({} external) from {} hrefs on {}", links.size(), external, hrefs.size(), pageUrl);
        return links;
    }

    private static String toCanonical(String href, Url base) {
        if (StringUtils.isBlank(href)) return null;
        String trimmed = href.strip();
        if (trimmed.length() > UrlCanonicalizer.MAX_URL_LENGTH) return null;
        if (StringUtils.startsWithAny(trimmed.toLowerCase(Locale.ROOT), SKIPPED_PREFIXES)) return null;
        Url resolved = base.resolve(trimmed);
        if (resolved == null || !resolved.isHttp()) return null;
        if (hasDeniedExtension(resolved.path())) return null;
        return UrlCanonicalizer.canonicalize(resolved.toString());
    }

    static boolean hasDeniedExtension(String path) {
        return StringUtils.endsWithAny(path.toLowerCase(Locale.ROOT), DENIED_EXTENSIONS);
    }

    /**
     * Pulls href values out of raw HTML with regular expressions. Used when the renderer returned no links or the
     * page came from the cache.
     */
    public static List<String> hrefsFromHtml(String html) {
        if (html == null || html.isEmpty()) return List.of();
        Set<String> hrefs = new LinkedHashSet<>();
        collect(QUOTED_HREF.matcher(html), hrefs, false);
        collect(UNQUOTED_HREF.matcher(html), hrefs, true);
        collect(AREA_HREF.matcher(html), hrefs, false);
        return new ArrayList<>(hrefs);
    }

    private static void collect(Matcher matcher, Set<String> hrefs, boolean unquoted) {
        while (matcher.find()) {
            String href = matcher.group(1);
            if (unquoted && (href.contains("<") || href.contains(">") || href.contains("="))) continue;
            hrefs.add(href);
        }
    }
}
