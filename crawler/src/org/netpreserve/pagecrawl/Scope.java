package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.util.Url;

import java.util.List;

/**
 * Decides whether a canonical URL falls under one of the crawl targets.
 */
public class Scope {
    private final List<String> targets;
    private final boolean strict;

    /**
     * @param targets canonical target URLs, in priority order
     * @param strict  require a path segment boundary after the target path
     */
    public Scope(List<String> targets, boolean strict) {
        this.targets = List.copyOf(targets);
        this.strict = strict;
    }

    public List<String> targets() {
        return targets;
    }

    public boolean strict() {
        return strict;
    }

    /**
     * Tests whether {@code url} has the same origin as {@code base} and its path starts with the base path. In
     * strict mode {@code /api} matches {@code /api} and {@code /api/users} but not {@code /api-docs}. A base path of
     * {@code /} matches everything on the host.
     */
    public static boolean isUnderBasePath(String url, String base, boolean strict) {
        Url parsedUrl = new Url(url);
        Url parsedBase = new Url(base);
        Url origin = parsedUrl.origin();
        Url baseOrigin = parsedBase.origin();
        if (origin == null || baseOrigin == null || !origin.toString().equalsIgnoreCase(baseOrigin.toString())) {
            return false;
        }

        String path = parsedUrl.path().isEmpty() ? "/" : parsedUrl.path();
        String basePath = parsedBase.path().isEmpty() ? "/" : parsedBase.path();
        if (basePath.equals("/")) return true;
        if (!path.startsWith(basePath)) return false;
        if (!strict) return true;
        return path.length() == basePath.length()
               || basePath.endsWith("/")
               || path.charAt(basePath.length()) == '/';
    }

    public static boolean isInternal(String url, List<String> bases, boolean strict) {
        for (String base : bases) {
            if (isUnderBasePath(url, base, strict)) return true;
        }
        return false;
    }

    public boolean isInternal(String url) {
        return isInternal(url, targets, strict);
    }

    /**
     * Returns the first target the URL falls under, or null for external URLs.
     */
    public @Nullable String targetFor(String url) {
        for (String target : targets) {
            if (isUnderBasePath(url, target, strict)) return target;
        }
        return null;
    }
}
