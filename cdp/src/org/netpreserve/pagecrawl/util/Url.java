package org.netpreserve.pagecrawl.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * URL type which caches parsing. Accessors return null when the string is not a parseable absolute URI.
 */
public class Url {
    private static final String ILLEGAL_CHARS = " \"<>\\^`{|}";
    private final String url;
    private URI uri;
    private boolean unparseable;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public static @Nullable Url orNull(@Nullable String url) {
        if (url == null) return null;
        return new Url(url);
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(escapeIllegalChars(url));
        }
        return uri;
    }

    private synchronized @Nullable URI parse() {
        if (unparseable) return null;
        try {
            return toURI();
        } catch (URISyntaxException e) {
            unparseable = true;
            return null;
        }
    }

    /**
     * Percent-encodes the ASCII characters browsers tolerate in hrefs but {@link URI} rejects.
     */
    static String escapeIllegalChars(String s) {
        StringBuilder builder = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7f || ILLEGAL_CHARS.indexOf(c) >= 0) {
                if (builder == null) builder = new StringBuilder(s.length() + 16).append(s, 0, i);
                builder.append('%').append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(c & 0xf, 16)));
            } else if (builder != null) {
                builder.append(c);
            }
        }
        return builder == null ? s : builder.toString();
    }

    public boolean isValid() {
        return parse() != null;
    }

    public @Nullable String host() {
        URI parsed = parse();
        return parsed == null ? null : parsed.getHost();
    }

    public @Nullable String scheme() {
        URI parsed = parse();
        return parsed == null ? null : parsed.getScheme();
    }

    public int port() {
        URI parsed = parse();
        return parsed == null ? -1 : parsed.getPort();
    }

    /**
     * Raw (still percent-encoded) path, empty when the URL has none.
     */
    public String path() {
        URI parsed = parse();
        if (parsed == null || parsed.getRawPath() == null) return "";
        return parsed.getRawPath();
    }

    public @Nullable String query() {
        URI parsed = parse();
        return parsed == null ? null : parsed.getRawQuery();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    private String withoutQueryOrFragment() {
        String s = withoutFragment().url;
        int i = s.indexOf('?');
        return i == -1 ? s : s.substring(0, i);
    }

    /**
     * Scheme and authority, e.g. {@code https://example.org:8080}.
     */
    public @Nullable Url origin() {
        URI parsed = parse();
        if (parsed == null || parsed.getScheme() == null || parsed.getRawAuthority() == null) return null;
        return new Url(parsed.getScheme() + "://" + parsed.getRawAuthority());
    }

    public @Nullable Url withPath(String path) {
        Url origin = origin();
        return origin == null ? null : new Url(origin.url + path);
    }

    /**
     * Resolves a possibly relative reference against this URL the way a browser resolves an href.
     *
     * @return the absolute URL or null if either side can't be parsed
     */
    public @Nullable Url resolve(String reference) {
        URI base = parse();
        if (base == null || !base.isAbsolute()) return null;
        if (reference.isEmpty()) return withoutFragment();
        if (reference.startsWith("?")) return new Url(withoutQueryOrFragment() + reference);
        if (reference.startsWith("#")) return new Url(withoutFragment().url + reference);
        try {
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                base = new URI(base.getScheme() + "://" + base.getRawAuthority() + "/");
            }
            URI resolved = base.resolve(new URI(escapeIllegalChars(reference)));
            return new Url(resolved.toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return url.equals(((Url) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
