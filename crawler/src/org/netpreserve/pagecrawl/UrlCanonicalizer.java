package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.util.Url;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Normalizes URLs into the form used as frontier and page identity.
 * <p>
 * The canonical form forces https, lowercases the host and strips any leading {@code www.} labels, drops the
 * default port, the query, the fragment and trailing slashes (the root path stays {@code /}). Internationalized
 * hosts are converted to their ASCII form. Applying it twice gives the same result as applying it once.
 */
public final class UrlCanonicalizer {
    /**
     * Longer strings are almost certainly page content mistaken for a URL.
     */
    public static final int MAX_URL_LENGTH = 2000;

    private UrlCanonicalizer() {
    }

    /**
     * @return the canonical URL, or null if the input is blank, too long, malformed, not http(s) or has no host
     */
    public static @Nullable String canonicalize(@Nullable String url) {
        if (url == null) return null;
        url = url.strip();
        if (url.isEmpty() || url.length() > MAX_URL_LENGTH) return null;

        URI uri;
        try {
            uri = new Url(url).toURI();
        } catch (URISyntaxException e) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) return null;
        String host = uri.getHost();
        int port = uri.getPort();
        if (host == null) {
            // URI only parses hostnames made of letters, digits and hyphens
            String authority = uri.getRawAuthority();
            if (authority == null) return null;
            authority = authority.substring(authority.lastIndexOf('@') + 1);
            int colon = authority.lastIndexOf(':');
            if (colon >= 0 && !authority.endsWith("]")) {
                try {
                    port = Integer.parseInt(authority.substring(colon + 1));
                } catch (NumberFormatException e) {
                    return null;
                }
                authority = authority.substring(0, colon);
            }
            try {
                host = IDN.toASCII(authority);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        if (host.isEmpty()) return null;

        host = host.toLowerCase(Locale.ROOT);
        while (host.startsWith("www.") && host.length() > "www.".length()) {
            host = host.substring("www.".length());
        }

        var builder = new StringBuilder(url.length());
        builder.append("https://").append(host);
        if (port != -1 && port != 80 && port != 443) {
            builder.append(':').append(port);
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        int end = path.length();
        while (end > 1 && path.charAt(end - 1) == '/') end--;
        builder.append(path, 0, end);
        return builder.toString();
    }
}
