package org.netpreserve.pagecrawl.cdp;

import org.netpreserve.pagecrawl.util.Url;

/**
 * The browser reported a network-level error (e.g. {@code net::ERR_NAME_NOT_RESOLVED}) for the main document.
 */
public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(Url url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
