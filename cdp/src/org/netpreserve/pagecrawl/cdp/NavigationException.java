package org.netpreserve.pagecrawl.cdp;

import org.netpreserve.pagecrawl.util.Url;

public class NavigationException extends Exception {
    protected final Url url;

    public NavigationException(Url url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
