package org.netpreserve.pagecrawl.cdp;

import org.netpreserve.pagecrawl.util.Url;

public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(Url url, String message) {
        super(url, message);
    }
}
