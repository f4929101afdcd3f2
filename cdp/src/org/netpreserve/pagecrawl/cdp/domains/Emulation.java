package org.netpreserve.pagecrawl.cdp.domains;

public interface Emulation {
    /**
     * Makes the page believe it has focus even when its window is in the background.
     */
    void setFocusEmulationEnabled(boolean enabled);

    void setUserAgentOverride(String userAgent);
}
