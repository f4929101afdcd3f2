package org.netpreserve.pagecrawl.cdp.domains;

import org.netpreserve.pagecrawl.cdp.protocol.Unwrap;

import java.util.List;
import java.util.function.Consumer;

public interface Target {
    GetTargets getTargets();

    CreateTarget createTarget(String url, Boolean newWindow, Integer width, Integer height,
                              String browserContextId);

    AttachToTarget attachToTarget(String targetId, boolean flatten);

    void closeTarget(String targetId);

    /**
     * Creates a context with its own cookie jar, cache and storage.
     */
    @Unwrap("browserContextId")
    String createBrowserContext(Boolean disposeOnDefaultBrowserContext);

    void disposeBrowserContext(String browserContextId);

    void onDetachedFromTarget(Consumer<DetachedFromTarget> handler);

    record CreateTarget(String targetId) {
    }

    record GetTargets(List<TargetInfo> targetInfos) {
    }

    record AttachToTarget(String sessionId) {
    }

    record DetachedFromTarget(String sessionId, String targetId) {
    }

    record TargetInfo(String targetId, String type, String title, String url, boolean attached,
                      String browserContextId) {
    }
}
