package org.netpreserve.pagecrawl.render;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.PageMetadata;

import java.util.List;

/**
 * @param url      address of the document after redirects
 * @param links    raw href values in document order, empty if the renderer doesn't collect them
 * @param markdown markdown rendition, if the renderer produces one
 */
public record RenderedPage(
        String url,
        String html,
        String text,
        List<String> links,
        PageMetadata metadata,
        @Nullable String markdown
) {
}
