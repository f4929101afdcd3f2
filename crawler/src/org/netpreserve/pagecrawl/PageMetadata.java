package org.netpreserve.pagecrawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Descriptive metadata read from a page's head. Every field is optional.
 *
 * @param canonical the page's own {@code <link rel="canonical">}, not our canonical form
 * @param jsonLd    the first JSON-LD block carrying a headline, description or name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageMetadata(
        @Nullable String title,
        @Nullable String description,
        @Nullable String keywords,
        @Nullable String author,
        @Nullable String generator,
        @Nullable String ogTitle,
        @Nullable String ogDescription,
        @Nullable String ogType,
        @Nullable String ogSiteName,
        @Nullable String articleSection,
        @Nullable List<String> articleTags,
        @Nullable String canonical,
        @Nullable String language,
        @Nullable JsonLd jsonLd
) {
    public static final PageMetadata EMPTY = new PageMetadata(null, null, null, null, null, null, null, null, null,
            null, null, null, null, null);

    public static PageMetadata ofTitle(String title) {
        return new PageMetadata(title, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JsonLd(
            @Nullable String type,
            @Nullable String headline,
            @Nullable String description,
            @Nullable String name,
            @Nullable String author) {
    }
}
