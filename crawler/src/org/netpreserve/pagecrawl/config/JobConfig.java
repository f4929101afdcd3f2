package org.netpreserve.pagecrawl.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Root configuration for a crawl job.
 *
 * @param crawl     how to crawl (concurrency, scope, limits)
 * @param browser   what to render with
 * @param readiness when a rendered page counts as ready
 */
public record JobConfig(
        CrawlConfig crawl,
        BrowserConfig browser,
        ReadinessConfig readiness
) {
    public static JobConfig defaults() {
        return new JobConfig(CrawlConfig.defaults(), BrowserConfig.defaults(), ReadinessConfig.defaults());
    }

    public JobConfig withCrawl(CrawlConfig crawl) {
        return new JobConfig(crawl, browser, readiness);
    }

    public JobConfig withBrowser(BrowserConfig browser) {
        return new JobConfig(crawl, browser, readiness);
    }

    public static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    /**
     * Loads the built-in defaults with {@code configFile} merged over them, if it exists.
     */
    public static JobConfig load(@Nullable Path configFile) throws IOException {
        var mapper = yamlMapper();
        JsonNode configTree;
        try (InputStream stream = Objects.requireNonNull(JobConfig.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            configTree = mapper.readTree(stream);
        }
        if (configFile != null && Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(configTree, JobConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isMissingNode()) return base;
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
