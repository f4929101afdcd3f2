package org.netpreserve.pagecrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.util.CommandLineDeserializer;

import java.util.List;

/**
 * Configuration for the browser pages are rendered in.
 *
 * @param executable binary to invoke (e.g. "google-chrome-stable"), null to search the usual locations
 * @param options    command-line options
 * @param shell      remote shell command (e.g. ["ssh", "user@host"])
 * @param userAgent  User-Agent override, null to keep the browser's own
 */
public record BrowserConfig(
        @Nullable String executable,
        @JsonDeserialize(using = CommandLineDeserializer.class)
        List<String> options,
        @JsonDeserialize(using = CommandLineDeserializer.class)
        @Nullable List<String> shell,
        @Nullable String userAgent
) {
    public static BrowserConfig defaults() {
        return new BrowserConfig(null, List.of("--headless=new", "--disable-gpu"), null, null);
    }

    public BrowserConfig withExecutable(String executable) {
        return new BrowserConfig(executable, options, shell, userAgent);
    }
}
