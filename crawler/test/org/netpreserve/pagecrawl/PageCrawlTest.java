package org.netpreserve.pagecrawl;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageCrawlTest {
    @Test
    void testParseOptions() {
        var options = PageCrawl.Options.parse(new String[]{"-j", "jobs/docs", "--workers", "3", "-n", "20",
                "--no-strict", "--wait-for", "main,article", "https://example.com/docs"});
        assertEquals(Path.of("jobs/docs"), options.jobDir);
        assertEquals(3, options.workers);
        assertEquals(20, options.pageLimit);
        assertEquals(Boolean.FALSE, options.strict);
        assertEquals(List.of("main", "article"), options.waitFor);
        assertEquals(List.of("https://example.com/docs"), options.targets);
        assertFalse(options.help);
    }

    @Test
    void testMissingOptionValue() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> PageCrawl.Options.parse(new String[]{"https://example.com/", "--workers"}));
        assertEquals("Option --workers requires a value", e.getMessage());
    }

    @Test
    void testNonNumericOptionValue() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> PageCrawl.Options.parse(new String[]{"--page-limit", "ten", "https://example.com/"}));
        assertEquals("Option --page-limit expects a number but got: ten", e.getMessage());
    }

    @Test
    void testUnknownOption() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> PageCrawl.Options.parse(new String[]{"--fast"}));
        assertEquals("Unknown option: --fast", e.getMessage());
    }
}
