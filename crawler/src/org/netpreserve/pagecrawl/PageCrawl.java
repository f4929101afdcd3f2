package org.netpreserve.pagecrawl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.cdp.protocol.CDPBase;
import org.netpreserve.pagecrawl.config.CrawlConfig;
import org.netpreserve.pagecrawl.config.JobConfig;
import org.netpreserve.pagecrawl.db.Database;
import org.netpreserve.pagecrawl.db.DatabaseDiagnostics;
import org.netpreserve.pagecrawl.db.DatabaseStorage;
import org.netpreserve.pagecrawl.render.CdpSessionFactory;
import org.netpreserve.pagecrawl.render.PooledRenderer;
import org.netpreserve.pagecrawl.render.ReadinessDetector;
import org.netpreserve.pagecrawl.render.RendererPool;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class PageCrawl {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(PageCrawl.class);
    private static final String DEFAULT_USER_AGENT = "pagecrawl/0.1";

    /**
     * Command-line options. Unset values leave the job's config.yaml in charge.
     */
    static class Options {
        Path jobDir = Path.of("data");
        final List<String> targets = new ArrayList<>();
        boolean help;
        boolean dumpConfig;
        boolean report;
        @Nullable Integer workers;
        @Nullable Integer pageLimit;
        @Nullable Integer maxHops;
        @Nullable Boolean strict;
        boolean skipCache;
        boolean isolated;
        boolean followExternal;
        @Nullable String browserExecutable;
        @Nullable String traceCdpFile;
        final List<String> waitFor = new ArrayList<>();

        /**
         * @throws IllegalArgumentException on an unknown option, a missing option value or a malformed number
         */
        static Options parse(String[] args) {
            var options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--dump-config" -> options.dumpConfig = true;
                    case "--report" -> options.report = true;
                    case "--job-dir", "-j" -> options.jobDir = Path.of(value(args, ++i, arg));
                    case "--workers", "-w" -> options.workers = intValue(args, ++i, arg);
                    case "--page-limit", "-n" -> options.pageLimit = intValue(args, ++i, arg);
                    case "--no-strict" -> options.strict = false;
                    case "--skip-cache" -> options.skipCache = true;
                    case "--isolated" -> options.isolated = true;
                    case "--follow-external" -> options.followExternal = true;
                    case "--max-hops" -> options.maxHops = intValue(args, ++i, arg);
                    case "--wait-for" -> options.waitFor.addAll(Arrays.asList(value(args, ++i, arg).split(",")));
                    case "--browser" -> options.browserExecutable = value(args, ++i, arg);
                    case "--trace-cdp" -> options.traceCdpFile = value(args, ++i, arg);
                    case "--help", "-h" -> options.help = true;
                    default -> {
                        if (arg.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + arg);
                        options.targets.add(arg);
                    }
                }
            }
            return options;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) throw new IllegalArgumentException("Option " + option + " requires a value");
            return args[i];
        }

        private static int intValue(String[] args, int i, String option) {
            String value = value(args, i, option);
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Option " + option + " expects a number but got: " + value);
            }
        }
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: pagecrawl [options] URL...");
        out.println("Options:");
        out.println("  -h, --help");
        out.println("      --browser EXE        Chrome or Chromium executable");
        out.println("      --dump-config        Print the effective configuration and exit");
        out.println("      --follow-external    Follow links leading outside the targets");
        out.println("      --isolated           Render in a separate browser context");
        out.println("  -j, --job-dir DIR        Directory for the database and config.yaml");
        out.println("      --max-hops N         Links to follow outside the targets (1-5)");
        out.println("      --no-strict          Match target paths by plain prefix");
        out.println("  -n, --page-limit N       Maximum pages saved per target");
        out.println("      --report             Print the diagnostic report and exit");
        out.println("      --skip-cache         Render pages even if saved by an earlier job");
        out.println("      --trace-cdp FILE     Write CDP trace to file");
        out.println("      --wait-for SELECTORS Comma-separated CSS selectors to wait for");
        out.println("  -w, --workers N          Pages rendered concurrently (1-10)");
    }

    public static void main(String[] args) throws Exception {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage(System.err);
            System.exit(1);
            return;
        }
        if (options.help) {
            printUsage(System.out);
            System.exit(0);
        }
        if (options.traceCdpFile != null) startCdpTraceFile(options.traceCdpFile);

        Path jobDir = options.jobDir;
        List<String> targets = options.targets;

        JobConfig config = JobConfig.load(jobDir.resolve("config.yaml"));
        CrawlConfig crawl = config.crawl();
        if (options.workers != null) crawl = crawl.withWorkers(options.workers);
        if (options.pageLimit != null) crawl = crawl.withPageLimit(options.pageLimit);
        if (options.strict != null) crawl = crawl.withStrict(options.strict);
        if (options.skipCache) crawl = crawl.withSkipCache(true);
        if (options.isolated) crawl = crawl.withIsolated(true);
        if (options.followExternal || options.maxHops != null) {
            crawl = crawl.withFollowExternal(options.followExternal || crawl.followExternal(),
                    options.maxHops != null ? options.maxHops : crawl.maxHops());
        }
        if (!options.waitFor.isEmpty()) crawl = crawl.withWaitFor(options.waitFor);
        config = config.withCrawl(crawl.normalized());
        if (options.browserExecutable != null) {
            config = config.withBrowser(config.browser().withExecutable(options.browserExecutable));
        }

        if (options.dumpConfig) {
            System.out.println(JobConfig.yamlMapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        if (targets.isEmpty() && !options.report) {
            System.err.println("No target URLs given. Try --help.");
            System.exit(1);
        }

        Files.createDirectories(jobDir);
        int exitCode;
        try (Database db = Database.open(jobDir.resolve("db.sqlite3"))) {
            var diagnostics = new DatabaseDiagnostics(db);
            if (options.report) {
                System.out.println(diagnostics.report());
                return;
            }
            diagnostics.cleanup(DatabaseDiagnostics.DEFAULT_RETENTION);
            exitCode = crawl(config, targets, db, diagnostics) ? 0 : 2;
        } catch (SchemaMismatchException e) {
            System.err.println(e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Runs one crawl to completion.
     *
     * @return true if every page was processed without error
     */
    private static boolean crawl(JobConfig config, List<String> targets, Database db,
                                 DatabaseDiagnostics diagnostics) throws Exception {
        var storage = new DatabaseStorage(db);
        String userAgent = config.browser().userAgent() != null ? config.browser().userAgent() : DEFAULT_USER_AGENT;
        var discovery = new SitemapDiscovery(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build(), userAgent);
        var sessionFactory = new CdpSessionFactory(config.browser());
        log.info("Using browser {}", sessionFactory.version());
        var renderer = new PooledRenderer(new RendererPool(sessionFactory), new ReadinessDetector(config.readiness()));

        var job = new CrawlJob(targets, config.crawl(), storage, renderer, discovery, diagnostics);
        var registry = new JobRegistry();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (registry.cancelActive()) {
                System.err.println("Interrupted, waiting for workers to stop...");
                try {
                    job.awaitCompletion(Duration.ofSeconds(30));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "shutdown-hook"));

        String jobId = registry.start(job);
        while (!job.awaitCompletion(Duration.ofHours(1))) {
            log.debug("Job {} still running", jobId);
        }

        CrawlProgress progress = job.progress();
        System.out.println("Job " + jobId + " finished: " + job.status());
        System.out.println("  pages saved:  " + progress.pagesProcessed());
        System.out.println("  pages failed: " + progress.pagesFailed());
        for (Map.Entry<String, String> failure : job.failures().entrySet()) {
            System.out.println("    " + failure.getKey() + ": " + failure.getValue());
        }
        return job.status() == JobStatus.COMPLETED;
    }

    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("cdp-trace-file");
        fileAppender.setFile(file);
        fileAppender.start();

        var cdpLogger = (Logger) LoggerFactory.getLogger(CDPBase.class);
        cdpLogger.addAppender(fileAppender);
        if (cdpLogger.getEffectiveLevel().toInt() != Level.TRACE_INT) {
            // keep the console at the level it had before
            var filter = new ThresholdFilter();
            filter.setLevel(cdpLogger.getEffectiveLevel().toString());
            filter.start();
            Appender<ILoggingEvent> stdout = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT");
            if (stdout != null) {
                stdout.stop();
                stdout.addFilter(filter);
                stdout.start();
            }
            cdpLogger.setLevel(Level.TRACE);
        }
    }
}
