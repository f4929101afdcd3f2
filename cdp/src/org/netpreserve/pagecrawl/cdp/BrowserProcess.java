package org.netpreserve.pagecrawl.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.cdp.domains.Browser;
import org.netpreserve.pagecrawl.cdp.domains.Target;
import org.netpreserve.pagecrawl.cdp.protocol.CDPClient;
import org.netpreserve.pagecrawl.cdp.protocol.CDPClosedException;
import org.netpreserve.pagecrawl.cdp.protocol.CDPException;
import org.netpreserve.pagecrawl.cdp.protocol.CDPSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.lang.ProcessBuilder.Redirect.*;
import static java.util.stream.Collectors.joining;

/**
 * Launches and manages a browser process controlled via CDP.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 *
 * try (BrowserProcess browserProcess = BrowserProcess.start();
 *      Navigator navigator = browserProcess.newWindow(null)) {
 *     navigator.navigateTo(new Url("http://example.com/"), Duration.ofSeconds(30));
 * }
 * }</pre>
 */
public class BrowserProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium",
            "chromium-browser",
            "google-chrome",
            "google-chrome-stable",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe");

    /**
     * Flags that keep background tabs running timers, rendering and network at full speed. Workers drive several
     * tabs at once and only one of them can be in the foreground.
     */
    private static final List<String> NO_THROTTLING_FLAGS = List.of(
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding",
            "--disable-features=CalculateNativeWinOcclusion,IntensiveWakeUpThrottling");

    private final Process process;
    private final CDPClient cdp;
    private final Browser browser;
    private final Target target;
    private Browser.Version version;

    private BrowserProcess(Process process, CDPClient cdp) {
        this.process = process;
        this.cdp = cdp;
        this.browser = cdp.domain(Browser.class);
        this.target = cdp.domain(Target.class);
        target.onDetachedFromTarget(event -> {
            log.debug("Target {} detached", event.targetId());
            cdp.markDetached(event.sessionId());
        });
    }

    public static BrowserProcess start() throws IOException {
        return start(null, List.of("--headless=new"), null, null);
    }

    /**
     * @param executable browser binary, or null to search the usual install locations
     * @param options    extra command-line flags
     * @param profileDir user data directory, or null for a temporary one deleted on exit
     * @param shell      command prefix used to run the browser (e.g. {@code ssh host}), or null for {@code /bin/sh -c}
     */
    public static BrowserProcess start(@Nullable String executable, @Nullable List<String> options,
                                       @Nullable Path profileDir, @Nullable List<String> shell) throws IOException {
        boolean temporaryProfile = profileDir == null;
        if (temporaryProfile) {
            profileDir = Path.of(System.getProperty("java.io.tmpdir"), "pagecrawl-" + UUID.randomUUID());
        }
        if (executable == null) {
            executable = probeForExecutable(shell);
        }
        if (shell == null && Files.exists(Path.of("/bin/sh"))) {
            shell = List.of("/bin/sh", "-c");
        }
        var command = buildCommand(executable, options, profileDir, shell != null);
        // always download PDFs rather than opening the viewer
        String preferences = "{\"plugins\":{\"always_open_pdf_externally\": true}}";
        Path preferencesFile = profileDir.resolve("Default").resolve("Preferences");

        Process process;
        if (shell != null) {
            // Pipe mode: the browser talks CDP on FD 3 (in) and FD 4 (out). Java can't hand arbitrary FDs to a
            // child so the shell maps them onto our stdin and stdout.
            var shellCommand = new ArrayList<>(shell);
            String cleanupTrap = "";
            if (temporaryProfile) {
                if (profileDir.getNameCount() == 0) throw new IOException("Refusing to delete " + profileDir);
                cleanupTrap = "trap " + singleQuote("rm -rf " + singleQuote(profileDir.toString()) + " 2>/dev/null")
                              + " EXIT && ";
            }
            shellCommand.add(cleanupTrap +
                             "mkdir -p " + singleQuote(preferencesFile.getParent().toString()) +
                             " && echo " + singleQuote(preferences) + " > " + singleQuote(preferencesFile.toString()) +
                             " && " + command.stream().map(BrowserProcess::singleQuote).collect(joining(" ")) +
                             " 3<&0 4>&1 0<&- 1>&2");
            process = new ProcessBuilder(shellCommand)
                    .redirectError(INHERIT)
                    .redirectOutput(PIPE)
                    .redirectInput(PIPE)
                    .start();
        } else {
            Files.createDirectories(preferencesFile.getParent());
            Files.writeString(preferencesFile, preferences);
            process = new ProcessBuilder(command)
                    .inheritIO()
                    .redirectError(PIPE)
                    .start();
        }
        addShutdownHook(process);
        try {
            CDPClient client = shell != null ?
                    new CDPClient(process.getInputStream(), process.getOutputStream()) :
                    new CDPClient(readDevtoolsUrl(process));
            return new BrowserProcess(process, client);
        } catch (IOException | RuntimeException e) {
            process.destroy();
            throw e;
        }
    }

    private static List<String> buildCommand(String executable, @Nullable List<String> options, Path profileDir,
                                             boolean pipe) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.add(pipe ? "--remote-debugging-pipe" : "--remote-debugging-port=0");
        command.addAll(List.of(
                "--no-default-browser-check",
                "--no-first-run",
                "--no-startup-window",
                "--disable-search-engine-choice-screen",
                "--disable-background-networking",
                "--disable-sync",
                "--use-mock-keychain",
                "--disable-blink-features=AutomationControlled",
                "--window-size=1920,1080",
                "--user-data-dir=" + profileDir));
        command.addAll(NO_THROTTLING_FLAGS);
        if (options != null) command.addAll(options);
        return command;
    }

    private static void addShutdownHook(Process process) {
        java.lang.Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (process.waitFor(1, TimeUnit.SECONDS)) return;
                process.destroy();
                if (process.waitFor(10, TimeUnit.SECONDS)) return;
                process.destroyForcibly();
            } catch (InterruptedException e) {
                process.destroyForcibly();
            }
        }, "BrowserProcess shutdown"));
    }

    private static String singleQuote(String string) {
        return "'" + string.replace("'", "'\\''") + "'";
    }

    private static String probeForExecutable(@Nullable List<String> shell) throws IOException {
        if (shell == null && !Files.exists(Path.of("/bin/sh"))) {
            for (var executable : BROWSER_EXECUTABLES) {
                try {
                    new ProcessBuilder(executable, "--version").inheritIO().start();
                    return executable;
                } catch (IOException e) {
                    log.debug("Browser candidate {} not found", executable);
                }
            }
            throw new IOException("Couldn't detect browser. Use the --browser option");
        }
        var shellCommand = new ArrayList<>(shell != null ? shell : List.of("/bin/sh", "-c"));
        shellCommand.add(BROWSER_EXECUTABLES.stream()
                .map(executable -> "command -v " + singleQuote(executable))
                .collect(joining(" || ")));
        var process = new ProcessBuilder(shellCommand)
                .inheritIO()
                .redirectOutput(PIPE)
                .start();
        var output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
        try {
            if (process.waitFor() != 0 || output.isEmpty()) {
                throw new IOException("Couldn't detect browser (shell: " + shellCommand.subList(0, shellCommand.size() - 1)
                                      + "). Use the --browser option");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while detecting browser", e);
        }
        return output.lines().findFirst().orElse(output);
    }

    private static URI readDevtoolsUrl(Process process) throws IOException {
        var future = new CompletableFuture<URI>();
        var thread = new Thread(() -> {
            var prefix = "DevTools listening on ";
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream()))) {
                reader.lines().forEach(line -> {
                    if (line.startsWith(prefix)) {
                        future.complete(URI.create(line.substring(prefix.length())));
                    }
                    log.info("Browser: {}", line);
                });
            } catch (Exception e) {
                log.error("Error reading browser stderr", e);
                future.completeExceptionally(e);
            }
        }, "Browser stderr");
        thread.setDaemon(true);
        thread.start();
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for DevTools URL", e);
        } catch (TimeoutException | ExecutionException e) {
            throw new IOException("Browser did not report a DevTools URL", e);
        }
    }

    /**
     * Closes the connection to the browser and terminates the process.
     */
    @Override
    public void close() {
        try {
            browser.close();
            cdp.waitClose(Duration.ofMillis(1000));
        } catch (CDPClosedException e) {
            log.debug("Browser already gone");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("Error quitting browser", e);
        }
        try {
            cdp.close();
        } catch (RuntimeException e) {
            log.warn("Error closing browser CDP connection", e);
        }
        process.destroy();
        try {
            process.waitFor(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted closing process", e);
            Thread.currentThread().interrupt();
        } finally {
            process.destroyForcibly();
        }
    }

    public boolean isAlive() {
        return process.isAlive() && !cdp.isClosed();
    }

    /**
     * Opens a new tab in its own window.
     *
     * @param browserContextId context from {@link #createBrowserContext()}, or null for the default context
     */
    public Navigator newWindow(@Nullable String browserContextId) {
        String targetId = target.createTarget("about:blank", browserContextId == null ? Boolean.TRUE : null,
                1920, 1080, browserContextId).targetId();
        var sessionId = target.attachToTarget(targetId, true).sessionId();
        var session = new CDPSession(cdp, sessionId, targetId);
        try {
            return new Navigator(session);
        } catch (CDPException e) {
            session.close();
            throw e;
        }
    }

    /**
     * Creates an incognito-like browser context that shares nothing with the default profile.
     */
    public String createBrowserContext() {
        return target.createBrowserContext(null);
    }

    public void disposeBrowserContext(String browserContextId) {
        if (cdp.isClosed()) return;
        target.disposeBrowserContext(browserContextId);
    }

    public Browser.Version version() {
        if (version == null) {
            this.version = browser.getVersion();
        }
        return version;
    }
}
