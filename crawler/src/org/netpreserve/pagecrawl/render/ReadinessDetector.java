package org.netpreserve.pagecrawl.render;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagecrawl.config.ReadinessConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Decides when a loaded page has finished rendering its content.
 * <p>
 * Runs as a state machine driven by a fixed tick. In {@link Phase#LOADING} it samples the resource and mutation
 * counters until both have been unchanged long enough (network idle and DOM stable) or the phase cap runs out. In
 * {@link Phase#CONTENT_PLATEAU} it samples the visible text length until it stops changing. The overall timeout moves
 * straight to {@link Phase#READY} from any phase, so the wait never outlasts it. Failing probes never fail the wait.
 */
public class ReadinessDetector {
    private static final Logger log = LoggerFactory.getLogger(ReadinessDetector.class);
    private final ReadinessConfig config;

    public enum Phase {
        LOADING, CONTENT_PLATEAU, READY
    }

    /**
     * @param reason        {@code plateau}, {@code plateau-with-content}, {@code timeout} or {@code probe-failed}
     * @param contentLength last sampled content length
     */
    public record Readiness(String reason, Duration elapsed, int contentLength, boolean networkIdle,
                            boolean domStable) {
    }

    public ReadinessDetector(ReadinessConfig config) {
        this.config = config;
    }

    /**
     * Counter that is considered settled once its value hasn't changed for {@code quietNanos}.
     */
    private static class QuietSignal {
        final Probe<Integer> probe;
        final long quietNanos;
        int lastValue = -1;
        long lastChange;
        boolean settled;

        QuietSignal(Probe<Integer> probe, Duration quiet, long now) {
            this.probe = probe;
            this.quietNanos = quiet.toNanos();
            this.lastChange = now;
        }

        void sample(RendererSession session, long now) {
            if (settled) return;
            Integer value = probe(session, probe);
            if (value == null) {
                settled = true;
                return;
            }
            if (value != lastValue) {
                lastValue = value;
                lastChange = now;
            } else if (now - lastChange >= quietNanos) {
                settled = true;
            }
        }
    }

    public Readiness await(RendererSession session, Duration timeout) throws InterruptedException {
        long start = System.nanoTime();
        long timeoutNanos = Math.max(0, timeout.toNanos());
        long hardDeadline = start + timeoutNanos;
        long signalCap = config.signalCap().toNanos();
        long loadingDeadline = start + Math.min(timeoutNanos, signalCap);
        long plateauWait = config.contentPlateauWait().toNanos();
        long checkInterval = config.contentCheckInterval().toNanos();
        long tick = config.pollInterval().toMillis();

        var network = new QuietSignal(Probe.RESOURCE_COUNT, config.networkIdleWait(), start);
        var dom = new QuietSignal(Probe.MUTATION_COUNT, config.domStableWait(), start);

        Phase phase = Phase.LOADING;
        long plateauDeadline = 0;
        long nextContentCheck = 0;
        int lastLength = 0;
        long timerStart = -1;
        String timerReason = null;
        String reason = "timeout";

        while (true) {
            long now = System.nanoTime();
            if (now - hardDeadline >= 0) break;

            if (phase == Phase.LOADING) {
                network.sample(session, now);
                dom.sample(session, now);
                if ((network.settled && dom.settled) || now - loadingDeadline >= 0) {
                    phase = Phase.CONTENT_PLATEAU;
                    plateauDeadline = now + Math.min(hardDeadline - now, signalCap);
                    nextContentCheck = now;
                    log.trace("Loading phase done after {}ms (networkIdle={}, domStable={})",
                            (now - start) / 1_000_000, network.settled, dom.settled);
                }
            }

            if (phase == Phase.CONTENT_PLATEAU) {
                if (now - plateauDeadline >= 0) break;
                if (now - nextContentCheck >= 0) {
                    nextContentCheck = now + checkInterval;
                    Integer length = probe(session, Probe.CONTENT_LENGTH);
                    if (length == null) {
                        reason = "probe-failed";
                        break;
                    }
                    if (length != lastLength) {
                        lastLength = length;
                        timerStart = now;
                        timerReason = "plateau";
                    } else if (length >= config.minContentLength() && timerStart < 0) {
                        timerStart = now;
                        timerReason = "plateau-with-content";
                    }
                }
                if (timerStart >= 0 && now - timerStart >= plateauWait) {
                    reason = timerReason;
                    break;
                }
            }

            long sleepMillis = Math.min(tick, Math.max(1, (hardDeadline - System.nanoTime()) / 1_000_000));
            Thread.sleep(sleepMillis);
        }

        var readiness = new Readiness(reason, Duration.ofNanos(System.nanoTime() - start), lastLength,
                network.settled, dom.settled);
        log.atDebug().addKeyValue("reason", readiness.reason())
                .addKeyValue("elapsedMs", readiness.elapsed().toMillis())
                .addKeyValue("contentLength", readiness.contentLength())
                .log("Content ready");
        return readiness;
    }

    /**
     * Polls until every selector matches an element or the timeout passes.
     *
     * @return true if all selectors were found
     */
    public boolean waitForSelectors(RendererSession session, List<String> selectors, Duration timeout)
            throws InterruptedException {
        if (selectors.isEmpty()) return true;
        Probe<Boolean> probe = Probe.selectorsPresent(selectors);
        long deadline = System.nanoTime() + timeout.toNanos();
        long tick = config.pollInterval().toMillis();
        while (true) {
            if (Boolean.TRUE.equals(probe(session, probe))) return true;
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMillis <= 0) {
                log.warn("Timed out waiting for selectors {} on session {}", selectors, session.id());
                return false;
            }
            Thread.sleep(Math.min(tick, remainingMillis));
        }
    }

    private static <T> @Nullable T probe(RendererSession session, Probe<T> probe) {
        try {
            return session.runProbe(probe);
        } catch (RenderException e) {
            log.debug("Probe {} failed: {}", probe.name(), e.getMessage());
            return null;
        }
    }
}
