package org.netpreserve.pagecrawl;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory crawl state of one job: the FIFO queue, the in-flight set and the outcome of every URL that has been
 * taken. All methods are synchronized on the frontier so workers share it under one lock.
 * <p>
 * A canonical URL is admitted at most once per job. Once it has left the queue it stays known, so a URL that failed,
 * turned out to be a duplicate or was dropped is never queued again.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final Scope scope;
    private final @Nullable Integer pageLimit;
    private final ArrayDeque<FrontierUrl> queue = new ArrayDeque<>();
    private final Map<String, FrontierUrl.State> states = new HashMap<>();
    private final Map<String, FrontierUrl> inFlight = new LinkedHashMap<>();
    private final Set<String> completed = new LinkedHashSet<>();
    private final Map<String, String> failed = new LinkedHashMap<>();
    private final Map<String, Integer> completedPerTarget = new HashMap<>();
    private final Map<String, Integer> inFlightPerTarget = new HashMap<>();

    /**
     * @param scope     targets of the job
     * @param pageLimit maximum pages saved per target, or null for no limit
     */
    public Frontier(Scope scope, @Nullable Integer pageLimit) {
        this.scope = scope;
        this.pageLimit = pageLimit;
    }

    /**
     * Queues a canonical URL unless it has been seen before in this job.
     *
     * @return true if the URL was newly queued
     */
    public synchronized boolean add(String url, int depth) {
        if (states.containsKey(url)) return false;
        var frontierUrl = new FrontierUrl(url, depth, scope.targetFor(url));
        queue.addLast(frontierUrl);
        states.put(url, FrontierUrl.State.QUEUED);
        return true;
    }

    public synchronized int addAll(Collection<LinkExtractor.Link> links) {
        int novel = 0;
        for (var link : links) {
            if (add(link.url(), link.depth())) novel++;
        }
        log.debug("Added {} new URLs from {} links", novel, links.size());
        return novel;
    }

    /**
     * Takes the first queued URL whose target still has capacity. URLs of full targets are left in place.
     *
     * @return the URL, now in flight, or null if nothing can be taken right now
     */
    public synchronized @Nullable FrontierUrl takeNext() {
        for (Iterator<FrontierUrl> it = queue.iterator(); it.hasNext(); ) {
            FrontierUrl candidate = it.next();
            if (!hasCapacity(candidate.target())) continue;
            it.remove();
            states.put(candidate.url(), FrontierUrl.State.IN_FLIGHT);
            inFlight.put(candidate.url(), candidate);
            if (candidate.target() != null) inFlightPerTarget.merge(candidate.target(), 1, Integer::sum);
            return candidate;
        }
        return null;
    }

    /**
     * Records the outcome of an in-flight URL.
     *
     * @param detail error description, only used for {@link FrontierUrl.State#FAILED}
     */
    public synchronized void release(FrontierUrl frontierUrl, FrontierUrl.State newState, @Nullable String detail) {
        if (newState == FrontierUrl.State.QUEUED || newState == FrontierUrl.State.IN_FLIGHT) {
            throw new IllegalArgumentException("Not a final state: " + newState);
        }
        if (inFlight.remove(frontierUrl.url()) == null) {
            log.warn("Released URL that was not in flight: {}", frontierUrl.url());
            return;
        }
        String target = frontierUrl.target();
        if (target != null) inFlightPerTarget.merge(target, -1, Integer::sum);
        states.put(frontierUrl.url(), newState);
        if (newState == FrontierUrl.State.COMPLETED) {
            completed.add(frontierUrl.url());
            if (target != null) completedPerTarget.merge(target, 1, Integer::sum);
        } else if (newState == FrontierUrl.State.FAILED) {
            failed.put(frontierUrl.url(), detail == null ? "Unknown error" : detail);
        }
    }

    /**
     * Conservative quota check: a target is full once its completed count reaches the limit. In-flight URLs are not
     * counted, so concurrent workers may overshoot the limit by up to one page each.
     */
    public synchronized boolean hasCapacity(@Nullable String target) {
        if (target == null || pageLimit == null) return true;
        return completedCount(target) < pageLimit;
    }

    /**
     * True while at least one target can accept more pages.
     */
    public synchronized boolean canGrabMoreUrls() {
        if (pageLimit == null) return true;
        for (String target : scope.targets()) {
            if (completedCount(target) < pageLimit) return true;
        }
        return false;
    }

    /**
     * True once every target has reached the page limit. Always false without a limit.
     */
    public synchronized boolean hasMetPageLimit() {
        return pageLimit != null && !canGrabMoreUrls();
    }

    public synchronized int completedCount(String target) {
        return completedPerTarget.getOrDefault(target, 0);
    }

    public synchronized int inFlightCount(String target) {
        return inFlightPerTarget.getOrDefault(target, 0);
    }

    public synchronized boolean hasInFlight() {
        return !inFlight.isEmpty();
    }

    public synchronized int queueSize() {
        return queue.size();
    }

    public synchronized @Nullable FrontierUrl.State state(String url) {
        return states.get(url);
    }

    public synchronized Set<String> completed() {
        return new LinkedHashSet<>(completed);
    }

    /**
     * Failed URLs with their error details, in the order they failed.
     */
    public synchronized Map<String, String> failures() {
        return new LinkedHashMap<>(failed);
    }

    public synchronized List<String> errors() {
        List<String> errors = new ArrayList<>(failed.size());
        failed.forEach((url, detail) -> errors.add(url + ": " + detail));
        return errors;
    }

    /**
     * Discards everything still queued or in flight. The discarded URLs stay known.
     */
    public synchronized void clearPending() {
        for (FrontierUrl url : queue) {
            states.put(url.url(), FrontierUrl.State.DROPPED);
        }
        for (String url : inFlight.keySet()) {
            states.put(url, FrontierUrl.State.DROPPED);
        }
        if (!queue.isEmpty() || !inFlight.isEmpty()) {
            log.info("Discarding {} queued and {} in-flight URLs", queue.size(), inFlight.size());
        }
        queue.clear();
        inFlight.clear();
        inFlightPerTarget.clear();
    }

    public synchronized CrawlProgress progress() {
        int found = queue.size() + inFlight.size() + completed.size();
        return new CrawlProgress(found, completed.size(), failed.size(), queue.size(),
                new ArrayList<>(inFlight.keySet()));
    }
}
