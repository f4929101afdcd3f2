package org.netpreserve.pagecrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.pagecrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * Tuning of the content readiness wait.
 *
 * @param networkIdleWait      how long the resource count must stay unchanged
 * @param domStableWait        how long the mutation count must stay unchanged
 * @param contentPlateauWait   how long the content length must stay unchanged
 * @param contentCheckInterval how often the content length is sampled
 * @param minContentLength     content length at which a page may be considered ready without growing
 * @param signalCap            upper bound on each of the two waiting phases
 * @param pollInterval         scheduler tick
 */
public record ReadinessConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration networkIdleWait,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration domStableWait,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration contentPlateauWait,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration contentCheckInterval,
        int minContentLength,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration signalCap,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pollInterval
) {
    public static ReadinessConfig defaults() {
        return new ReadinessConfig(Duration.ofMillis(500), Duration.ofMillis(1000), Duration.ofMillis(1000),
                Duration.ofMillis(200), 200, Duration.ofSeconds(10), Duration.ofMillis(100));
    }
}
