package io.billbatch.render;

import java.time.Instant;

/**
 * Selector view of one engine.
 *
 * name         : engine name
 * priorityRank : 0-based position in the fallback chain
 * available    : result of the last probe, null if never probed
 * probedAt     : time of the last probe, null if never probed
 */
public record EngineDescriptor(
        String name,
        int priorityRank,
        Boolean available,
        Instant probedAt
) {
}
