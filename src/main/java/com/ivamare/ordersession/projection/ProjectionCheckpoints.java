package com.ivamare.ordersession.projection;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last applied sequence number per subscriber per stream.
 */
public class ProjectionCheckpoints {

    private final Map<String, Map<String, Long>> checkpoints = new ConcurrentHashMap<>();

    /**
     * @return last applied sequence number, 0 if nothing was applied
     */
    public long lastApplied(String subscriber, String streamId) {
        Map<String, Long> streams = checkpoints.get(subscriber);
        if (streams == null) {
            return 0L;
        }
        return streams.getOrDefault(streamId, 0L);
    }

    public void advance(String subscriber, String streamId, long sequenceNumber) {
        checkpoints.computeIfAbsent(subscriber, s -> new ConcurrentHashMap<>())
            .merge(streamId, sequenceNumber, Math::max);
    }

    public void reset(String subscriber) {
        checkpoints.remove(subscriber);
    }

    public Set<String> streams(String subscriber) {
        return Set.copyOf(checkpoints.getOrDefault(subscriber, Map.of()).keySet());
    }
}
