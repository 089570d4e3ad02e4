package com.whereq.easel.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Accepted-but-not-started job counts per requester.
 *
 * Requester ids {@code <= 0} are anonymous and never counted. Entries that drop to zero are
 * removed. Not thread-safe; the owner guards access.
 */
class PendingCounters {

    private final Map<Long, Integer> counts = new HashMap<>();

    int count(long requesterId) {
        return counts.getOrDefault(requesterId, 0);
    }

    void increment(long requesterId) {
        if (requesterId > 0) {
            counts.merge(requesterId, 1, Integer::sum);
        }
    }

    /**
     * No-op when nothing is counted for the requester
     */
    void decrement(long requesterId) {
        counts.computeIfPresent(requesterId, (id, count) -> count > 1 ? count - 1 : null);
    }

    /**
     * Increment only if the requester is below {@code limit}; a limit {@code <= 0} never blocks
     */
    boolean tryIncrement(long requesterId, int limit) {
        if (limit > 0 && requesterId > 0 && count(requesterId) >= limit) {
            return false;
        }
        increment(requesterId);
        return true;
    }

    int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    int requesters() {
        return counts.size();
    }

    void clear() {
        counts.clear();
    }
}
