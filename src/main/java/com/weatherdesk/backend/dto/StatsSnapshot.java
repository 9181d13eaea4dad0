package com.weatherdesk.backend.dto;

import java.util.List;

/**
 * Point-in-time counts for the stats endpoint. Holds scalars only, so it is
 * always a finite tree that serializes cleanly.
 *
 * @param totalUsers      users in the backing store, null when the store could not be read
 * @param weatherRequests weather lookups completed since startup
 * @param cacheStatus     sizes of the in-memory caches
 * @param partial         true when some figure could not be obtained
 * @param missing         names of the fields that could not be obtained
 */
public record StatsSnapshot(Long totalUsers,
                            long weatherRequests,
                            CacheStatus cacheStatus,
                            boolean partial,
                            List<String> missing) {

    public record CacheStatus(int weatherCacheSize, int sessionCount) {}

    public StatsSnapshot {
        missing = List.copyOf(missing);
    }
}
