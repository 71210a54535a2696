package com.example.notemake_backend.dto.web;

import com.example.notemake_backend.dto.pipeline.CacheStats;

public record CacheStatsResponse(long entryCount, long totalSizeBytes, double totalSizeMb, long oldestEntryAgeSec,
                                 long ttlDays) {

    public static CacheStatsResponse from(CacheStats stats, long ttlDays) {
        double mb = Math.round(stats.totalSizeBytes() / (1024.0 * 1024.0) * 100.0) / 100.0;
        return new CacheStatsResponse(stats.entryCount(), stats.totalSizeBytes(), mb,
                stats.oldestEntryAge().getSeconds(), ttlDays);
    }
}
