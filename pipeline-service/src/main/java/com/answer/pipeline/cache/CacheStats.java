package com.answer.pipeline.cache;

public record CacheStats(
        int memoryEntries,
        int memoryCapacity,
        long memoryHits,
        long memoryMisses,
        long memoryEvictions,
        long sharedHits,
        long sharedMisses,
        boolean sharedEnabled,
        boolean sharedAvailable
) {
}
