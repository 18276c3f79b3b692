package com.climapipeline.service.cache;

public record CacheStats(int entries, long sizeBytes, String path, long ttlMinutes) {
}
