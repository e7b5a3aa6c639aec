package com.mikov.accountvalidator.cache;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CacheStats {
    private final int size;
    private final long hits;
    private final long misses;
    private final double hitRate;
    private final int maxSize;
}
