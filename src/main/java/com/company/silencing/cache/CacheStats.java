package com.company.silencing.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {
    private int size;
    private int tombstones;
    private long rebuildCount;
    private Instant lastRebuildAt;
    private boolean rebuilding;
}
