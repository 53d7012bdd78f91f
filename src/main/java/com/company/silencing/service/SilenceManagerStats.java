package com.company.silencing.service;

import com.company.silencing.repository.SilenceStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceManagerStats {
    private ManagerState state;

    // Cache
    private int cacheSize;
    private long cachedPending;
    private long cachedActive;
    private Instant lastSyncAt;

    // Storage counts, null when storage could not be read
    private SilenceStats storage;

    // Background workers
    private long gcRuns;
    private long gcFailures;
    private Instant lastGcAt;
    private long syncRuns;
    private long syncFailures;

    private long alertsChecked;
    private long alertsSilenced;
}
