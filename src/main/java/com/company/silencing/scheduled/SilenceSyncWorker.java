package com.company.silencing.scheduled;

import com.company.silencing.config.SilenceProperties;

import java.time.Clock;

/**
 * Reloads the manager cache from storage at a fixed interval, picking up
 * writes made by other instances sharing the database.
 */
public class SilenceSyncWorker extends PeriodicSilenceWorker {

    private final Runnable cacheRefresher;

    public SilenceSyncWorker(Runnable cacheRefresher, SilenceProperties.SyncConfig config, Clock clock) {
        // A refresh must finish before the next one is due
        super("silence-sync", config.getInterval(), config.getInterval(), config.getInterval(), clock);
        this.cacheRefresher = cacheRefresher;
    }

    @Override
    protected void runCycle() {
        cacheRefresher.run();
    }
}
