package com.company.silencing.service;

import com.company.silencing.cache.SilenceCache;
import com.company.silencing.config.SilenceProperties;
import com.company.silencing.domain.Silence;
import com.company.silencing.domain.enums.SilenceStatus;
import com.company.silencing.event.SilenceCreatedEvent;
import com.company.silencing.event.SilenceDeletedEvent;
import com.company.silencing.event.SilenceUpdatedEvent;
import com.company.silencing.exception.SilenceException;
import com.company.silencing.exception.SilenceManagerStateException;
import com.company.silencing.exception.SilenceValidationException;
import com.company.silencing.matcher.SilenceMatchResult;
import com.company.silencing.matcher.SilenceMatcher;
import com.company.silencing.repository.SilenceFilter;
import com.company.silencing.repository.SilenceRepository;
import com.company.silencing.repository.SilenceStats;
import com.company.silencing.scheduled.SilenceGcWorker;
import com.company.silencing.scheduled.SilenceSyncWorker;
import com.company.silencing.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates silence storage, the in-memory cache and the matcher.
 *
 * <p>Writes go to storage first and then through to the cache before returning, so a caller
 * always observes its own writes in {@link #isAlertSilenced(Map)}. Alert checks only read the
 * cache and never touch storage.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultSilenceManager implements SilenceManager {

    private final SilenceRepository repository;
    private final SilenceMatcher matcher;
    private final SilenceCache cache;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final SilenceProperties properties;
    private final Clock clock;

    private final AtomicReference<ManagerState> state = new AtomicReference<>(ManagerState.STOPPED);

    // Serializes cache rebuilds between the GC worker, the sync worker and start()
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile SilenceGcWorker gcWorker;
    private volatile SilenceSyncWorker syncWorker;
    private volatile Instant lastSyncAt;

    @Override
    public Silence createSilence(Silence silence) {
        requireRunning("create silence");

        Silence created = repository.createSilence(silence);
        cache.put(created);

        meterRegistry.counter("silences.created").increment();
        eventPublisher.publishEvent(new SilenceCreatedEvent(created.copy()));

        return created;
    }

    @Override
    public Silence getSilence(String id) {
        requireRunning("get silence");

        Optional<Silence> cached = cache.get(id);
        if (cached.isPresent()) {
            Silence silence = cached.get();
            silence.setStatus(silence.statusAt(TimeUtils.now(clock)));
            return silence;
        }

        Silence stored = repository.getSilenceById(id);
        if (!stored.getStatus().isTerminal()) {
            cache.put(stored);
        }
        return stored;
    }

    @Override
    public List<Silence> listSilences(SilenceFilter filter) {
        requireRunning("list silences");
        return repository.listSilences(filter);
    }

    @Override
    public Silence updateSilence(Silence patch) {
        requireRunning("update silence");

        if (patch == null) {
            throw new SilenceValidationException("silence", "Silence is required");
        }
        if (patch.getId() == null || patch.getId().isEmpty()) {
            throw new SilenceValidationException("id", "Silence ID is required");
        }
        if (patch.getUpdatedAt() == null) {
            throw new SilenceValidationException("updatedAt", "Update token is required");
        }

        Silence current = repository.getSilenceById(patch.getId());

        if (patch.getCreatedBy() != null && !patch.getCreatedBy().equals(current.getCreatedBy())) {
            throw new SilenceValidationException("createdBy", "Creator cannot be changed");
        }

        Silence merged = current.toBuilder()
                .comment(patch.getComment() != null ? patch.getComment() : current.getComment())
                .startsAt(patch.getStartsAt() != null ? patch.getStartsAt() : current.getStartsAt())
                .endsAt(patch.getEndsAt() != null ? patch.getEndsAt() : current.getEndsAt())
                .matchers(patch.getMatchers() != null
                        ? new ArrayList<>(patch.getMatchers())
                        : current.getMatchers())
                .updatedAt(patch.getUpdatedAt())
                .build();

        Silence updated = repository.updateSilence(merged);
        cache.put(updated);

        meterRegistry.counter("silences.updated").increment();
        eventPublisher.publishEvent(new SilenceUpdatedEvent(current, updated.copy()));

        return updated;
    }

    @Override
    public void deleteSilence(String id) {
        requireRunning("delete silence");

        repository.deleteSilence(id);
        cache.remove(id);

        meterRegistry.counter("silences.deleted").increment();
        eventPublisher.publishEvent(new SilenceDeletedEvent(id));
    }

    @Override
    public SilenceMatchResult isAlertSilenced(Map<String, String> labels) {
        meterRegistry.counter("silences.alerts.checked").increment();

        if (state.get() != ManagerState.RUNNING) {
            log.debug("Silence manager is {}, treating alert as not silenced", state.get());
            return SilenceMatchResult.notSilenced();
        }

        try {
            List<Silence> active = cache.activeAt(TimeUtils.now(clock));
            SilenceMatchResult result = matcher.isSilenced(labels, active,
                    () -> state.get() != ManagerState.RUNNING);

            if (result.isSilenced()) {
                meterRegistry.counter("silences.alerts.silenced").increment();
                log.debug("Alert {} silenced by {}", labels, result.getMatchedSilenceIds());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Silence check failed for alert {}, treating as not silenced", labels, e);
            return SilenceMatchResult.notSilenced();
        }
    }

    @Override
    public List<Silence> getActiveSilences() {
        requireRunning("list active silences");

        List<Silence> active = cache.activeAt(TimeUtils.now(clock));
        active.sort(Comparator.comparing(Silence::getEndsAt).thenComparing(Silence::getId));
        return active;
    }

    @Override
    public List<Silence> getExpiringSoon(Duration window) {
        requireRunning("list expiring silences");

        if (window == null || window.isZero() || window.isNegative()) {
            throw new SilenceValidationException("window", "Window must be positive");
        }
        return repository.getExpiringSoon(window);
    }

    @Override
    public SilenceManagerStats getStats() {
        Instant now = TimeUtils.now(clock);
        List<Silence> cached = cache.snapshot();
        long pending = cached.stream().filter(s -> s.statusAt(now) == SilenceStatus.PENDING).count();
        long active = cached.stream().filter(s -> s.statusAt(now) == SilenceStatus.ACTIVE).count();

        SilenceStats storage = null;
        try {
            storage = repository.getSilenceStats();
        } catch (SilenceException e) {
            log.warn("Could not read silence storage stats: {}", e.getMessage());
        }

        SilenceGcWorker gc = gcWorker;
        SilenceSyncWorker sync = syncWorker;

        return SilenceManagerStats.builder()
                .state(state.get())
                .cacheSize(cached.size())
                .cachedPending(pending)
                .cachedActive(active)
                .lastSyncAt(lastSyncAt)
                .storage(storage)
                .gcRuns(gc != null ? gc.getRunCount() : 0)
                .gcFailures(gc != null ? gc.getFailureCount() : 0)
                .lastGcAt(gc != null ? gc.getLastRunAt() : null)
                .syncRuns(sync != null ? sync.getRunCount() : 0)
                .syncFailures(sync != null ? sync.getFailureCount() : 0)
                .alertsChecked((long) meterRegistry.counter("silences.alerts.checked").count())
                .alertsSilenced((long) meterRegistry.counter("silences.alerts.silenced").count())
                .build();
    }

    @Override
    public ManagerState getState() {
        return state.get();
    }

    /**
     * Load the cache and launch the background workers. A failed initial load leaves the
     * manager stopped and rethrows.
     */
    @Override
    public synchronized void start() {
        if (state.get() == ManagerState.RUNNING) {
            log.warn("Silence manager already running");
            return;
        }
        if (!state.compareAndSet(ManagerState.STOPPED, ManagerState.STARTING)) {
            throw new SilenceManagerStateException("Cannot start silence manager", state.get());
        }

        log.info("Starting silence manager");

        try {
            refreshCache();
        } catch (RuntimeException e) {
            state.set(ManagerState.STOPPED);
            log.error("Silence manager failed to load silences, staying stopped", e);
            throw e;
        }

        SilenceProperties.GcConfig gcConfig = properties.getGc();
        if (gcConfig.isEnabled()) {
            gcWorker = new SilenceGcWorker(repository, this::refreshCache, eventPublisher,
                    meterRegistry, gcConfig, clock);
            gcWorker.start();
        }

        SilenceProperties.SyncConfig syncConfig = properties.getSync();
        if (syncConfig.isEnabled()) {
            syncWorker = new SilenceSyncWorker(this::refreshCache, syncConfig, clock);
            syncWorker.start();
        }

        state.set(ManagerState.RUNNING);
        log.info("Silence manager running with {} cached silences", cache.size());
    }

    /**
     * Stop the workers, waiting at most the configured shutdown timeout for in-flight cycles.
     */
    @Override
    public synchronized void stop() {
        if (!state.compareAndSet(ManagerState.RUNNING, ManagerState.STOPPING)) {
            log.debug("Silence manager not running ({}), nothing to stop", state.get());
            return;
        }

        log.info("Stopping silence manager");
        Duration timeout = properties.getManager().getShutdownTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();

        boolean clean = true;
        if (gcWorker != null) {
            clean &= gcWorker.stop(timeout);
        }
        if (syncWorker != null) {
            clean &= syncWorker.stop(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
        }
        if (!clean) {
            log.warn("Silence manager workers did not stop within {}", timeout);
        }

        // Let an in-flight refresh finish so it cannot refill the cache after the clear
        boolean locked = false;
        try {
            locked = refreshLock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            cache.clear();
        } finally {
            if (locked) {
                refreshLock.unlock();
            }
        }
        state.set(ManagerState.STOPPED);
        log.info("Silence manager stopped");
    }

    /**
     * Reload the cache from storage. Mutations made while the load is running are kept.
     */
    public void refreshCache() {
        refreshLock.lock();
        try {
            if (isShuttingDown()) {
                log.debug("Silence manager is {}, skipping cache refresh", state.get());
                return;
            }
            cache.beginRebuild();
            List<Silence> loaded;
            try {
                loaded = repository.listUnexpiredSilences();
            } catch (RuntimeException e) {
                cache.abortRebuild();
                throw e;
            }
            if (isShuttingDown()) {
                cache.abortRebuild();
                return;
            }
            cache.completeRebuild(loaded);
            lastSyncAt = TimeUtils.now(clock);
            log.debug("Silence cache refreshed with {} silences", cache.size());
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean isShuttingDown() {
        ManagerState current = state.get();
        return current == ManagerState.STOPPING || current == ManagerState.STOPPED;
    }

    private void requireRunning(String operation) {
        ManagerState current = state.get();
        if (current != ManagerState.RUNNING) {
            throw new SilenceManagerStateException("Cannot " + operation, current);
        }
    }
}
