package com.company.silencing.cache;

import com.company.silencing.domain.Silence;
import com.company.silencing.domain.enums.SilenceStatus;
import com.company.silencing.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory view of the silences that have not ended yet (pending and active).
 *
 * <p>Alert checks read a snapshot under the read lock. Writers (CRUD write-through and the
 * periodic rebuild from storage) take the write lock. A rebuild loads from storage outside
 * the lock, so mutations arriving meanwhile are journaled and replayed on top of the loaded
 * data when the new map is swapped in. A slow reload can therefore never resurrect a deleted
 * silence or roll back an update.
 *
 * <p>Write-through is ordered by {@code updatedAt}: a put never replaces a newer version of the
 * same silence. A removed id is remembered as a tombstone, so a put carrying data read from
 * storage before the delete is dropped. A tombstone lives until the removed silence would have
 * ended, or for the tombstone TTL when its end time is unknown, and is pruned on rebuild.
 *
 * <p>Every silence handed in or out is a copy; callers never share instances with the cache.
 */
@Slf4j
public class SilenceCache {

    public static final Duration DEFAULT_TOMBSTONE_TTL = Duration.ofHours(1);

    private final ReadWriteLock lock;
    private final Clock clock;
    private final Duration tombstoneTtl;

    private Map<String, Silence> silences = new HashMap<>();

    // removed id -> instant after which the tombstone can be dropped
    private final Map<String, Instant> tombstones = new HashMap<>();

    // id -> replacement, or empty for a removal, recorded while a rebuild is in flight
    private final Map<String, Optional<Silence>> journal = new LinkedHashMap<>();
    private boolean rebuilding;
    private long rebuildCount;
    private Instant lastRebuildAt;

    public SilenceCache(Clock clock) {
        this(clock, new ReentrantReadWriteLock());
    }

    public SilenceCache(Clock clock, ReadWriteLock lock) {
        this(clock, lock, DEFAULT_TOMBSTONE_TTL);
    }

    public SilenceCache(Clock clock, ReadWriteLock lock, Duration tombstoneTtl) {
        this.clock = clock;
        this.lock = lock;
        this.tombstoneTtl = tombstoneTtl;
    }

    /**
     * Insert or replace, unless the cache already holds a newer version or the id was removed.
     * A silence that has already ended is evicted instead.
     *
     * @return true if the silence is now cached
     */
    public boolean put(Silence silence) {
        Instant now = TimeUtils.now(clock);
        if (!silence.getEndsAt().isAfter(now)) {
            evict(silence.getId());
            return false;
        }

        Silence copy = silence.copy();
        lock.writeLock().lock();
        try {
            if (tombstones.containsKey(copy.getId())) {
                log.debug("Dropping cache put for removed silence {}", copy.getId());
                return false;
            }
            if (isOlder(copy, silences.get(copy.getId()))) {
                log.debug("Dropping stale cache put for silence {} (updatedAt {})",
                        copy.getId(), copy.getUpdatedAt());
                return false;
            }
            silences.put(copy.getId(), copy);
            if (rebuilding) {
                journal.put(copy.getId(), Optional.of(copy));
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a deleted silence and refuse later puts for its id.
     */
    public void remove(String id) {
        Instant now = TimeUtils.now(clock);
        lock.writeLock().lock();
        try {
            Silence removed = silences.remove(id);
            Instant until = removed != null ? removed.getEndsAt() : now.plus(tombstoneTtl);
            tombstones.merge(id, until, (a, b) -> a.isAfter(b) ? a : b);
            if (rebuilding) {
                journal.put(id, Optional.empty());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Ended silences leave the cache without a tombstone; storage still has them
    private void evict(String id) {
        lock.writeLock().lock();
        try {
            silences.remove(id);
            if (rebuilding) {
                journal.put(id, Optional.empty());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean isOlder(Silence candidate, Silence current) {
        return current != null
                && current.getUpdatedAt() != null
                && candidate.getUpdatedAt() != null
                && candidate.getUpdatedAt().isBefore(current.getUpdatedAt());
    }

    public Optional<Silence> get(String id) {
        lock.readLock().lock();
        try {
            Silence silence = silences.get(id);
            return silence != null ? Optional.of(silence.copy()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Point-in-time copy of every cached silence.
     */
    public List<Silence> snapshot() {
        lock.readLock().lock();
        try {
            List<Silence> copies = new ArrayList<>(silences.size());
            for (Silence silence : silences.values()) {
                copies.add(silence.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies of the silences active at {@code now}, with their status set accordingly.
     */
    public List<Silence> activeAt(Instant now) {
        lock.readLock().lock();
        try {
            List<Silence> active = new ArrayList<>();
            for (Silence silence : silences.values()) {
                if (silence.isActiveAt(now)) {
                    Silence copy = silence.copy();
                    copy.setStatus(SilenceStatus.ACTIVE);
                    active.add(copy);
                }
            }
            return active;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Start journaling mutations. Call before loading from storage.
     */
    public void beginRebuild() {
        lock.writeLock().lock();
        try {
            if (rebuilding) {
                log.debug("Silence cache rebuild already in progress, restarting journal");
            }
            rebuilding = true;
            journal.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Swap in the freshly loaded silences, then replay mutations made since {@link #beginRebuild()}.
     */
    public void completeRebuild(Collection<Silence> loaded) {
        Instant now = TimeUtils.now(clock);
        Map<String, Silence> fresh = new HashMap<>();
        for (Silence silence : loaded) {
            if (silence.getEndsAt().isAfter(now)) {
                fresh.put(silence.getId(), silence.copy());
            }
        }

        lock.writeLock().lock();
        try {
            int replayed = journal.size();
            for (Map.Entry<String, Optional<Silence>> entry : journal.entrySet()) {
                if (entry.getValue().isPresent()) {
                    Silence journaled = entry.getValue().get();
                    if (!isOlder(journaled, fresh.get(entry.getKey()))) {
                        fresh.put(entry.getKey(), journaled);
                    }
                } else {
                    fresh.remove(entry.getKey());
                }
            }
            journal.clear();

            Iterator<Map.Entry<String, Instant>> it = tombstones.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Instant> tombstone = it.next();
                if (tombstone.getValue().isAfter(now)) {
                    fresh.remove(tombstone.getKey());
                } else {
                    it.remove();
                }
            }

            rebuilding = false;
            silences = fresh;
            rebuildCount++;
            lastRebuildAt = now;

            log.debug("Silence cache rebuilt with {} silences ({} journaled changes replayed)",
                    fresh.size(), replayed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop the journal after a failed load. Current contents stay as they are.
     */
    public void abortRebuild() {
        lock.writeLock().lock();
        try {
            rebuilding = false;
            journal.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            silences = new HashMap<>();
            tombstones.clear();
            journal.clear();
            rebuilding = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return silences.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats getStats() {
        lock.readLock().lock();
        try {
            return CacheStats.builder()
                    .size(silences.size())
                    .tombstones(tombstones.size())
                    .rebuildCount(rebuildCount)
                    .lastRebuildAt(lastRebuildAt)
                    .rebuilding(rebuilding)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }
}
