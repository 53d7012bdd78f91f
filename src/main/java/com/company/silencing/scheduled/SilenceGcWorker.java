package com.company.silencing.scheduled;

import com.company.silencing.config.SilenceProperties;
import com.company.silencing.domain.Silence;
import com.company.silencing.event.SilencesExpiringSoonEvent;
import com.company.silencing.repository.SilenceRepository;
import com.company.silencing.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic silence garbage collection:
 * <ol>
 *   <li>mark silences whose end time has passed as expired</li>
 *   <li>hard delete expired silences older than the retention window</li>
 *   <li>reload the manager cache</li>
 *   <li>warn about active silences ending within the early-warning window</li>
 * </ol>
 * Storage work is done in batches of {@code batchSize} until a short batch comes back.
 */
@Slf4j
public class SilenceGcWorker extends PeriodicSilenceWorker {

    private final SilenceRepository repository;
    private final Runnable cacheRefresher;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final SilenceProperties.GcConfig config;

    public SilenceGcWorker(SilenceRepository repository,
                           Runnable cacheRefresher,
                           ApplicationEventPublisher eventPublisher,
                           MeterRegistry meterRegistry,
                           SilenceProperties.GcConfig config,
                           Clock clock) {
        super("silence-gc", config.getInterval(), config.getInitialDelay(), config.getTickTimeout(), clock);
        this.repository = repository;
        this.cacheRefresher = cacheRefresher;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.config = config;
    }

    @Override
    protected void runCycle() {
        long startTime = System.currentTimeMillis();
        Instant now = TimeUtils.now(clock);

        int expired = drain(() -> repository.expireSilences(now));
        if (expired > 0) {
            meterRegistry.counter("silences.gc.expired").increment(expired);
        }

        Instant deleteBefore = now.minus(config.getRetention());
        int deleted = drain(() -> repository.expireSilences(deleteBefore, true));
        if (deleted > 0) {
            meterRegistry.counter("silences.gc.deleted").increment(deleted);
        }

        cacheRefresher.run();

        reportExpiringSoon();

        log.info("Silence GC completed in {}ms: {} expired, {} deleted (retention {})",
                System.currentTimeMillis() - startTime, expired, deleted, config.getRetention());
    }

    @Override
    protected void onFailure() {
        meterRegistry.counter("silences.gc.failures").increment();
    }

    private void reportExpiringSoon() {
        List<Silence> expiring = repository.getExpiringSoon(config.getExpiringSoonWindow());
        if (expiring.isEmpty()) {
            return;
        }

        log.info("{} active silences end within {}", expiring.size(), config.getExpiringSoonWindow());
        for (Silence silence : expiring) {
            log.debug("Silence {} by {} ends at {}", silence.getId(), silence.getCreatedBy(), silence.getEndsAt());
        }
        eventPublisher.publishEvent(new SilencesExpiringSoonEvent(expiring, config.getExpiringSoonWindow()));
    }

    private int drain(BatchOperation operation) {
        int total = 0;
        int batch;
        do {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Silence GC interrupted after {} rows", total);
                break;
            }
            batch = operation.run();
            total += batch;
        } while (batch >= config.getBatchSize());
        return total;
    }

    @FunctionalInterface
    private interface BatchOperation {
        int run();
    }
}
