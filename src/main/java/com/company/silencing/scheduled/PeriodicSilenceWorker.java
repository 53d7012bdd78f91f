package com.company.silencing.scheduled;

import com.company.silencing.exception.SilenceException;
import com.company.silencing.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-delay background worker owned by the silence manager.
 *
 * <p>A single-thread {@link ThreadPoolTaskScheduler} triggers each cycle; the cycle itself runs
 * on a single-thread {@link ThreadPoolTaskExecutor} and is bounded by its own timeout. A cycle
 * that overruns is cancelled through thread interruption and counted as a failure. Both pools
 * are created on every {@link #start()}, so a stopped worker can be started again.
 */
@Slf4j
public abstract class PeriodicSilenceWorker {

    private final String name;
    private final Duration interval;
    private final Duration initialDelay;
    private final Duration cycleTimeout;
    protected final Clock clock;

    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private volatile Instant lastRunAt;

    private ThreadPoolTaskScheduler scheduler;
    private ThreadPoolTaskExecutor cycleExecutor;
    private volatile boolean running;

    protected PeriodicSilenceWorker(String name,
                                    Duration interval,
                                    Duration initialDelay,
                                    Duration cycleTimeout,
                                    Clock clock) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(name + " interval must be positive: " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.initialDelay = initialDelay != null ? initialDelay : Duration.ZERO;
        this.cycleTimeout = cycleTimeout;
        this.clock = clock;
    }

    /**
     * One unit of work. Runs on the cycle thread; should honor interruption.
     */
    protected abstract void runCycle();

    public synchronized void start() {
        if (running) {
            log.warn("Worker {} already running", name);
            return;
        }

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(name + "-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.initialize();

        cycleExecutor = new ThreadPoolTaskExecutor();
        cycleExecutor.setCorePoolSize(1);
        cycleExecutor.setMaxPoolSize(1);
        cycleExecutor.setThreadNamePrefix(name + "-cycle-");
        cycleExecutor.setDaemon(true);
        cycleExecutor.setWaitForTasksToCompleteOnShutdown(true);
        cycleExecutor.initialize();

        running = true;

        Instant firstRun = scheduler.getClock().instant().plus(initialDelay);
        scheduler.scheduleWithFixedDelay(this::tick, firstRun, interval);

        log.info("Started worker {} (interval: {}, cycle timeout: {})", name, interval, cycleTimeout);
    }

    /**
     * Stop scheduling and wait for the current cycle, at most {@code timeout}. A cycle still
     * running after that is interrupted.
     *
     * @return true if the worker terminated in time
     */
    public synchronized boolean stop(Duration timeout) {
        if (!running) {
            return true;
        }
        running = false;
        log.info("Stopping worker {}", name);

        long deadline = System.nanoTime() + timeout.toNanos();

        scheduler.setAwaitTerminationMillis(timeout.toMillis());
        scheduler.shutdown();
        boolean terminated = scheduler.getScheduledThreadPoolExecutor().isTerminated();
        if (!terminated) {
            // Interrupting the tick cancels the cycle it is waiting on
            scheduler.getScheduledThreadPoolExecutor().shutdownNow();
        }

        cycleExecutor.setAwaitTerminationMillis(
                Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
        cycleExecutor.shutdown();
        if (!cycleExecutor.getThreadPoolExecutor().isTerminated()) {
            cycleExecutor.getThreadPoolExecutor().shutdownNow();
            terminated = false;
        }

        if (!terminated) {
            log.warn("Worker {} did not finish its cycle within {}, interrupted", name, timeout);
        }
        return terminated;
    }

    /**
     * Run one cycle under the cycle timeout. Called by the scheduler thread.
     */
    void tick() {
        Future<?> future;
        try {
            future = cycleExecutor.submit(this::runCycle);
        } catch (RuntimeException e) {
            // Cycle executor already shut down by stop()
            log.debug("Worker {} skipped a cycle: {}", name, e.getMessage());
            return;
        }

        try {
            if (cycleTimeout != null && !cycleTimeout.isZero()) {
                future.get(cycleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                future.get();
            }
            runCount.incrementAndGet();
            lastRunAt = TimeUtils.now(clock);
        } catch (TimeoutException e) {
            future.cancel(true);
            failureCount.incrementAndGet();
            onFailure();
            log.error("Worker {} cycle exceeded {} and was cancelled", name, cycleTimeout);
        } catch (ExecutionException e) {
            failureCount.incrementAndGet();
            onFailure();
            Throwable cause = e.getCause();
            if (cause instanceof SilenceException && ((SilenceException) cause).isRetryable()) {
                log.warn("Worker {} cycle failed, retrying next cycle: {}", name, cause.getMessage());
            } else {
                log.error("Worker {} cycle failed", name, cause);
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Hook for failure metrics.
     */
    protected void onFailure() {
    }

    public String getName() {
        return name;
    }

    public boolean isRunning() {
        return running;
    }

    public long getRunCount() {
        return runCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }
}
