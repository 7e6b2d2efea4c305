package com.pgokache.scheduler;

import com.pgokache.collector.CollectorSettings;
import com.pgokache.crypto.InvalidCredentialException;
import com.pgokache.logging.MdcKeys;
import com.pgokache.model.Instance;
import com.pgokache.model.SetupState;
import com.pgokache.service.CollectorService;
import com.pgokache.store.RecordStore;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background collection loop over every instance whose setup is ready.
 *
 * <p>One daemon worker runs passes back to back: a pass visits ready instances sequentially and
 * isolates failures per instance, then the worker sleeps for the polling interval. The handle can
 * be started once; {@link #stop()} is observed before each pass and between instances.
 */
@Component
public class CollectionScheduler {
    private static final Logger log = LoggerFactory.getLogger(CollectionScheduler.class);

    private final RecordStore recordStore;
    private final CollectorService collectorService;
    private final CollectorSettings settings;
    private final boolean enabled;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong passCount = new AtomicLong();
    private volatile ScheduledExecutorService executor;
    private volatile CountDownLatch currentPassLatch;
    private volatile OffsetDateTime lastPassStartedAt;
    private volatile OffsetDateTime lastPassFinishedAt;
    private volatile OffsetDateTime nextPassAt;

    /**
     * Snapshot of the scheduler state.
     */
    @Value
    @Builder
    public static class SchedulerStatus {
        boolean enabled;
        boolean running;
        int intervalSec;
        long passCount;
        OffsetDateTime lastPassStartedAt;
        OffsetDateTime lastPassFinishedAt;
        /** When the worker will start the next pass; null while stopped or mid-pass. */
        OffsetDateTime nextPassAt;
    }

    /**
     * Counts of one pass.
     */
    @Value
    public static class PassResult {
        int collected;
        int skipped;
        int failed;
    }

    @Autowired
    public CollectionScheduler(
            RecordStore recordStore,
            CollectorService collectorService,
            CollectorSettings settings,
            @org.springframework.beans.factory.annotation.Value("${pgokache.scheduler.enabled:true}") boolean enabled
    ) {
        this(recordStore, collectorService, settings, enabled, Clock.systemUTC());
    }

    CollectionScheduler(RecordStore recordStore, CollectorService collectorService, CollectorSettings settings,
                        boolean enabled, Clock clock) {
        this.recordStore = recordStore;
        this.collectorService = collectorService;
        this.settings = settings;
        this.enabled = enabled;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Collection scheduler disabled (pgokache.scheduler.enabled=false)");
            return;
        }
        start();
    }

    /**
     * Starts the loop. Only the first call has an effect.
     *
     * @return true if this call started the loop
     */
    public boolean start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Collection scheduler already started");
            return false;
        }

        running.set(true);
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pgokache-collector");
            t.setDaemon(true);
            return t;
        });
        nextPassAt = OffsetDateTime.now(clock);
        executor.schedule(this::tick, 0, TimeUnit.SECONDS);
        log.info("Started collection scheduler with interval: {}s", settings.resolveIntervalSec());
        return true;
    }

    /**
     * Stops the loop and waits briefly for an in-flight pass. The handle cannot be restarted.
     */
    @PreDestroy
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        nextPassAt = null;
        ScheduledExecutorService ex = executor;
        if (ex != null) {
            ex.shutdown();
        }

        CountDownLatch latch = currentPassLatch;
        if (latch != null) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for collection pass to complete");
            }
        }

        log.info("Stopped collection scheduler after {} pass(es)", passCount.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus getStatus() {
        return SchedulerStatus.builder()
                .enabled(enabled)
                .running(running.get())
                .intervalSec(settings.resolveIntervalSec())
                .passCount(passCount.get())
                .lastPassStartedAt(lastPassStartedAt)
                .lastPassFinishedAt(lastPassFinishedAt)
                .nextPassAt(nextPassAt)
                .build();
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        int intervalSec = settings.resolveIntervalSec();
        nextPassAt = null;

        CountDownLatch latch = new CountDownLatch(1);
        currentPassLatch = latch;
        try {
            runPass();
        } catch (Throwable t) {
            log.error("Collection pass failed", t);
        } finally {
            latch.countDown();
            scheduleNext(intervalSec);
        }
    }

    private void scheduleNext(int intervalSec) {
        if (!running.get()) {
            return;
        }
        try {
            executor.schedule(this::tick, intervalSec, TimeUnit.SECONDS);
            nextPassAt = OffsetDateTime.now(clock).plusSeconds(intervalSec);
        } catch (RejectedExecutionException e) {
            log.debug("Collection scheduler shut down before next pass could be scheduled");
        }
    }

    /**
     * Runs one pass over all ready instances on the calling thread.
     *
     * <p>lastCheckedAt is touched for every visited instance, whatever the outcome.
     *
     * @return pass counts
     */
    public PassResult runPass() {
        lastPassStartedAt = OffsetDateTime.now(clock);
        List<SetupState> readyStates = recordStore.listReadySetupStates();
        int collected = 0;
        int skipped = 0;
        int failed = 0;

        for (SetupState state : readyStates) {
            if (started.get() && !running.get()) {
                log.info("Collection pass interrupted by stop request");
                break;
            }

            long instanceId = state.getInstanceId();
            MDC.put(MdcKeys.INSTANCE_ID, String.valueOf(instanceId));
            try {
                Optional<Instance> instance = recordStore.findInstance(instanceId);
                if (instance.isEmpty()) {
                    skipped++;
                    continue;
                }
                collectorService.collectInstance(instance.get());
                collected++;
            } catch (InvalidCredentialException e) {
                log.warn("Collection skipped for instance {}: invalid credentials", instanceId);
                skipped++;
            } catch (Throwable t) {
                // Errors included: the remaining instances are still visited.
                log.error("Collection failed for instance {}: {}", instanceId, t.toString(), t);
                failed++;
            } finally {
                recordStore.touchLastChecked(instanceId, OffsetDateTime.now(clock));
                MDC.remove(MdcKeys.INSTANCE_ID);
            }
        }

        passCount.incrementAndGet();
        lastPassFinishedAt = OffsetDateTime.now(clock);
        log.debug("Collection pass finished: ready={}, collected={}, skipped={}, failed={}",
                readyStates.size(), collected, skipped, failed);
        return new PassResult(collected, skipped, failed);
    }
}
