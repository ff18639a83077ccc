package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.Channel;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically publishes LaunchPacks whose channel schedule has come due.
 *
 * Publishes run without force, so failed channels are retried only after the cooldown and
 * packs claimed by another caller are skipped.
 */
public final class DuePublishSweeper {
    private static final Logger log = LoggerFactory.getLogger(DuePublishSweeper.class);

    static final int DEFAULT_BATCH_SIZE = 25;

    private final LaunchPackStore store;
    private final List<PublishOrchestrator> orchestrators;
    private final LaunchKitMetrics metrics;
    private final Clock clock;
    private final Duration interval;
    private final int batchSize;
    private final ScheduledExecutorService scheduler;

    public DuePublishSweeper(LaunchPackStore store, List<PublishOrchestrator> orchestrators,
                             LaunchKitMetrics metrics, Clock clock, Duration interval) {
        this(store, orchestrators, metrics, clock, interval, DEFAULT_BATCH_SIZE);
    }

    public DuePublishSweeper(LaunchPackStore store, List<PublishOrchestrator> orchestrators,
                             LaunchKitMetrics metrics, Clock clock, Duration interval, int batchSize) {
        this.store = store;
        this.orchestrators = List.copyOf(orchestrators);
        this.metrics = metrics;
        this.clock = clock;
        this.interval = interval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
            r -> new Thread(r, "due-publish-sweeper")
        );
    }

    public void start() {
        long initialDelay = 10;
        long period = Math.max(1, interval.toSeconds());

        scheduler.scheduleAtFixedRate(
            this::runSweep,
            initialDelay,
            period,
            TimeUnit.SECONDS
        );

        log.info("[SWEEP] Due publish sweeper started: interval={}s, batchSize={}", period, batchSize);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SWEEP] Due publish sweeper stopped");
    }

    private void runSweep() {
        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("[SWEEP] Sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One pass over every enabled channel.
     *
     * @return number of successful publishes
     */
    public int sweepOnce() {
        Instant now = clock.instant();
        int published = 0;
        for (PublishOrchestrator orchestrator : orchestrators) {
            if (!orchestrator.isChannelEnabled()) {
                continue;
            }
            published += sweepChannel(orchestrator, now);
        }
        return published;
    }

    private int sweepChannel(PublishOrchestrator orchestrator, Instant now) {
        Channel channel = orchestrator.channel();
        List<LaunchPack> due = channel == Channel.TELEGRAM
            ? store.findDueTelegramPublishes(now, batchSize)
            : store.findDueXPublishes(now, batchSize);
        if (due.isEmpty()) {
            if (metrics != null) {
                metrics.recordSweep(channel.opsField(), 0, 0);
            }
            return 0;
        }

        log.info("[SWEEP] {} LaunchPack(s) due for {}", due.size(), channel.opsField());
        int published = 0;
        int failed = 0;
        for (LaunchPack pack : due) {
            try {
                orchestrator.publish(pack.id(), false);
                published++;
            } catch (LaunchKitException e) {
                if (e.getKind() == ErrorKind.CONFLICT || channel.code("NOT_READY").equals(e.getCode())) {
                    log.debug("[SWEEP] {} skipped for {}: {}", pack.id(), channel.opsField(), e.getCode());
                } else {
                    failed++;
                    log.warn("[SWEEP] {} failed for {}: {} {}", pack.id(), channel.opsField(), e.getCode(), e.getMessage());
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("[SWEEP] {} failed for {}: {}", pack.id(), channel.opsField(), e.getMessage(), e);
            }
        }
        if (metrics != null) {
            metrics.recordSweep(channel.opsField(), due.size(), failed);
        }
        return published;
    }
}
