package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.AuditEntry;
import in.launchkit.domain.launchpack.Channel;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.PublishClaim;
import in.launchkit.domain.launchpack.PublishStatus;
import in.launchkit.domain.launchpack.ScheduleItem;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import in.launchkit.security.SecureAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Claim-guarded publish of one channel's content.
 *
 * Subclasses supply configuration checks and the ordered remote sequence; this class owns the
 * claim, the terminal state write and the schedule-intent snapshot.
 */
public abstract class PublishOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PublishOrchestrator.class);

    protected final LaunchPackStore store;
    protected final Channel channel;
    protected final LaunchKitMetrics metrics;
    protected final Clock clock;
    private final SecureAuditLogger audit;

    protected PublishOrchestrator(LaunchPackStore store, Channel channel, LaunchKitMetrics metrics, Clock clock) {
        this.store = store;
        this.channel = channel;
        this.metrics = metrics;
        this.clock = clock;
        this.audit = new SecureAuditLogger(logPrefix());
    }

    public LaunchPack publish(String id, boolean force) {
        Instant start = clock.instant();
        LaunchPack existing;
        try {
            checkConfigured();
            existing = store.get(id).orElseThrow(() -> LaunchKitException.notFound(id));
            if (!existing.ops().checked(readinessItem())) {
                throw LaunchKitException.validation(channel.code("NOT_READY"),
                    displayName() + " copy not marked ready", Map.of("checklist", readinessItem()));
            }
        } catch (LaunchKitException e) {
            log.warn("[{}] {} rejected: {} {}", logPrefix(), id, e.getCode(), e.getMessage());
            record("rejected", start);
            throw e;
        }

        if (existing.publishState(channel).status() == PublishStatus.PUBLISHED && !force) {
            log.info("[{}] {} already published, returning recorded ids", logPrefix(), id);
            record("noop", start);
            return existing;
        }

        Optional<LaunchPack> claim = claim(id, new PublishClaim(clock.instant(), force));
        if (claim.isEmpty()) {
            if (metrics != null) {
                metrics.recordClaimRejected(channel.opsField());
            }
            record("rejected", start);
            throw LaunchKitException.conflict(channel.code("PUBLISH_IN_PROGRESS"), displayName() + " publish in progress");
        }
        LaunchPack claimed = claim.get();
        log.info("[{}] Claimed publish slot for {}", logPrefix(), id);

        try {
            List<String> ids = execute(claimed);

            Instant done = clock.instant();
            String field = "ops." + channel.opsField();
            LaunchPackPatch patch = LaunchPackPatch.empty()
                .set(field + ".status", PublishStatus.PUBLISHED)
                .set(field + ".published_at", done)
                .set(field + ".result_ids", ids)
                .set(field + ".schedule_intent", normalizeSchedule(claimed.schedule(channel)))
                .set(field + ".error_code", null)
                .set(field + ".error_message", null)
                .checklist(publishedItem(), true)
                .appendAudit(AuditEntry.of(done, displayName() + " publish complete"));
            LaunchPack saved = store.update(id, patch);

            log.info("[{}] {} published {} item(s)", logPrefix(), id, ids.size());
            record("published", start);
            return saved;

        } catch (RuntimeException | Error e) {
            recordFailure(id, e);
            record("failed", start);
            throw e;
        }
    }

    /**
     * Whether this channel's feature flag is on. Credentials are not checked.
     */
    public abstract boolean isChannelEnabled();

    public Channel channel() {
        return channel;
    }

    /**
     * @throws LaunchKitException {@code *_DISABLED} or {@code *_CONFIG_MISSING} with every missing key
     */
    protected abstract void checkConfigured();

    /**
     * Run the remote sequence in order. Any exception aborts the whole publish.
     *
     * @return remote ids in send order
     */
    protected abstract List<String> execute(LaunchPack claimed);

    protected abstract Optional<LaunchPack> claim(String id, PublishClaim claim);

    protected abstract String displayName();

    protected abstract String logPrefix();

    protected void checkCredentials(boolean enabled, List<String> missingKeys) {
        if (!enabled) {
            throw LaunchKitException.disabled(channel.code("DISABLED"), displayName() + " publishing disabled");
        }
        if (!missingKeys.isEmpty()) {
            throw LaunchKitException.configMissing(channel.code("CONFIG_MISSING"), missingKeys);
        }
    }

    private String readinessItem() {
        return channel.contentField() + "_ready";
    }

    private String publishedItem() {
        return channel.contentField() + "_published";
    }

    /**
     * Schedule snapshot with timestamps truncated to milliseconds, the canonical UTC form.
     */
    static List<ScheduleItem> normalizeSchedule(List<ScheduleItem> schedule) {
        List<ScheduleItem> normalized = new ArrayList<>(schedule.size());
        for (ScheduleItem item : schedule) {
            Instant when = item.when() == null ? null : item.when().truncatedTo(ChronoUnit.MILLIS);
            normalized.add(new ScheduleItem(when, item.text(), item.mediaUrl()));
        }
        return normalized;
    }

    private void recordFailure(String id, Throwable error) {
        String code = error instanceof LaunchKitException
            ? ((LaunchKitException) error).getCode()
            : channel.code("PUBLISH_FAILED");
        Map<String, Object> details = error instanceof LaunchKitException
            ? ((LaunchKitException) error).getDetails()
            : Map.of();
        String message = audit.sanitize(String.valueOf(error.getMessage()));
        audit.logError("publish " + id, code, message, details);

        Instant failedAt = clock.instant();
        String field = "ops." + channel.opsField();
        LaunchPackPatch patch = LaunchPackPatch.empty()
            .set(field + ".status", PublishStatus.FAILED)
            .set(field + ".failed_at", failedAt)
            .set(field + ".error_code", code)
            .set(field + ".error_message", message)
            .appendAudit(AuditEntry.of(failedAt, displayName() + " publish failed: " + message));
        try {
            store.update(id, patch);
        } catch (RuntimeException updateError) {
            log.error("[{}] Could not persist failure for {}: {}", logPrefix(), id, updateError.getMessage(), updateError);
            error.addSuppressed(updateError);
        }
    }

    private void record(String outcome, Instant start) {
        if (metrics != null) {
            metrics.recordPublish(channel == Channel.TELEGRAM ? "telegram" : "x", outcome,
                Duration.between(start, clock.instant()));
        }
    }
}
