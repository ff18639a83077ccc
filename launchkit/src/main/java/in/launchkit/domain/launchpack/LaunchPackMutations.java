package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.launchkit.domain.common.LaunchKitException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State transitions shared by every LaunchPack store.
 *
 * Stores call these under their own atomicity (a lock, a row lock or a conditional UPDATE);
 * the functions themselves are pure.
 */
public final class LaunchPackMutations {

    /** Window after a failure during which unforced retries are refused. */
    public static final Duration RETRY_COOLDOWN = Duration.ofMinutes(10);

    private static final Set<String> IMMUTABLE_FIELDS = Set.of("id", "idempotency_key", "version", "created_at", "updated_at");

    public static LaunchPack create(LaunchPackInput input, String id, Instant now) {
        LaunchPack pack = new LaunchPack(id, input.idempotencyKey(), 1, input.brand(), input.links(),
            input.assets(), input.tg(), input.x(), input.launch(), input.ops(), now, now);
        return LaunchPackValidator.normalizeAndValidate(pack);
    }

    /**
     * Deep-merge a patch into the current record, append audit entries, bump the version.
     *
     * @throws LaunchKitException VALIDATION_ERROR for schema violations or immutable fields,
     *                            INVALID_TRANSITION when a status would leave a terminal state
     *                            or skip the transition graph
     */
    public static LaunchPack applyPatch(LaunchPack current, LaunchPackPatch patch, Instant now) {
        ObjectNode changes = patch.changes();
        for (String field : IMMUTABLE_FIELDS) {
            if (changes.has(field)) {
                throw LaunchKitException.validation("VALIDATION_ERROR", "Field cannot be patched: " + field,
                    Map.of("errors", List.of(field + ": immutable")));
            }
        }

        JsonNode merged = JsonMerge.merge(LaunchPackJson.toTree(current), changes);
        LaunchPack next = LaunchPackJson.fromTree(merged);

        List<AuditEntry> audit = next.ops().auditLog();
        if (!isPrefix(current.ops().auditLog(), audit)) {
            throw LaunchKitException.validation("AUDIT_LOG_APPEND_ONLY",
                "Audit log entries cannot be removed or rewritten",
                Map.of("errors", List.of("ops.audit_log: append-only")));
        }
        if (!patch.auditAppends().isEmpty()) {
            audit = new ArrayList<>(audit);
            audit.addAll(patch.auditAppends());
        }

        checkLaunchTransition(current.launch().status(), next.launch().status());
        for (Channel channel : Channel.values()) {
            checkPublishTransition(channel, current.publishState(channel).status(), next.publishState(channel).status());
        }

        Ops ops = new Ops(next.ops().checklist(), audit, next.ops().tgPublish(), next.ops().xPublish());
        LaunchPack bumped = new LaunchPack(current.id(), next.idempotencyKey(), current.version() + 1,
            next.brand(), next.links(), next.assets(), next.tg(), next.x(), next.launch(), ops,
            current.createdAt(), now);
        return LaunchPackValidator.normalizeAndValidate(bumped);
    }

    /**
     * Launch slot is free when not launched and either never requested or previously failed.
     */
    public static boolean canClaimLaunch(LaunchPack current) {
        LaunchState launch = current.launch();
        return launch.status() != LaunchStatus.LAUNCHED
            && (launch.requestedAt() == null || launch.status() == LaunchStatus.FAILED);
    }

    public static LaunchPack claimLaunch(LaunchPack current, LaunchClaim claim, Instant now) {
        LaunchState l = current.launch();
        LaunchState claimed = new LaunchState(claim.status(), claim.requestedAt(), l.completedAt(), l.launchedAt(),
            l.failedAt(), l.mint(), l.txSignature(), l.pumpUrl(), l.errorCode(), l.errorMessage());
        return withLaunch(current, claimed, now);
    }

    /**
     * Publish slot is free when idle, or failed and either forced or past the cooldown.
     * A failure without a recorded timestamp counts as long past.
     */
    public static boolean canClaimPublish(ChannelPublishState state, PublishClaim claim) {
        if (state.status() == PublishStatus.IDLE) {
            return true;
        }
        if (state.status() != PublishStatus.FAILED) {
            return false;
        }
        if (claim.force()) {
            return true;
        }
        Instant failedAt = state.failedAt() == null ? Instant.EPOCH : state.failedAt();
        return !failedAt.isAfter(claim.requestedAt().minus(RETRY_COOLDOWN));
    }

    public static LaunchPack claimPublish(LaunchPack current, Channel channel, PublishClaim claim, Instant now) {
        ChannelPublishState s = current.publishState(channel);
        ChannelPublishState claimed = new ChannelPublishState(PublishStatus.IN_PROGRESS, claim.requestedAt(),
            null, s.publishedAt(), null, null, s.resultIds(), s.scheduleIntent());
        return withPublishState(current, channel, claimed, now);
    }

    /**
     * Due when the channel is neither running nor done and any scheduled entry has come due.
     * The recorded schedule intent takes precedence over the configured schedule.
     */
    public static boolean isPublishDue(LaunchPack pack, Channel channel, Instant now) {
        ChannelPublishState state = pack.publishState(channel);
        if (state.status() == PublishStatus.IN_PROGRESS || state.status() == PublishStatus.PUBLISHED) {
            return false;
        }
        List<ScheduleItem> schedule = state.scheduleIntent().isEmpty() ? pack.schedule(channel) : state.scheduleIntent();
        for (ScheduleItem item : schedule) {
            if (item.isDue(now)) {
                return true;
            }
        }
        return false;
    }

    public static void checkLaunchTransition(LaunchStatus from, LaunchStatus to) {
        if (!from.canMoveTo(to)) {
            throw LaunchKitException.conflict("INVALID_TRANSITION",
                "launch.status cannot move from " + from.wire() + " to " + to.wire());
        }
    }

    public static void checkPublishTransition(Channel channel, PublishStatus from, PublishStatus to) {
        if (!from.canMoveTo(to)) {
            throw LaunchKitException.conflict("INVALID_TRANSITION",
                "ops." + channel.opsField() + ".status cannot move from " + from.wire() + " to " + to.wire());
        }
    }

    private static boolean isPrefix(List<AuditEntry> prefix, List<AuditEntry> list) {
        if (prefix.size() > list.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!prefix.get(i).equals(list.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static LaunchPack withLaunch(LaunchPack p, LaunchState launch, Instant now) {
        return new LaunchPack(p.id(), p.idempotencyKey(), p.version() + 1, p.brand(), p.links(), p.assets(),
            p.tg(), p.x(), launch, p.ops(), p.createdAt(), now);
    }

    private static LaunchPack withPublishState(LaunchPack p, Channel channel, ChannelPublishState state, Instant now) {
        Ops o = p.ops();
        Ops ops = channel == Channel.TELEGRAM
            ? new Ops(o.checklist(), o.auditLog(), state, o.xPublish())
            : new Ops(o.checklist(), o.auditLog(), o.tgPublish(), state);
        return new LaunchPack(p.id(), p.idempotencyKey(), p.version() + 1, p.brand(), p.links(), p.assets(),
            p.tg(), p.x(), p.launch(), ops, p.createdAt(), now);
    }

    private LaunchPackMutations() {}
}
