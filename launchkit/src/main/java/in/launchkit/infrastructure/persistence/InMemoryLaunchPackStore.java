package in.launchkit.infrastructure.persistence;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.Channel;
import in.launchkit.domain.launchpack.LaunchClaim;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackInput;
import in.launchkit.domain.launchpack.LaunchPackMutations;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.LaunchStatus;
import in.launchkit.domain.launchpack.PublishClaim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process LaunchPack store.
 *
 * A single lock guards the whole map, so every check-and-set runs as one critical section.
 */
public final class InMemoryLaunchPackStore implements LaunchPackStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLaunchPackStore.class);

    private final Map<String, LaunchPack> packs = new HashMap<>();
    private final Map<String, String> idsByIdempotencyKey = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryLaunchPackStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLaunchPackStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LaunchPack create(LaunchPackInput input) {
        lock.lock();
        try {
            String key = input.idempotencyKey();
            if (key != null && idsByIdempotencyKey.containsKey(key)) {
                LaunchPack existing = packs.get(idsByIdempotencyKey.get(key));
                log.info("[STORE] Idempotent create hit: key matched {}", existing.id());
                return existing;
            }
            LaunchPack pack = LaunchPackMutations.create(input, UUID.randomUUID().toString(), clock.instant());
            packs.put(pack.id(), pack);
            if (key != null) {
                idsByIdempotencyKey.put(key, pack.id());
            }
            log.info("[STORE] Created LaunchPack {} ({})", pack.id(), pack.brand().ticker());
            return pack;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LaunchPack> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(packs.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public LaunchPack update(String id, LaunchPackPatch patch) {
        lock.lock();
        try {
            LaunchPack current = packs.get(id);
            if (current == null) {
                throw LaunchKitException.notFound(id);
            }
            LaunchPack next = LaunchPackMutations.applyPatch(current, patch, clock.instant());
            packs.put(id, next);
            log.debug("[STORE] Updated LaunchPack {} to version {}", id, next.version());
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LaunchPack> claimLaunch(String id, LaunchClaim claim) {
        lock.lock();
        try {
            LaunchPack current = packs.get(id);
            if (current == null || !LaunchPackMutations.canClaimLaunch(current)) {
                return Optional.empty();
            }
            LaunchPack claimed = LaunchPackMutations.claimLaunch(current, claim, clock.instant());
            packs.put(id, claimed);
            return Optional.of(claimed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LaunchPack> claimTelegramPublish(String id, PublishClaim claim) {
        return claimPublish(id, Channel.TELEGRAM, claim);
    }

    @Override
    public Optional<LaunchPack> claimXPublish(String id, PublishClaim claim) {
        return claimPublish(id, Channel.X, claim);
    }

    private Optional<LaunchPack> claimPublish(String id, Channel channel, PublishClaim claim) {
        lock.lock();
        try {
            LaunchPack current = packs.get(id);
            if (current == null || !LaunchPackMutations.canClaimPublish(current.publishState(channel), claim)) {
                return Optional.empty();
            }
            LaunchPack claimed = LaunchPackMutations.claimPublish(current, channel, claim, clock.instant());
            packs.put(id, claimed);
            return Optional.of(claimed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<LaunchPack> findDueTelegramPublishes(Instant now, int limit) {
        return findDue(Channel.TELEGRAM, now, limit);
    }

    @Override
    public List<LaunchPack> findDueXPublishes(Instant now, int limit) {
        return findDue(Channel.X, now, limit);
    }

    private List<LaunchPack> findDue(Channel channel, Instant now, int limit) {
        lock.lock();
        try {
            return packs.values().stream()
                .filter(p -> LaunchPackMutations.isPublishDue(p, channel, now))
                .sorted(Comparator.comparing(LaunchPack::updatedAt))
                .limit(Math.max(limit, 0))
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int countLaunchedSince(Instant since) {
        lock.lock();
        try {
            return (int) packs.values().stream()
                .filter(p -> p.launch().status() == LaunchStatus.LAUNCHED)
                .filter(p -> p.launch().launchedAt() != null && !p.launch().launchedAt().isBefore(since))
                .count();
        } finally {
            lock.unlock();
        }
    }
}
