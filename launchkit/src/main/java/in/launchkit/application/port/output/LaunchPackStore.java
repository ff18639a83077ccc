package in.launchkit.application.port.output;

import in.launchkit.domain.launchpack.LaunchClaim;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackInput;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.PublishClaim;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Store for LaunchPack aggregates.
 *
 * The store is the only writer of LaunchPack records. The claim operations are atomic
 * check-and-set transitions: for one id and one operation kind, at most one concurrent caller
 * wins and the rest get {@link Optional#empty()} without any write taking place.
 * Every successful mutation (update or claim) increments {@code version} by exactly one.
 */
public interface LaunchPackStore {

    /**
     * Create a LaunchPack. If the input carries an idempotency key that already exists,
     * the existing record is returned unchanged.
     *
     * @throws in.launchkit.domain.common.LaunchKitException VALIDATION_ERROR on schema violation
     */
    LaunchPack create(LaunchPackInput input);

    Optional<LaunchPack> get(String id);

    /**
     * Deep-merge a patch into an existing record. Always succeeds for an existing id,
     * subject to validation and the status transition graph.
     *
     * @throws in.launchkit.domain.common.LaunchKitException NOT_FOUND if absent
     */
    LaunchPack update(String id, LaunchPackPatch patch);

    /**
     * Take the launch slot: succeeds only if not launched and either never requested or failed.
     */
    Optional<LaunchPack> claimLaunch(String id, LaunchClaim claim);

    /**
     * Take the Telegram publish slot: succeeds only from idle, or from failed when forced
     * or past the retry cooldown. Sets in_progress and attempted_at, clears error fields.
     */
    Optional<LaunchPack> claimTelegramPublish(String id, PublishClaim claim);

    /**
     * Take the X publish slot. Same predicate as {@link #claimTelegramPublish}.
     */
    Optional<LaunchPack> claimXPublish(String id, PublishClaim claim);

    /**
     * LaunchPacks with a Telegram schedule entry due at {@code now}, oldest update first.
     */
    List<LaunchPack> findDueTelegramPublishes(Instant now, int limit);

    List<LaunchPack> findDueXPublishes(Instant now, int limit);

    /**
     * Number of LaunchPacks that reached launched at or after {@code since}.
     */
    int countLaunchedSince(Instant since);
}
