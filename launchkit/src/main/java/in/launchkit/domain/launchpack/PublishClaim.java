package in.launchkit.domain.launchpack;

import java.time.Instant;

/**
 * Request to take a channel's publish slot.
 *
 * @param force bypass the failed-retry cooldown (never bypasses published or in_progress)
 */
public record PublishClaim(Instant requestedAt, boolean force) {}
