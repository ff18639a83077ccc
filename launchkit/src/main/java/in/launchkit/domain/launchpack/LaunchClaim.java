package in.launchkit.domain.launchpack;

import java.time.Instant;

/**
 * Request to take the launch slot.
 */
public record LaunchClaim(Instant requestedAt, LaunchStatus status) {
    public static LaunchClaim ready(Instant requestedAt) {
        return new LaunchClaim(requestedAt, LaunchStatus.READY);
    }
}
