package in.launchkit.infrastructure.metrics;

import java.time.Duration;

/**
 * Operational metrics for launches, publishes and their remote dependencies.
 *
 * Collaborators accept a null instance and skip recording.
 */
public interface LaunchKitMetrics {

    /**
     * @param outcome launched, failed, noop or rejected
     */
    void recordLaunch(String outcome, Duration latency);

    /**
     * @param channel telegram or x
     * @param outcome published, failed, noop or rejected
     */
    void recordPublish(String channel, String outcome, Duration latency);

    /**
     * A claim returned no-match.
     */
    void recordClaimRejected(String operation);

    /**
     * @param dependency e.g. pumpportal, pumpfun_ipfs, telegram, x, logo
     * @param status     HTTP status code as text, or "error" when no response arrived
     */
    void recordExternalCall(String dependency, String status);

    void recordSweep(String channel, int due, int failed);
}
