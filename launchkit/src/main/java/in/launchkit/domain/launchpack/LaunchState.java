package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LaunchState(
    @JsonProperty("status") LaunchStatus status,
    @JsonProperty("requested_at") Instant requestedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("launched_at") Instant launchedAt,
    @JsonProperty("failed_at") Instant failedAt,
    @JsonProperty("mint") String mint,
    @JsonProperty("tx_signature") String txSignature,
    @JsonProperty("pump_url") String pumpUrl,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("error_message") String errorMessage
) {
    public LaunchState {
        status = status == null ? LaunchStatus.DRAFT : status;
    }

    public static LaunchState draft() {
        return new LaunchState(LaunchStatus.DRAFT, null, null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isLaunched() {
        return status == LaunchStatus.LAUNCHED;
    }
}
