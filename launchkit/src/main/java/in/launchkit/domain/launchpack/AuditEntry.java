package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AuditEntry(
    @JsonProperty("at") Instant at,
    @JsonProperty("message") String message,
    @JsonProperty("actor") String actor
) {
    public static final String DEFAULT_ACTOR = "launchkit";

    public AuditEntry {
        actor = actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
    }

    public static AuditEntry of(Instant at, String message) {
        return new AuditEntry(at, message, DEFAULT_ACTOR);
    }
}
