package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One future-dated posting intent.
 *
 * Timestamps are accepted with any ISO-8601 offset and held as UTC instants.
 */
public record ScheduleItem(
    @JsonProperty("when") Instant when,
    @JsonProperty("text") String text,
    @JsonProperty("media_url") String mediaUrl
) {
    public boolean isDue(Instant now) {
        return when != null && !when.isAfter(now);
    }
}
