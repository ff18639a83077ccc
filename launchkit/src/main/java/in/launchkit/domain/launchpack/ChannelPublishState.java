package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Publish state machine of one channel.
 *
 * @param resultIds     message or post ids in send order
 * @param scheduleIntent normalized schedule snapshot taken at publish time
 */
public record ChannelPublishState(
    @JsonProperty("status") PublishStatus status,
    @JsonProperty("attempted_at") Instant attemptedAt,
    @JsonProperty("failed_at") Instant failedAt,
    @JsonProperty("published_at") Instant publishedAt,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("result_ids") List<String> resultIds,
    @JsonProperty("schedule_intent") List<ScheduleItem> scheduleIntent
) {
    public ChannelPublishState {
        status = status == null ? PublishStatus.IDLE : status;
        resultIds = resultIds == null ? List.of() : List.copyOf(resultIds);
        scheduleIntent = scheduleIntent == null ? List.of() : List.copyOf(scheduleIntent);
    }

    public static ChannelPublishState idle() {
        return new ChannelPublishState(PublishStatus.IDLE, null, null, null, null, null, List.of(), List.of());
    }
}
