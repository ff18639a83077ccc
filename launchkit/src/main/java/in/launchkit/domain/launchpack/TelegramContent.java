package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TelegramContent(
    @JsonProperty("chat_id") String chatId,
    @JsonProperty("pins") TelegramPins pins,
    @JsonProperty("schedule") List<ScheduleItem> schedule
) {
    public TelegramContent {
        pins = pins == null ? TelegramPins.empty() : pins;
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
    }

    public static TelegramContent empty() {
        return new TelegramContent(null, TelegramPins.empty(), List.of());
    }
}
