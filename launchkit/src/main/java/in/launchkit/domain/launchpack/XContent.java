package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record XContent(
    @JsonProperty("main_post") String mainPost,
    @JsonProperty("thread") List<String> thread,
    @JsonProperty("reply_bank") List<String> replyBank,
    @JsonProperty("schedule") List<ScheduleItem> schedule
) {
    public XContent {
        mainPost = mainPost == null ? "" : mainPost;
        thread = thread == null ? List.of() : List.copyOf(thread);
        replyBank = replyBank == null ? List.of() : List.copyOf(replyBank);
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
    }

    public static XContent empty() {
        return new XContent("", List.of(), List.of(), List.of());
    }
}
