package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Ops(
    @JsonProperty("checklist") Map<String, Boolean> checklist,
    @JsonProperty("audit_log") List<AuditEntry> auditLog,
    @JsonProperty("tg_publish") ChannelPublishState tgPublish,
    @JsonProperty("x_publish") ChannelPublishState xPublish
) {
    public Ops {
        checklist = checklist == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checklist));
        auditLog = auditLog == null ? List.of() : List.copyOf(auditLog);
        tgPublish = tgPublish == null ? ChannelPublishState.idle() : tgPublish;
        xPublish = xPublish == null ? ChannelPublishState.idle() : xPublish;
    }

    public static Ops empty() {
        return new Ops(Map.of(), List.of(), ChannelPublishState.idle(), ChannelPublishState.idle());
    }

    public boolean checked(String item) {
        return Boolean.TRUE.equals(checklist.get(item));
    }

    public ChannelPublishState publishState(Channel channel) {
        return channel == Channel.TELEGRAM ? tgPublish : xPublish;
    }
}
