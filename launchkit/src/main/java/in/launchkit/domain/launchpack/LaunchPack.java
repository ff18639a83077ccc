package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The LaunchPack aggregate: campaign copy, launch request and per-channel publish state.
 *
 * Immutable. Every persisted mutation produces a new instance with {@code version} + 1.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LaunchPack(
    @JsonProperty("id") String id,
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("version") int version,
    @JsonProperty("brand") Brand brand,
    @JsonProperty("links") Links links,
    @JsonProperty("assets") Assets assets,
    @JsonProperty("tg") TelegramContent tg,
    @JsonProperty("x") XContent x,
    @JsonProperty("launch") LaunchState launch,
    @JsonProperty("ops") Ops ops,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {
    public LaunchPack {
        links = links == null ? Links.empty() : links;
        assets = assets == null ? Assets.empty() : assets;
        tg = tg == null ? TelegramContent.empty() : tg;
        x = x == null ? XContent.empty() : x;
        launch = launch == null ? LaunchState.draft() : launch;
        ops = ops == null ? Ops.empty() : ops;
    }

    public ChannelPublishState publishState(Channel channel) {
        return ops.publishState(channel);
    }

    /**
     * Schedule configured for a channel's content.
     */
    public List<ScheduleItem> schedule(Channel channel) {
        return channel == Channel.TELEGRAM ? tg.schedule() : x.schedule();
    }
}
