package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Creation payload. Everything a caller may supply; id, version and timestamps are assigned by the store.
 */
public record LaunchPackInput(
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("brand") Brand brand,
    @JsonProperty("links") Links links,
    @JsonProperty("assets") Assets assets,
    @JsonProperty("tg") TelegramContent tg,
    @JsonProperty("x") XContent x,
    @JsonProperty("launch") LaunchState launch,
    @JsonProperty("ops") Ops ops
) {
    public static LaunchPackInput of(Brand brand) {
        return new LaunchPackInput(null, brand, null, null, null, null, null, null);
    }

    public LaunchPackInput withIdempotencyKey(String key) {
        return new LaunchPackInput(key, brand, links, assets, tg, x, launch, ops);
    }
}
