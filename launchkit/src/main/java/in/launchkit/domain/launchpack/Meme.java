package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Meme(
    @JsonProperty("url") String url,
    @JsonProperty("caption") String caption
) {}
