package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Brand(
    @JsonProperty("name") String name,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("tagline") String tagline,
    @JsonProperty("description") String description,
    @JsonProperty("lore") String lore
) {
    public Brand {
        tagline = tagline == null ? "" : tagline;
        description = description == null ? "" : description;
        lore = lore == null ? "" : lore;
    }
}
