package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Links(
    @JsonProperty("telegram") String telegram,
    @JsonProperty("x") String x,
    @JsonProperty("website") String website
) {
    public static Links empty() {
        return new Links(null, null, null);
    }
}
