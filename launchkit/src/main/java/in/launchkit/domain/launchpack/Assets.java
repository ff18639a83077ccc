package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Assets(
    @JsonProperty("logo_url") String logoUrl,
    @JsonProperty("banner_url") String bannerUrl,
    @JsonProperty("memes") List<Meme> memes
) {
    public Assets {
        memes = memes == null ? List.of() : List.copyOf(memes);
    }

    public static Assets empty() {
        return new Assets(null, null, List.of());
    }
}
