package in.launchkit.domain.launchpack;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TelegramPins(
    @JsonProperty("welcome") String welcome,
    @JsonProperty("how_to_buy") String howToBuy,
    @JsonProperty("memekit") String memekit
) {
    public TelegramPins {
        welcome = welcome == null ? "" : welcome;
        howToBuy = howToBuy == null ? "" : howToBuy;
        memekit = memekit == null ? "" : memekit;
    }

    public static TelegramPins empty() {
        return new TelegramPins("", "", "");
    }
}
