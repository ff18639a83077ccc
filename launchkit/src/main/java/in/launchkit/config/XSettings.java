package in.launchkit.config;

import java.util.ArrayList;
import java.util.List;

public record XSettings(boolean enabled, String apiKey, String apiSecret, String accessToken, String accessSecret) {

    public static XSettings disabled() {
        return new XSettings(false, null, null, null, null);
    }

    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (apiKey == null || apiKey.isBlank()) missing.add("X_API_KEY");
        if (apiSecret == null || apiSecret.isBlank()) missing.add("X_API_SECRET");
        if (accessToken == null || accessToken.isBlank()) missing.add("X_ACCESS_TOKEN");
        if (accessSecret == null || accessSecret.isBlank()) missing.add("X_ACCESS_SECRET");
        return missing;
    }

    @Override
    public String toString() {
        return "XSettings[enabled=" + enabled + ", credentials=" + (missingKeys().isEmpty() ? "set" : "incomplete") + "]";
    }
}
