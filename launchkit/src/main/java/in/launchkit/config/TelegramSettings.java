package in.launchkit.config;

import java.util.ArrayList;
import java.util.List;

public record TelegramSettings(boolean enabled, String botToken, String chatId) {

    public static TelegramSettings disabled() {
        return new TelegramSettings(false, null, null);
    }

    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (botToken == null || botToken.isBlank()) missing.add("TG_BOT_TOKEN");
        if (chatId == null || chatId.isBlank()) missing.add("TG_CHAT_ID");
        return missing;
    }

    @Override
    public String toString() {
        return "TelegramSettings[enabled=" + enabled + ", botToken=" + (botToken == null ? "unset" : "****")
            + ", chatId=" + (chatId == null ? "unset" : "****") + "]";
    }
}
