package in.launchkit.domain.launchpack;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builders for LaunchPack inputs used across tests.
 */
public final class LaunchPackFixtures {

    public static LaunchPackInput input(String name, String ticker) {
        return LaunchPackInput.of(new Brand(name, ticker, "to the moon", "A dog with a crown", null));
    }

    public static LaunchPackInput withPins(String welcome, String howToBuy, String memekit) {
        return new LaunchPackInput(null,
            new Brand("King Dog", "king", "royal", "A dog with a crown", null),
            new Links("https://t.me/kingdog", "https://x.com/kingdog", "https://kingdog.io"),
            new Assets("https://cdn.example.com/logo.png", null, List.of()),
            new TelegramContent(null, new TelegramPins(welcome, howToBuy, memekit), List.of()),
            null, null, readyChecklist());
    }

    public static LaunchPackInput withThread(String mainPost, List<String> thread) {
        return new LaunchPackInput(null,
            new Brand("King Dog", "king", "royal", "A dog with a crown", null),
            null, null, null,
            new XContent(mainPost, thread, List.of(), List.of()),
            null, readyChecklist());
    }

    public static LaunchPackInput withTelegramSchedule(Instant... when) {
        List<ScheduleItem> schedule = new ArrayList<>();
        for (int i = 0; i < when.length; i++) {
            schedule.add(new ScheduleItem(when[i], "post " + (i + 1), null));
        }
        return new LaunchPackInput(null,
            new Brand("King Dog", "king", null, null, null),
            null, null,
            new TelegramContent(null, new TelegramPins("welcome", "", ""), schedule),
            null, null, readyChecklist());
    }

    public static LaunchPackInput launchable(String logoUrl) {
        return new LaunchPackInput(null,
            new Brand("King Dog", "king", "royal", "", null),
            new Links("https://t.me/kingdog", "https://x.com/kingdog", null),
            new Assets(logoUrl, null, List.of()),
            null, null, null, null);
    }

    private static Ops readyChecklist() {
        return new Ops(Map.of("tg_ready", true, "x_ready", true), List.of(), null, null);
    }

    private LaunchPackFixtures() {}
}
