package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.application.port.output.TextGenerator;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.AuditEntry;
import in.launchkit.domain.launchpack.Brand;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.ScheduleItem;
import in.launchkit.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates Telegram pins, X copy and posting schedules for a LaunchPack.
 *
 * Each piece of copy comes from the {@link TextGenerator}; a blank answer or a generator failure
 * falls back to a deterministic placeholder so the pack always ends up with usable copy.
 */
public final class CopyGeneratorService {
    private static final Logger log = LoggerFactory.getLogger(CopyGeneratorService.class);

    static final int THREAD_PARTS = 5;
    static final int REPLY_COUNT = 10;
    static final int TG_SCHEDULE_ENTRIES = 6;
    static final Duration TG_SCHEDULE_STEP = Duration.ofHours(4);
    static final int X_SCHEDULE_ENTRIES = 4;
    static final Duration X_SCHEDULE_STEP = Duration.ofHours(6);

    private final LaunchPackStore store;
    private final TextGenerator generator;
    private final Clock clock;

    /**
     * @param generator may be null; every piece then uses its placeholder
     */
    public CopyGeneratorService(LaunchPackStore store, TextGenerator generator, Clock clock) {
        this.store = store;
        this.generator = generator;
        this.clock = clock;
    }

    public LaunchPack generate(String id, String theme, List<String> keywords, String tone) {
        LaunchPack existing = store.get(id).orElseThrow(() -> LaunchKitException.notFound(id));
        List<String> kw = keywords == null ? List.of() : keywords;

        Brand brand = existing.brand();
        String basePrompt = "Generate meme token launch comms. Brand: " + brand.name() + " (" + brand.ticker() + "). "
            + "Theme: " + (isBlank(theme) ? "memes" : theme) + ". Keywords: " + String.join(", ", kw);

        String welcome = ask(basePrompt + "\nWelcome pin copy. Tone: " + toneOr(tone, "fun, crisp"),
            fallback("Welcome to the launch", theme, kw, tone));
        String howToBuy = ask(basePrompt + "\nHow to buy instructions (short). Tone: " + toneOr(tone, "direct"),
            fallback("How to buy: step-by-step", theme, kw, tone));
        String memekit = ask(basePrompt + "\nMemekit pin. Tone: " + toneOr(tone, "playful"),
            fallback("Memekit instructions", theme, kw, tone));

        String mainPost = ask(basePrompt + "\nMain announcement tweet. Tone: " + toneOr(tone, "hype"),
            fallback("Main announcement", theme, kw, tone));
        List<String> thread = new ArrayList<>();
        for (int i = 1; i <= THREAD_PARTS; i++) {
            thread.add(ask(basePrompt + "\nThread part " + i + "/" + THREAD_PARTS + ". Tone: " + toneOr(tone, "story"),
                fallback("Thread part " + i, theme, kw, tone)));
        }
        List<String> replies = new ArrayList<>();
        for (int i = 1; i <= REPLY_COUNT; i++) {
            replies.add(ask(basePrompt + "\nShort reply " + i + "/" + REPLY_COUNT + ". Tone: " + toneOr(tone, "witty one-liner"),
                fallback("Reply " + i, theme, kw, tone)));
        }

        Instant now = clock.instant();
        Instant start = Timestamps.nextTenMinuteBoundary(now);
        LaunchPackPatch patch = LaunchPackPatch.empty()
            .set("tg.pins.welcome", welcome)
            .set("tg.pins.how_to_buy", howToBuy)
            .set("tg.pins.memekit", memekit)
            .set("tg.schedule", schedule(start, TG_SCHEDULE_ENTRIES, TG_SCHEDULE_STEP, "TG",
                fallback("TG post", theme, kw, tone)))
            .set("x.main_post", mainPost)
            .set("x.thread", thread)
            .set("x.reply_bank", replies)
            .set("x.schedule", schedule(start, X_SCHEDULE_ENTRIES, X_SCHEDULE_STEP, "X",
                fallback("X post", theme, kw, tone)))
            .checklist("copy_ready", true)
            .checklist("tg_ready", true)
            .checklist("x_ready", true)
            .appendAudit(AuditEntry.of(now, "Generated launch copy"));

        LaunchPack saved = store.update(id, patch);
        log.info("[COPY] Generated copy for {} ({})", id, brand.ticker());
        return saved;
    }

    static String fallback(String prefix, String theme, List<String> keywords, String tone) {
        StringBuilder sb = new StringBuilder(prefix);
        if (!isBlank(theme)) sb.append(" | theme: ").append(theme);
        if (keywords != null && !keywords.isEmpty()) sb.append(" | keywords: ").append(String.join(", ", keywords));
        if (!isBlank(tone)) sb.append(" | tone: ").append(tone);
        return sb.toString();
    }

    private String ask(String prompt, String fallback) {
        if (generator == null) {
            return fallback;
        }
        try {
            String answer = generator.generate(prompt);
            return isBlank(answer) ? fallback : answer.trim();
        } catch (RuntimeException e) {
            log.warn("[COPY] Text generation failed, using placeholder: {}", e.getMessage());
            return fallback;
        }
    }

    private static List<ScheduleItem> schedule(Instant start, int count, Duration step, String prefix, String base) {
        List<ScheduleItem> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(new ScheduleItem(start.plus(step.multipliedBy(i)), prefix + " #" + (i + 1) + " " + base, null));
        }
        return items;
    }

    private static String toneOr(String tone, String defaultTone) {
        return isBlank(tone) ? defaultTone : tone;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
