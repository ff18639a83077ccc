package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.application.port.output.TelegramGateway;
import in.launchkit.config.TelegramSettings;
import in.launchkit.domain.launchpack.Channel;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.PublishClaim;
import in.launchkit.domain.launchpack.TelegramPins;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sends and pins the welcome, how-to-buy and meme-kit messages, in that order.
 *
 * Blank pins are skipped. The pack's own chat id overrides the configured one.
 */
public final class TelegramPublishOrchestrator extends PublishOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TelegramPublishOrchestrator.class);

    private final TelegramSettings settings;
    private final TelegramGateway gateway;

    public TelegramPublishOrchestrator(LaunchPackStore store, TelegramSettings settings, TelegramGateway gateway,
                                       LaunchKitMetrics metrics, Clock clock) {
        super(store, Channel.TELEGRAM, metrics, clock);
        this.settings = settings;
        this.gateway = gateway;
    }

    @Override
    public boolean isChannelEnabled() {
        return settings.enabled();
    }

    @Override
    protected void checkConfigured() {
        checkCredentials(settings.enabled(), settings.missingKeys());
    }

    @Override
    protected List<String> execute(LaunchPack claimed) {
        String override = claimed.tg().chatId();
        String chatId = override != null && !override.isBlank() ? override : settings.chatId();

        TelegramPins pins = claimed.tg().pins();
        List<String> ids = new ArrayList<>();
        for (String text : List.of(pins.welcome(), pins.howToBuy(), pins.memekit())) {
            if (text.isBlank()) {
                continue;
            }
            long messageId = gateway.sendMessage(chatId, text);
            gateway.pinMessage(chatId, messageId);
            ids.add(Long.toString(messageId));
            log.debug("[TG_PUBLISH] {} sent and pinned message {}", claimed.id(), messageId);
        }
        return ids;
    }

    @Override
    protected Optional<LaunchPack> claim(String id, PublishClaim claim) {
        return store.claimTelegramPublish(id, claim);
    }

    @Override
    protected String displayName() {
        return "Telegram";
    }

    @Override
    protected String logPrefix() {
        return "TG_PUBLISH";
    }
}
