package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.application.port.output.XGateway;
import in.launchkit.config.XSettings;
import in.launchkit.domain.launchpack.Channel;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.PublishClaim;
import in.launchkit.domain.launchpack.XContent;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Posts the main announcement, then the thread with each entry replying to the previous post.
 */
public final class XPublishOrchestrator extends PublishOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(XPublishOrchestrator.class);

    private final XSettings settings;
    private final XGateway gateway;

    public XPublishOrchestrator(LaunchPackStore store, XSettings settings, XGateway gateway,
                                LaunchKitMetrics metrics, Clock clock) {
        super(store, Channel.X, metrics, clock);
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
        XContent content = claimed.x();
        List<String> ids = new ArrayList<>();
        String previous = null;

        if (!content.mainPost().isBlank()) {
            previous = gateway.post(content.mainPost(), null);
            ids.add(previous);
        }
        for (String part : content.thread()) {
            previous = gateway.post(part, previous);
            ids.add(previous);
        }
        log.debug("[X_PUBLISH] {} posted {} item(s)", claimed.id(), ids.size());
        return ids;
    }

    @Override
    protected Optional<LaunchPack> claim(String id, PublishClaim claim) {
        return store.claimXPublish(id, claim);
    }

    @Override
    protected String displayName() {
        return "X";
    }

    @Override
    protected String logPrefix() {
        return "X_PUBLISH";
    }
}
