package in.launchkit.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.application.port.output.TextGenerator;
import in.launchkit.application.port.output.WalletSecretsStore;
import in.launchkit.application.service.CopyGeneratorService;
import in.launchkit.application.service.DuePublishSweeper;
import in.launchkit.application.service.LaunchOrchestrator;
import in.launchkit.application.service.LauncherWalletProvider;
import in.launchkit.application.service.TelegramPublishOrchestrator;
import in.launchkit.application.service.XPublishOrchestrator;
import in.launchkit.config.DatabaseSettings;
import in.launchkit.config.LaunchKitConfig;
import in.launchkit.infrastructure.http.BoundedHttpFetcher;
import in.launchkit.infrastructure.metrics.PrometheusLaunchKitMetrics;
import in.launchkit.infrastructure.persistence.EnvWalletSecretsStore;
import in.launchkit.infrastructure.persistence.InMemoryLaunchPackStore;
import in.launchkit.infrastructure.persistence.InMemoryWalletSecretsStore;
import in.launchkit.infrastructure.persistence.LaunchKitSchemaMigration;
import in.launchkit.infrastructure.persistence.PostgresLaunchPackStore;
import in.launchkit.infrastructure.persistence.PostgresWalletSecretsStore;
import in.launchkit.infrastructure.pumpportal.PumpFunAssetGateway;
import in.launchkit.infrastructure.pumpportal.PumpPortalClient;
import in.launchkit.infrastructure.telegram.TelegramBotClient;
import in.launchkit.infrastructure.x.XApiClient;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Object graph for one LaunchKit process, built from a single {@link LaunchKitConfig}.
 *
 * PostgreSQL backs the stores when a database URL is configured; otherwise everything is in memory.
 */
public final class LaunchKit implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LaunchKit.class);

    private final LaunchKitConfig config;
    private final HikariDataSource dataSource;
    private final BoundedHttpFetcher fetcher;
    private final PrometheusLaunchKitMetrics metrics;
    private final LaunchPackStore store;
    private final LaunchOrchestrator launchOrchestrator;
    private final TelegramPublishOrchestrator telegramPublisher;
    private final XPublishOrchestrator xPublisher;
    private final CopyGeneratorService copyGenerator;
    private final DuePublishSweeper sweeper;

    public LaunchKit(LaunchKitConfig config, CollectorRegistry registry, TextGenerator textGenerator, Clock clock) {
        this.config = config;
        this.metrics = new PrometheusLaunchKitMetrics(registry);

        WalletSecretsStore secrets;
        if (config.database().isConfigured()) {
            this.dataSource = createDataSource(config.database());
            new LaunchKitSchemaMigration(dataSource).migrate();
            this.store = new PostgresLaunchPackStore(dataSource, clock);
            secrets = new PostgresWalletSecretsStore(dataSource);
        } else {
            this.dataSource = null;
            this.store = new InMemoryLaunchPackStore(clock);
            secrets = new InMemoryWalletSecretsStore();
            log.warn("[BOOT] DATABASE_URL not set, LaunchPacks are kept in memory only");
        }
        secrets = new EnvWalletSecretsStore(config.wallet(), secrets);

        this.fetcher = new BoundedHttpFetcher(config.endpoints().connectTimeout(),
            config.endpoints().totalTimeout(), config.endpoints().maxLogoBytes());
        PumpPortalClient portal = new PumpPortalClient(config.endpoints(), fetcher, metrics);
        PumpFunAssetGateway assets = new PumpFunAssetGateway(config.endpoints(), fetcher, metrics);

        this.launchOrchestrator = new LaunchOrchestrator(store, config.launch(),
            new LauncherWalletProvider(secrets, portal), assets, portal, metrics, clock);
        this.telegramPublisher = new TelegramPublishOrchestrator(store, config.telegram(),
            new TelegramBotClient(config.endpoints(), config.telegram().botToken(), metrics), metrics, clock);
        this.xPublisher = new XPublishOrchestrator(store, config.x(),
            new XApiClient(config.endpoints(), config.x(), metrics), metrics, clock);
        this.copyGenerator = new CopyGeneratorService(store, textGenerator, clock);
        this.sweeper = new DuePublishSweeper(store, List.of(telegramPublisher, xPublisher), metrics, clock,
            config.sweepInterval());

        log.info("[BOOT] LaunchKit wired: store={}, tg.enabled={}, x.enabled={}",
            store.getClass().getSimpleName(), config.telegram().enabled(), config.x().enabled());
    }

    public static LaunchKit fromEnv() {
        return new LaunchKit(LaunchKitConfig.fromEnv(), new CollectorRegistry(), null, Clock.systemUTC());
    }

    public LaunchKitConfig config() {
        return config;
    }

    public LaunchPackStore store() {
        return store;
    }

    public LaunchOrchestrator launchOrchestrator() {
        return launchOrchestrator;
    }

    public TelegramPublishOrchestrator telegramPublisher() {
        return telegramPublisher;
    }

    public XPublishOrchestrator xPublisher() {
        return xPublisher;
    }

    public CopyGeneratorService copyGenerator() {
        return copyGenerator;
    }

    public DuePublishSweeper sweeper() {
        return sweeper;
    }

    public PrometheusLaunchKitMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        sweeper.stop();
        fetcher.close();
        if (dataSource != null) {
            dataSource.close();
        }
        log.info("[BOOT] LaunchKit closed");
    }

    private static HikariDataSource createDataSource(DatabaseSettings settings) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(settings.jdbcUrl());
        if (settings.user() != null) hikari.setUsername(settings.user());
        if (settings.password() != null) hikari.setPassword(settings.password());
        hikari.setMaximumPoolSize(Math.max(2, settings.poolSize()));
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("launchkit-hikari");

        log.info("[BOOT] DB pool={}", hikari.getMaximumPoolSize());
        return new HikariDataSource(hikari);
    }
}
