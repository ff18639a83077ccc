package in.launchkit.config;

import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Immutable LaunchKit configuration, read once at startup and passed to every service.
 */
public record LaunchKitConfig(
    LaunchSettings launch,
    WalletSettings wallet,
    TelegramSettings telegram,
    XSettings x,
    Endpoints endpoints,
    DatabaseSettings database,
    int metricsPort,
    Duration sweepInterval
) {
    private static final Logger log = LoggerFactory.getLogger(LaunchKitConfig.class);

    public static LaunchKitConfig defaults() {
        return new LaunchKitConfig(LaunchSettings.defaults(), WalletSettings.none(), TelegramSettings.disabled(),
            XSettings.disabled(), Endpoints.defaults(), DatabaseSettings.inMemory(), 9090, Duration.ofSeconds(60));
    }

    /**
     * Build from environment variables (falling back to system properties) and validate.
     */
    public static LaunchKitConfig fromEnv() {
        BigDecimal maxDevBuy = Env.getDecimal("MAX_SOL_DEV_BUY", BigDecimal.ZERO);
        BigDecimal maxPriorityFee = Env.getDecimal("MAX_PRIORITY_FEE", BigDecimal.ZERO);
        String maxSlippage = Env.get("MAX_SLIPPAGE_PERCENT", null);

        LaunchSettings launch = new LaunchSettings(
            Env.getBool("LAUNCH_ENABLE", false),
            Env.getBool("LOCAL_WITHDRAW_ENABLE", false),
            Env.getDecimal("LAUNCH_DEV_BUY_SOL", maxDevBuy),
            Env.getDecimal("LAUNCH_PRIORITY_FEE_SOL", maxPriorityFee),
            maxDevBuy,
            maxPriorityFee,
            Env.getInt("MAX_LAUNCHES_PER_DAY", 0),
            Env.getDecimal("LAUNCH_SLIPPAGE_PERCENT", BigDecimal.valueOf(LaunchSettings.DEFAULT_SLIPPAGE_PERCENT)).doubleValue(),
            maxSlippage == null ? null : Env.getDecimal("MAX_SLIPPAGE_PERCENT", null).doubleValue());

        WalletSettings wallet = new WalletSettings(
            Env.get("PUMP_PORTAL_API_KEY", null),
            Env.get("PUMP_PORTAL_WALLET_ADDRESS", null),
            Env.get("PUMP_PORTAL_WALLET_SECRET", null));

        TelegramSettings telegram = new TelegramSettings(
            Env.getBool("TG_ENABLE", false),
            Env.get("TG_BOT_TOKEN", null),
            Env.get("TG_CHAT_ID", null));

        XSettings x = new XSettings(
            Env.getBool("X_ENABLE", false),
            Env.get("X_API_KEY", null),
            Env.get("X_API_SECRET", null),
            Env.get("X_ACCESS_TOKEN", null),
            Env.get("X_ACCESS_SECRET", null));

        Endpoints defaults = Endpoints.defaults();
        Endpoints endpoints = new Endpoints(
            Env.get("PUMP_PORTAL_BASE_URL", defaults.pumpPortalBaseUrl()),
            Env.get("PUMP_FUN_BASE_URL", defaults.pumpFunBaseUrl()),
            Env.get("TELEGRAM_API_BASE_URL", defaults.telegramApiBaseUrl()),
            Env.get("X_API_BASE_URL", defaults.xApiBaseUrl()),
            defaults.connectTimeout(),
            defaults.totalTimeout(),
            defaults.maxLogoBytes());

        DatabaseSettings database = new DatabaseSettings(
            Env.get("DATABASE_URL", null),
            Env.get("DB_USER", null),
            Env.get("DB_PASS", null),
            Env.getInt("DB_POOL_SIZE", 10));

        LaunchKitConfig config = new LaunchKitConfig(launch, wallet, telegram, x, endpoints, database,
            Env.getInt("METRICS_PORT", 9090),
            Duration.ofSeconds(Env.getInt("PUBLISH_SWEEP_INTERVAL_SECONDS", 60)));
        config.validate();

        log.info("[CONFIG] launch.enabled={} tg.enabled={} x.enabled={} {}",
            launch.enabled(), telegram.enabled(), x.enabled(), database);
        return config;
    }

    /**
     * Startup checks that must hold before any service is built.
     */
    public void validate() {
        if (launch.enabled() && launch.localWithdrawEnabled()
                && (wallet.walletSecret() == null || wallet.walletSecret().isBlank())) {
            throw new LaunchKitException(ErrorKind.CONFIG_MISSING, "WALLET_SECRET_REQUIRED",
                "PUMP_PORTAL_WALLET_SECRET is required when LAUNCH_ENABLE and LOCAL_WITHDRAW_ENABLE are both set");
        }
        if (launch.devBuySol().signum() < 0 || launch.priorityFeeSol().signum() < 0) {
            throw new IllegalArgumentException("Launch amounts must not be negative");
        }
        if (launch.maxLaunchesPerDay() < 0) {
            throw new IllegalArgumentException("MAX_LAUNCHES_PER_DAY must not be negative");
        }
    }

    public LaunchKitConfig withLaunch(LaunchSettings value) {
        return new LaunchKitConfig(value, wallet, telegram, x, endpoints, database, metricsPort, sweepInterval);
    }

    public LaunchKitConfig withWallet(WalletSettings value) {
        return new LaunchKitConfig(launch, value, telegram, x, endpoints, database, metricsPort, sweepInterval);
    }

    public LaunchKitConfig withTelegram(TelegramSettings value) {
        return new LaunchKitConfig(launch, wallet, value, x, endpoints, database, metricsPort, sweepInterval);
    }

    public LaunchKitConfig withX(XSettings value) {
        return new LaunchKitConfig(launch, wallet, telegram, value, endpoints, database, metricsPort, sweepInterval);
    }

    public LaunchKitConfig withEndpoints(Endpoints value) {
        return new LaunchKitConfig(launch, wallet, telegram, x, value, database, metricsPort, sweepInterval);
    }
}
