package in.launchkit.config;

import java.time.Duration;

/**
 * Remote endpoints and the transfer limits applied to them.
 */
public record Endpoints(
    String pumpPortalBaseUrl,
    String pumpFunBaseUrl,
    String telegramApiBaseUrl,
    String xApiBaseUrl,
    Duration connectTimeout,
    Duration totalTimeout,
    long maxLogoBytes
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(8);
    public static final Duration DEFAULT_TOTAL_TIMEOUT = Duration.ofSeconds(20);
    public static final long DEFAULT_MAX_LOGO_BYTES = 8L * 1024 * 1024;

    public static Endpoints defaults() {
        return new Endpoints("https://pumpportal.fun", "https://pump.fun", "https://api.telegram.org",
            "https://api.twitter.com", DEFAULT_CONNECT_TIMEOUT, DEFAULT_TOTAL_TIMEOUT, DEFAULT_MAX_LOGO_BYTES);
    }

    /**
     * Same limits, all services at one base URL. Used against local stub servers.
     */
    public static Endpoints allAt(String baseUrl) {
        return new Endpoints(baseUrl, baseUrl, baseUrl, baseUrl,
            DEFAULT_CONNECT_TIMEOUT, DEFAULT_TOTAL_TIMEOUT, DEFAULT_MAX_LOGO_BYTES);
    }

    public Endpoints withLimits(Duration connect, Duration total, long maxBytes) {
        return new Endpoints(pumpPortalBaseUrl, pumpFunBaseUrl, telegramApiBaseUrl, xApiBaseUrl, connect, total, maxBytes);
    }
}
