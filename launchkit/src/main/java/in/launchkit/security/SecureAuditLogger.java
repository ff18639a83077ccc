package in.launchkit.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Audit logger that masks credentials before anything reaches the log.
 *
 * Masks:
 * - bearer tokens and api-key / token query parameters
 * - Telegram bot tokens embedded in request paths
 * - values of sensitive keys in detail maps, recursively through maps and lists
 *
 * Usage:
 * <pre>
 * SecureAuditLogger audit = new SecureAuditLogger("LAUNCH");
 * audit.logApiCall("POST", tradeUrl, 200, 850);
 * Map&lt;String, Object&gt; safe = audit.redact(details);
 * </pre>
 */
public class SecureAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(SecureAuditLogger.class);

    public static final String REDACTED = "[redacted]";

    private static final Set<String> SENSITIVE_KEYS = Set.of(
        "TG_BOT_TOKEN", "TG_CHAT_ID",
        "X_API_KEY", "X_API_SECRET", "X_ACCESS_TOKEN", "X_ACCESS_SECRET",
        "apiKey", "wallet", "walletSecret", "wallet_secret", "PUMP_PORTAL_WALLET_SECRET",
        "mint", "secret", "privateKey", "private_key"
    );

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern API_KEY_PATTERN =
        Pattern.compile("(api[_-]?key|apikey)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_PATTERN =
        Pattern.compile("(token|access[_-]?token)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern BOT_TOKEN_PATH_PATTERN =
        Pattern.compile("/bot\\d+:[A-Za-z0-9_-]+");

    private final String component;

    public SecureAuditLogger(String component) {
        this.component = component;
    }

    /**
     * Log API call with sanitized URL.
     */
    public void logApiCall(String method, String url, int statusCode, long durationMs) {
        log.info("[{}][API] method={}, url={}, status={}, duration_ms={}",
            component, method, sanitizeUrl(url), statusCode, durationMs);
    }

    /**
     * Log a failed operation. The message and details are sanitized.
     */
    public void logError(String operation, String code, String message, Map<String, Object> details) {
        log.error("[{}][ERROR] operation={}, code={}, error={}, details={}",
            component, operation, code, sanitize(message), redact(details));
    }

    public void logEvent(String event, String details) {
        log.info("[{}][EVENT] event={}, details={}", component, event, sanitize(details));
    }

    /**
     * Mask credentials inside free text.
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }

        String result = input;
        result = BEARER_TOKEN_PATTERN.matcher(result).replaceAll("Bearer ****");
        result = BOT_TOKEN_PATH_PATTERN.matcher(result).replaceAll("/bot****");
        result = API_KEY_PATTERN.matcher(result).replaceAll("$1=****");
        result = TOKEN_PATTERN.matcher(result).replaceAll("$1=****");
        return result;
    }

    /**
     * Sanitize URL path and query parameters.
     */
    public String sanitizeUrl(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        int queryIndex = url.indexOf('?');
        if (queryIndex == -1) {
            return sanitize(url);
        }

        String base = url.substring(0, queryIndex);
        String query = url.substring(queryIndex + 1);
        return sanitize(base) + "?" + sanitize(query);
    }

    /**
     * Copy of {@code details} with every sensitive key's value replaced by {@value #REDACTED}.
     */
    public Map<String, Object> redact(Map<String, ?> details) {
        if (details == null) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : details.entrySet()) {
            out.put(entry.getKey(), isSensitiveKey(entry.getKey()) ? REDACTED : redactValue(entry.getValue()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof Map) {
            return redact((Map<String, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                out.add(redactValue(item));
            }
            return out;
        }
        if (value instanceof String) {
            return sanitize((String) value);
        }
        return value;
    }

    public static boolean isSensitiveKey(String key) {
        return key != null && SENSITIVE_KEYS.contains(key);
    }
}
