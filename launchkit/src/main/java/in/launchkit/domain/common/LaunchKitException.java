package in.launchkit.domain.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured failure raised by the store and the orchestrators.
 *
 * Carries a stable {@code code} (e.g. LAUNCH_IN_PROGRESS, TG_CONFIG_MISSING) and a details
 * payload that callers can surface without consulting logs. Details must never contain secrets.
 */
public class LaunchKitException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final Map<String, Object> details;

    public LaunchKitException(ErrorKind kind, String code, String message) {
        this(kind, code, message, Map.of(), null);
    }

    public LaunchKitException(ErrorKind kind, String code, String message,
                              Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static LaunchKitException validation(String code, String message, Map<String, Object> details) {
        return new LaunchKitException(ErrorKind.VALIDATION, code, message, details, null);
    }

    public static LaunchKitException notFound(String id) {
        return new LaunchKitException(ErrorKind.NOT_FOUND, "NOT_FOUND",
            "LaunchPack not found: " + id, Map.of("id", id), null);
    }

    public static LaunchKitException conflict(String code, String message) {
        return new LaunchKitException(ErrorKind.CONFLICT, code, message);
    }

    public static LaunchKitException disabled(String code, String message) {
        return new LaunchKitException(ErrorKind.DISABLED, code, message);
    }

    public static LaunchKitException configMissing(String code, List<String> missingKeys) {
        return new LaunchKitException(ErrorKind.CONFIG_MISSING, code,
            "Missing configuration: " + String.join(", ", missingKeys),
            Map.of("missingKeys", List.copyOf(missingKeys)), null);
    }

    public static LaunchKitException policy(String code, String message, Map<String, Object> details) {
        return new LaunchKitException(ErrorKind.POLICY_VIOLATION, code, message, details, null);
    }

    public static LaunchKitException external(String code, String message,
                                              Map<String, Object> details, Throwable cause) {
        return new LaunchKitException(ErrorKind.EXTERNAL_CALL_FAILED, code, message, details, cause);
    }

    public static LaunchKitException invalidResponse(String code, String message, Map<String, Object> details) {
        return new LaunchKitException(ErrorKind.RESPONSE_INVALID, code, message, details, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Missing configuration or response keys, if this error names any.
     */
    @SuppressWarnings("unchecked")
    public List<String> missingKeys() {
        Object keys = details.get("missingKeys");
        return keys instanceof List ? (List<String>) keys : List.of();
    }

    @Override
    public String toString() {
        return "LaunchKitException[" + kind + "/" + code + "]: " + getMessage();
    }
}
