package in.launchkit.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Credential masking")
class SecureAuditLoggerTest {

    private final SecureAuditLogger audit = new SecureAuditLogger("TEST");

    @Test
    @DisplayName("Bearer tokens are masked")
    void sanitize_bearer() {
        assertEquals("Authorization: Bearer ****", audit.sanitize("Authorization: Bearer abc.def-123"));
    }

    @Test
    @DisplayName("Api key query parameter is masked")
    void sanitizeUrl_apiKey() {
        String url = audit.sanitizeUrl("https://pumpportal.fun/api/trade?api-key=secret123&x=1");

        assertEquals("https://pumpportal.fun/api/trade?api-key=****&x=1", url);
    }

    @Test
    @DisplayName("Bot token in the path is masked")
    void sanitizeUrl_botToken() {
        String url = audit.sanitizeUrl("https://api.telegram.org/bot123456:ABC-def_9/sendMessage");

        assertEquals("https://api.telegram.org/bot****/sendMessage", url);
    }

    @Test
    void sanitize_nullAndBlankPassThrough() {
        assertNull(audit.sanitize(null));
        assertEquals(" ", audit.sanitize(" "));
    }

    @Test
    @DisplayName("Sensitive keys are redacted through nested maps and lists")
    void redact_recursive() {
        Map<String, Object> details = Map.of(
            "status", 500,
            "walletSecret", "s3cret",
            "nested", Map.of("apiKey", "k", "note", "token=abc"),
            "items", List.of(Map.of("privateKey", "p"), "Bearer xyz"));

        Map<String, Object> safe = audit.redact(details);

        assertEquals(500, safe.get("status"));
        assertEquals(SecureAuditLogger.REDACTED, safe.get("walletSecret"));
        Map<?, ?> nested = (Map<?, ?>) safe.get("nested");
        assertEquals(SecureAuditLogger.REDACTED, nested.get("apiKey"));
        assertEquals("token=****", nested.get("note"));
        List<?> items = (List<?>) safe.get("items");
        assertEquals(SecureAuditLogger.REDACTED, ((Map<?, ?>) items.get(0)).get("privateKey"));
        assertEquals("Bearer ****", items.get(1));
    }

    @Test
    void redact_nullIsEmpty() {
        assertTrue(audit.redact(null).isEmpty());
    }
}
