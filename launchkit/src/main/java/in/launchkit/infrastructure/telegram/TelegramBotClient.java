package in.launchkit.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.launchkit.application.port.output.TelegramGateway;
import in.launchkit.config.Endpoints;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import in.launchkit.security.SecureAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API adapter (sendMessage, pinChatMessage).
 *
 * Every failure, including a reply with {@code ok=false}, surfaces as TG_PUBLISH_FAILED.
 */
public final class TelegramBotClient implements TelegramGateway {
    private static final Logger log = LoggerFactory.getLogger(TelegramBotClient.class);

    private static final String FAILURE_CODE = "TG_PUBLISH_FAILED";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecureAuditLogger audit = new SecureAuditLogger("TELEGRAM");
    private final HttpClient httpClient;
    private final Endpoints endpoints;
    private final String botToken;
    private final LaunchKitMetrics metrics;

    public TelegramBotClient(Endpoints endpoints, String botToken, LaunchKitMetrics metrics) {
        this.endpoints = endpoints;
        this.botToken = botToken;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(endpoints.connectTimeout())
            .build();
    }

    @Override
    public long sendMessage(String chatId, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("disable_web_page_preview", true);

        JsonNode result = call("sendMessage", body);
        JsonNode messageId = result.get("message_id");
        if (messageId == null || !messageId.canConvertToLong()) {
            throw LaunchKitException.invalidResponse(FAILURE_CODE, "Telegram sendMessage missing message_id", Map.of());
        }
        return messageId.asLong();
    }

    @Override
    public void pinMessage(String chatId, long messageId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", chatId);
        body.put("message_id", messageId);
        call("pinChatMessage", body);
    }

    private JsonNode call(String method, ObjectNode body) {
        String url = endpoints.telegramApiBaseUrl() + "/bot" + botToken + "/" + method;
        long start = System.currentTimeMillis();

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .timeout(endpoints.totalTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record("error");
            throw LaunchKitException.external(FAILURE_CODE, "Telegram " + method + " interrupted", Map.of("method", method), e);
        } catch (IOException e) {
            record("error");
            throw LaunchKitException.external(FAILURE_CODE, "Telegram " + method + " failed: " + audit.sanitize(e.getMessage()),
                Map.of("method", method), e);
        }

        audit.logApiCall("POST", url, response.statusCode(), System.currentTimeMillis() - start);
        record(String.valueOf(response.statusCode()));

        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (IOException e) {
            json = objectMapper.createObjectNode();
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300 || !json.path("ok").asBoolean(false)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("method", method);
            details.put("status", response.statusCode());
            if (json.hasNonNull("description")) {
                details.put("description", json.get("description").asText());
            }
            log.warn("[TELEGRAM] {} rejected: {}", method, details);
            throw LaunchKitException.external(FAILURE_CODE, "Telegram " + method + " failed", details, null);
        }
        return json.path("result");
    }

    private void record(String status) {
        if (metrics != null) {
            metrics.recordExternalCall("telegram", status);
        }
    }
}
