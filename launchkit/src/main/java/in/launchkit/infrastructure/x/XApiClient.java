package in.launchkit.infrastructure.x;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.launchkit.application.port.output.XGateway;
import in.launchkit.config.Endpoints;
import in.launchkit.config.XSettings;
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
import java.util.Map;

/**
 * X (Twitter) v2 posting adapter. Replies chain through {@code reply.in_reply_to_tweet_id}.
 */
public final class XApiClient implements XGateway {
    private static final Logger log = LoggerFactory.getLogger(XApiClient.class);

    private static final String FAILURE_CODE = "X_PUBLISH_FAILED";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecureAuditLogger audit = new SecureAuditLogger("X");
    private final HttpClient httpClient;
    private final Endpoints endpoints;
    private final XSettings credentials;
    private final LaunchKitMetrics metrics;

    public XApiClient(Endpoints endpoints, XSettings credentials, LaunchKitMetrics metrics) {
        this.endpoints = endpoints;
        this.credentials = credentials;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(endpoints.connectTimeout())
            .build();
    }

    @Override
    public String post(String text, String replyToId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("text", text);
        if (replyToId != null) {
            body.putObject("reply").put("in_reply_to_tweet_id", replyToId);
        }

        String url = endpoints.xApiBaseUrl() + "/2/tweets";
        long start = System.currentTimeMillis();

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + credentials.accessToken())
                .header("x-api-key", credentials.apiKey())
                .header("x-api-secret", credentials.apiSecret())
                .header("x-access-token", credentials.accessToken())
                .header("x-access-secret", credentials.accessSecret())
                .timeout(endpoints.totalTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record("error");
            throw LaunchKitException.external(FAILURE_CODE, "X post interrupted", Map.of(), e);
        } catch (IOException e) {
            record("error");
            throw LaunchKitException.external(FAILURE_CODE, "X post failed: " + audit.sanitize(e.getMessage()), Map.of(), e);
        }

        audit.logApiCall("POST", url, response.statusCode(), System.currentTimeMillis() - start);
        record(String.valueOf(response.statusCode()));

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("[X] Post rejected: HTTP {}", response.statusCode());
            throw LaunchKitException.external(FAILURE_CODE, "X post failed (" + response.statusCode() + ")",
                Map.of("status", response.statusCode()), null);
        }

        String id = null;
        try {
            JsonNode json = objectMapper.readTree(response.body());
            JsonNode idNode = json.path("data").path("id");
            if (idNode.isTextual() || idNode.isNumber()) {
                id = idNode.asText();
            }
        } catch (IOException e) {
            log.warn("[X] Post response is not JSON: {}", e.getMessage());
        }
        if (id == null || id.isBlank()) {
            throw LaunchKitException.invalidResponse(FAILURE_CODE, "X post response missing id", Map.of());
        }
        return id;
    }

    private void record(String status) {
        if (metrics != null) {
            metrics.recordExternalCall("x", status);
        }
    }
}
