package in.launchkit.infrastructure.pumpportal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.launchkit.application.port.output.LaunchPortal;
import in.launchkit.config.Endpoints;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launch.CreateTokenRequest;
import in.launchkit.domain.launch.LauncherWallet;
import in.launchkit.domain.launch.TradeReceipt;
import in.launchkit.infrastructure.http.BoundedHttpFetcher;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import in.launchkit.security.SecureAuditLogger;
import in.launchkit.util.Base58;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * PumpPortal adapter: launcher wallet issuance and create-and-buy trades.
 */
public final class PumpPortalClient implements LaunchPortal {
    private static final Logger log = LoggerFactory.getLogger(PumpPortalClient.class);

    private static final String DEPENDENCY = "pumpportal";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecureAuditLogger audit = new SecureAuditLogger("PUMPPORTAL");
    private final HttpClient httpClient;
    private final Endpoints endpoints;
    private final BoundedHttpFetcher fetcher;
    private final LaunchKitMetrics metrics;

    public PumpPortalClient(Endpoints endpoints, BoundedHttpFetcher fetcher, LaunchKitMetrics metrics) {
        this.endpoints = endpoints;
        this.fetcher = fetcher;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(endpoints.connectTimeout())
            .build();
    }

    @Override
    public LauncherWallet createWallet() {
        log.info("[PUMPPORTAL] Requesting launcher wallet");

        BoundedHttpFetcher.Fetched fetched;
        try {
            fetched = fetcher.fetch(endpoints.pumpPortalBaseUrl() + "/api/create-wallet", "WALLET_CREATE_FAILED");
        } catch (LaunchKitException e) {
            record("error");
            throw e;
        }
        record("200");

        JsonNode body = parse(fetched.body());
        String apiKey = firstText(body, "apiKey");
        String wallet = firstText(body, "wallet", "publicKey", "address");
        String walletSecret = firstText(body, "privateKey", "secretKey", "walletSecret", "private_key");

        List<String> missingKeys = new ArrayList<>();
        if (apiKey == null) missingKeys.add("apiKey");
        if (wallet == null) missingKeys.add("wallet");
        if (walletSecret == null) missingKeys.add("walletSecret");
        if (!missingKeys.isEmpty()) {
            throw LaunchKitException.invalidResponse("INVALID_WALLET_RESPONSE", "Invalid wallet response",
                Map.of("missingKeys", missingKeys));
        }

        int length = Base58.decodedLength(walletSecret);
        if (length < 0) {
            throw LaunchKitException.invalidResponse("WALLET_SECRET_INVALID", "Wallet secret is not valid base58", Map.of());
        }
        if (length != LauncherWallet.SECRET_KEY_BYTES) {
            throw LaunchKitException.invalidResponse("WALLET_SECRET_INVALID",
                "Wallet secret must decode to " + LauncherWallet.SECRET_KEY_BYTES + " bytes", Map.of("length", length));
        }

        log.info("[PUMPPORTAL] Launcher wallet issued: {}", wallet);
        return new LauncherWallet(apiKey, wallet, walletSecret);
    }

    @Override
    public TradeReceipt submitCreate(LauncherWallet wallet, CreateTokenRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("action", "create");
        ObjectNode metadata = payload.putObject("tokenMetadata");
        metadata.put("name", request.name());
        metadata.put("symbol", request.symbol());
        metadata.put("uri", request.metadataUri());
        payload.put("denominatedInSol", "true");
        payload.put("amount", request.amountSol());
        payload.put("slippage", request.slippage());
        payload.put("priorityFee", request.priorityFeeSol());
        payload.put("pool", "pump");
        payload.put("mint", request.mint().secretKey());

        String url = endpoints.pumpPortalBaseUrl() + "/api/trade?api-key="
            + URLEncoder.encode(wallet.apiKey(), StandardCharsets.UTF_8);

        log.info("[PUMPPORTAL] Submitting create trade: symbol={} amount={} slippage={} priorityFee={} mint={}",
            request.symbol(), request.amountSol(), request.slippage(), request.priorityFeeSol(), request.mint().publicKey());

        HttpResponse<String> response;
        long start = System.currentTimeMillis();
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .timeout(endpoints.totalTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                .build();
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record("error");
            throw LaunchKitException.external("LAUNCH_FAILED", "Trade submission interrupted", Map.of(), e);
        } catch (IOException e) {
            record("error");
            throw LaunchKitException.external("LAUNCH_FAILED",
                "Trade submission failed: " + audit.sanitize(e.getMessage()), Map.of(), e);
        }

        audit.logApiCall("POST", url, response.statusCode(), System.currentTimeMillis() - start);
        record(String.valueOf(response.statusCode()));

        JsonNode json = parse(response.body());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String error = firstText(json, "error");
            throw LaunchKitException.external("LAUNCH_FAILED",
                error != null ? error : "Launch failed (" + response.statusCode() + ")",
                Map.of("status", response.statusCode()), null);
        }

        String signature = firstText(json, "signature", "tx", "txSignature");
        if (signature == null) {
            throw LaunchKitException.invalidResponse("LAUNCH_FAILED",
                "Launch portal returned no transaction signature", Map.of());
        }
        return new TradeReceipt(signature, firstText(json, "mint"));
    }

    private JsonNode parse(byte[] body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("[PUMPPORTAL] Response is not JSON: {}", e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private JsonNode parse(String body) {
        return parse(body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8));
    }

    static String firstText(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private void record(String status) {
        if (metrics != null) {
            metrics.recordExternalCall(DEPENDENCY, status);
        }
    }
}
