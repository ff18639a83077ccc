package in.launchkit.infrastructure.pumpportal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.launchkit.application.port.output.TokenAssetGateway;
import in.launchkit.config.Endpoints;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launch.LogoImage;
import in.launchkit.domain.launch.TokenMetadataForm;
import in.launchkit.infrastructure.http.BoundedHttpFetcher;
import in.launchkit.infrastructure.http.MultipartBody;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Logo download and pump.fun IPFS metadata upload.
 */
public final class PumpFunAssetGateway implements TokenAssetGateway {
    private static final Logger log = LoggerFactory.getLogger(PumpFunAssetGateway.class);

    static final String DEFAULT_FILENAME = "logo.png";
    static final String DEFAULT_CONTENT_TYPE = "image/png";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final Endpoints endpoints;
    private final BoundedHttpFetcher fetcher;
    private final LaunchKitMetrics metrics;

    public PumpFunAssetGateway(Endpoints endpoints, BoundedHttpFetcher fetcher, LaunchKitMetrics metrics) {
        this.endpoints = endpoints;
        this.fetcher = fetcher;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(endpoints.connectTimeout())
            .build();
    }

    @Override
    public LogoImage fetchLogo(String url) {
        BoundedHttpFetcher.Fetched fetched;
        try {
            fetched = fetcher.fetch(url, "LOGO_FETCH_FAILED");
        } catch (LaunchKitException e) {
            record("logo", "error");
            throw e;
        }
        record("logo", "200");

        String contentType = fetched.contentType() == null || fetched.contentType().isBlank()
            ? DEFAULT_CONTENT_TYPE
            : fetched.contentType();
        LogoImage logo = new LogoImage(fetched.body(), filenameFrom(url), contentType);
        log.info("[IPFS] Fetched logo {}", logo);
        return logo;
    }

    @Override
    public String uploadMetadata(TokenMetadataForm form, LogoImage logo) {
        MultipartBody body = new MultipartBody()
            .field("name", form.name())
            .field("symbol", form.symbol())
            .field("description", form.description())
            .field("showName", "true")
            .field("twitter", form.twitter())
            .field("telegram", form.telegram())
            .field("website", form.website())
            .file("file", logo.filename(), logo.contentType(), logo.bytes());

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoints.pumpFunBaseUrl() + "/api/ipfs"))
                .header("Content-Type", body.contentType())
                .timeout(endpoints.totalTimeout())
                .POST(body.publisher())
                .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record("pumpfun_ipfs", "error");
            throw LaunchKitException.external("IPFS_UPLOAD_FAILED", "IPFS upload interrupted", Map.of(), e);
        } catch (IOException e) {
            record("pumpfun_ipfs", "error");
            throw LaunchKitException.external("IPFS_UPLOAD_FAILED", "IPFS upload failed: " + e.getMessage(), Map.of(), e);
        }

        record("pumpfun_ipfs", String.valueOf(response.statusCode()));
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw LaunchKitException.external("IPFS_UPLOAD_FAILED",
                "IPFS upload failed (" + response.statusCode() + ")", Map.of("status", response.statusCode()), null);
        }

        String uri;
        try {
            JsonNode json = objectMapper.readTree(response.body());
            uri = PumpPortalClient.firstText(json, "metadataUri", "uri");
        } catch (IOException e) {
            uri = null;
            log.warn("[IPFS] Upload response is not JSON: {}", e.getMessage());
        }
        if (uri == null) {
            throw LaunchKitException.invalidResponse("IPFS_UPLOAD_FAILED", "No metadataUri returned", Map.of());
        }
        log.info("[IPFS] Metadata uploaded: {}", uri);
        return uri;
    }

    /**
     * Last path segment of the URL, or logo.png when it has no extension.
     */
    static String filenameFrom(String url) {
        String path = url.split("#", 2)[0].split("\\?", 2)[0];
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isEmpty() || !name.contains(".")) {
            return DEFAULT_FILENAME;
        }
        return name;
    }

    private void record(String dependency, String status) {
        if (metrics != null) {
            metrics.recordExternalCall(dependency, status);
        }
    }
}
