package in.launchkit.infrastructure.pumpportal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.launchkit.config.Endpoints;
import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launch.CreateTokenRequest;
import in.launchkit.domain.launch.LauncherWallet;
import in.launchkit.domain.launch.MintKeypair;
import in.launchkit.domain.launch.TradeReceipt;
import in.launchkit.infrastructure.StubHttpServer;
import in.launchkit.infrastructure.http.BoundedHttpFetcher;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import in.launchkit.util.Base58;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PumpPortalClientTest {

    private static final int TEST_PORT = 19102;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private LaunchKitMetrics metrics;

    private StubHttpServer server;
    private BoundedHttpFetcher fetcher;
    private PumpPortalClient client;

    @BeforeEach
    void setUp() {
        server = new StubHttpServer(TEST_PORT);
        Endpoints endpoints = Endpoints.allAt(server.baseUrl())
            .withLimits(Duration.ofSeconds(2), Duration.ofSeconds(5), 64 * 1024);
        fetcher = new BoundedHttpFetcher(endpoints.connectTimeout(), endpoints.totalTimeout(), endpoints.maxLogoBytes());
        client = new PumpPortalClient(endpoints, fetcher, metrics);
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
        server.close();
    }

    private static String secretOfLength(int bytes) {
        byte[] secret = new byte[bytes];
        Arrays.fill(secret, (byte) 7);
        return Base58.encode(secret);
    }

    private static CreateTokenRequest createRequest(MintKeypair mint) {
        return new CreateTokenRequest("King Dog", "KING", "ipfs://meta", new BigDecimal("0.5"), 10,
            new BigDecimal("0.0005"), mint);
    }

    @Test
    void createWallet_returnsIssuedWallet() {
        String secret = secretOfLength(64);
        server.on("/api/create-wallet", StubHttpServer.json(200,
            "{\"apiKey\":\"k-1\",\"walletPublicKey\":\"ignored\",\"wallet\":\"W1\",\"privateKey\":\"" + secret + "\"}"));

        LauncherWallet wallet = client.createWallet();

        assertEquals("k-1", wallet.apiKey());
        assertEquals("W1", wallet.wallet());
        assertEquals(secret, wallet.walletSecret());
        assertEquals("GET", server.requests().get(0).method());
        verify(metrics).recordExternalCall("pumpportal", "200");
    }

    @Test
    void createWallet_missingFields_listsMissingKeys() {
        server.on("/api/create-wallet", StubHttpServer.json(200, "{\"wallet\":\"W1\"}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.createWallet());

        assertEquals("INVALID_WALLET_RESPONSE", e.getCode());
        assertEquals(ErrorKind.RESPONSE_INVALID, e.getKind());
        assertEquals(List.of("apiKey", "walletSecret"), e.getDetails().get("missingKeys"));
    }

    @Test
    void createWallet_secretOfWrongLength_isRejected() {
        server.on("/api/create-wallet", StubHttpServer.json(200,
            "{\"apiKey\":\"k-1\",\"wallet\":\"W1\",\"privateKey\":\"" + secretOfLength(32) + "\"}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.createWallet());

        assertEquals("WALLET_SECRET_INVALID", e.getCode());
        assertEquals(32, e.getDetails().get("length"));
    }

    @Test
    void createWallet_secretNotBase58_isRejected() {
        server.on("/api/create-wallet", StubHttpServer.json(200,
            "{\"apiKey\":\"k-1\",\"wallet\":\"W1\",\"privateKey\":\"0OIl-not-base58\"}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.createWallet());

        assertEquals("WALLET_SECRET_INVALID", e.getCode());
    }

    @Test
    void createWallet_httpFailure_usesWalletCreateCode() {
        server.on("/api/create-wallet", StubHttpServer.json(503, "{}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.createWallet());

        assertEquals("WALLET_CREATE_FAILED", e.getCode());
        assertEquals(503, e.getDetails().get("status"));
        verify(metrics).recordExternalCall("pumpportal", "error");
    }

    @Test
    void submitCreate_postsTradeAndReturnsSignature() throws Exception {
        MintKeypair mint = MintKeypair.generate();
        server.on("/api/trade", StubHttpServer.json(200,
            "{\"signature\":\"sig-1\",\"mint\":\"" + mint.publicKey() + "\"}"));

        TradeReceipt receipt = client.submitCreate(new LauncherWallet("k 1", "W1", secretOfLength(64)), createRequest(mint));

        assertEquals("sig-1", receipt.signature());
        assertEquals(mint.publicKey(), receipt.mint());

        StubHttpServer.Recorded request = server.requests().get(0);
        assertEquals("POST", request.method());
        assertEquals("api-key=k+1", request.query());
        JsonNode payload = MAPPER.readTree(request.bodyText());
        assertEquals("create", payload.get("action").asText());
        assertEquals("KING", payload.path("tokenMetadata").get("symbol").asText());
        assertEquals("ipfs://meta", payload.path("tokenMetadata").get("uri").asText());
        assertEquals("pump", payload.get("pool").asText());
        assertEquals(10, payload.get("slippage").asInt());
        assertEquals(mint.secretKey(), payload.get("mint").asText());
    }

    @Test
    void submitCreate_acceptsAlternateSignatureField() {
        server.on("/api/trade", StubHttpServer.json(200, "{\"txSignature\":\"sig-2\"}"));

        TradeReceipt receipt = client.submitCreate(new LauncherWallet("k", "W1", secretOfLength(64)),
            createRequest(MintKeypair.generate()));

        assertEquals("sig-2", receipt.signature());
        assertNull(receipt.mint());
    }

    @Test
    void submitCreate_errorStatus_carriesPortalError() {
        server.on("/api/trade", StubHttpServer.json(500, "{\"error\":\"insufficient balance\"}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () ->
            client.submitCreate(new LauncherWallet("k", "W1", secretOfLength(64)), createRequest(MintKeypair.generate())));

        assertEquals("LAUNCH_FAILED", e.getCode());
        assertEquals(ErrorKind.EXTERNAL_CALL_FAILED, e.getKind());
        assertEquals("insufficient balance", e.getMessage());
        assertEquals(500, e.getDetails().get("status"));
    }

    @Test
    void submitCreate_withoutSignature_isInvalidResponse() {
        server.on("/api/trade", StubHttpServer.json(200, "{\"ok\":true}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () ->
            client.submitCreate(new LauncherWallet("k", "W1", secretOfLength(64)), createRequest(MintKeypair.generate())));

        assertEquals("LAUNCH_FAILED", e.getCode());
        assertEquals(ErrorKind.RESPONSE_INVALID, e.getKind());
    }
}
