package in.launchkit.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.launchkit.config.Endpoints;
import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.infrastructure.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TelegramBotClientTest {

    private static final int TEST_PORT = 19103;
    private static final String TOKEN = "123456:ABC-def";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StubHttpServer server;
    private TelegramBotClient client;

    @BeforeEach
    void setUp() {
        server = new StubHttpServer(TEST_PORT);
        Endpoints endpoints = Endpoints.allAt(server.baseUrl())
            .withLimits(Duration.ofSeconds(2), Duration.ofSeconds(5), Endpoints.DEFAULT_MAX_LOGO_BYTES);
        client = new TelegramBotClient(endpoints, TOKEN, null);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void sendMessage_returnsMessageId() throws Exception {
        server.on("/bot" + TOKEN + "/sendMessage",
            StubHttpServer.json(200, "{\"ok\":true,\"result\":{\"message_id\":42}}"));

        long id = client.sendMessage("@kingdog", "gm");

        assertEquals(42L, id);
        JsonNode body = MAPPER.readTree(server.requests().get(0).bodyText());
        assertEquals("@kingdog", body.get("chat_id").asText());
        assertEquals("gm", body.get("text").asText());
        assertTrue(body.get("disable_web_page_preview").asBoolean());
    }

    @Test
    void pinMessage_sendsMessageId() throws Exception {
        server.on("/bot" + TOKEN + "/pinChatMessage", StubHttpServer.json(200, "{\"ok\":true,\"result\":true}"));

        client.pinMessage("@kingdog", 42L);

        JsonNode body = MAPPER.readTree(server.requests().get(0).bodyText());
        assertEquals(42L, body.get("message_id").asLong());
    }

    @Test
    void okFalse_failsWithDescription() {
        server.on("/bot" + TOKEN + "/sendMessage",
            StubHttpServer.json(200, "{\"ok\":false,\"description\":\"chat not found\"}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.sendMessage("@nobody", "gm"));

        assertEquals("TG_PUBLISH_FAILED", e.getCode());
        assertEquals(ErrorKind.EXTERNAL_CALL_FAILED, e.getKind());
        assertEquals("sendMessage", e.getDetails().get("method"));
        assertEquals("chat not found", e.getDetails().get("description"));
    }

    @Test
    void errorStatus_failsWithStatus() {
        server.on("/bot" + TOKEN + "/pinChatMessage",
            StubHttpServer.json(400, "{\"ok\":false,\"description\":\"not enough rights\"}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.pinMessage("@kingdog", 7L));

        assertEquals(400, e.getDetails().get("status"));
        assertEquals("pinChatMessage", e.getDetails().get("method"));
    }

    @Test
    void missingMessageId_isInvalidResponse() {
        server.on("/bot" + TOKEN + "/sendMessage", StubHttpServer.json(200, "{\"ok\":true,\"result\":{}}"));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.sendMessage("@kingdog", "gm"));

        assertEquals(ErrorKind.RESPONSE_INVALID, e.getKind());
        assertEquals("TG_PUBLISH_FAILED", e.getCode());
    }

    @Test
    void failureMessage_doesNotLeakBotToken() {
        LaunchKitException e = assertThrows(LaunchKitException.class, () -> client.sendMessage("@kingdog", "gm"));

        assertFalse(e.getMessage().contains(TOKEN));
        assertEquals(404, e.getDetails().get("status"));
    }
}
