package in.launchkit.bootstrap;

import in.launchkit.TestClock;
import in.launchkit.config.LaunchKitConfig;
import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackFixtures;
import in.launchkit.infrastructure.persistence.InMemoryLaunchPackStore;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring of the default (in-memory, all channels disabled) process and its ops endpoints.
 */
public class LaunchKitTest {

    private static final int TEST_PORT = 19105;

    private LaunchKit kit;
    private Undertow server;

    @BeforeEach
    public void setUp() {
        kit = new LaunchKit(LaunchKitConfig.defaults(), new CollectorRegistry(), null,
            new TestClock(Instant.parse("2026-02-01T09:00:00Z")));
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
        kit.close();
    }

    @Test
    public void testDefaultsUseInMemoryStore() {
        assertInstanceOf(InMemoryLaunchPackStore.class, kit.store());
    }

    @Test
    public void testCopyGenerationThroughWiredServices() {
        LaunchPack pack = kit.store().create(LaunchPackFixtures.input("King Dog", "king"));

        LaunchPack generated = kit.copyGenerator().generate(pack.id(), "royalty", List.of(), null);

        assertTrue(generated.ops().checklist().get("copy_ready"));
        assertEquals(6, generated.tg().schedule().size());
    }

    @Test
    public void testDisabledChannelsAreRejected() {
        LaunchPack pack = kit.store().create(LaunchPackFixtures.input("King Dog", "king"));

        LaunchKitException tg = assertThrows(LaunchKitException.class,
            () -> kit.telegramPublisher().publish(pack.id(), false));
        LaunchKitException launch = assertThrows(LaunchKitException.class,
            () -> kit.launchOrchestrator().launch(pack.id(), false));

        assertEquals("TG_DISABLED", tg.getCode());
        assertEquals(ErrorKind.DISABLED, tg.getKind());
        assertEquals("LAUNCH_DISABLED", launch.getCode());
    }

    @Test
    public void testSweepWithDisabledChannelsPublishesNothing() {
        assertEquals(0, kit.sweeper().sweepOnce());
    }

    @Test
    public void testOpsEndpoints() throws Exception {
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(App.routes(kit))
            .build();
        server.start();

        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

        HttpResponse<String> health = httpClient.send(
            HttpRequest.newBuilder().uri(URI.create("http://localhost:" + TEST_PORT + "/health")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> metrics = httpClient.send(
            HttpRequest.newBuilder().uri(URI.create("http://localhost:" + TEST_PORT + "/metrics")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, health.statusCode());
        assertEquals("{\"status\":\"ok\"}", health.body());
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("launchkit_launches_total"));
    }
}
