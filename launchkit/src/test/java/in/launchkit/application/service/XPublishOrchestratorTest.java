package in.launchkit.application.service;

import in.launchkit.TestClock;
import in.launchkit.application.port.output.XGateway;
import in.launchkit.config.XSettings;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackFixtures;
import in.launchkit.domain.launchpack.PublishStatus;
import in.launchkit.infrastructure.persistence.InMemoryLaunchPackStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class XPublishOrchestratorTest {

    private static final Instant START = Instant.parse("2026-01-10T12:00:00Z");
    private static final XSettings SETTINGS = new XSettings(true, "key", "secret", "token", "token-secret");

    @Mock
    private XGateway gateway;

    private InMemoryLaunchPackStore store;
    private XPublishOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        TestClock clock = new TestClock(START);
        store = new InMemoryLaunchPackStore(clock);
        orchestrator = new XPublishOrchestrator(store, SETTINGS, gateway, null, clock);
    }

    @Test
    void publish_chainsThreadRepliesToPreviousPost() {
        when(gateway.post("gm kings", null)).thenReturn("1001");
        when(gateway.post("part one", "1001")).thenReturn("1002");
        when(gateway.post("part two", "1002")).thenReturn("1003");
        LaunchPack pack = store.create(LaunchPackFixtures.withThread("gm kings", List.of("part one", "part two")));

        LaunchPack result = orchestrator.publish(pack.id(), false);

        assertEquals(List.of("1001", "1002", "1003"), result.ops().xPublish().resultIds());
        assertEquals(PublishStatus.PUBLISHED, result.ops().xPublish().status());
        assertTrue(result.ops().checked("x_published"));

        InOrder order = inOrder(gateway);
        order.verify(gateway).post("gm kings", null);
        order.verify(gateway).post("part one", "1001");
        order.verify(gateway).post("part two", "1002");
        verifyNoMoreInteractions(gateway);
    }

    @Test
    void publish_threadWithoutMainPostStartsTopLevel() {
        when(gateway.post("only part", null)).thenReturn("2001");
        LaunchPack pack = store.create(LaunchPackFixtures.withThread("", List.of("only part")));

        LaunchPack result = orchestrator.publish(pack.id(), false);

        assertEquals(List.of("2001"), result.ops().xPublish().resultIds());
    }

    @Test
    void publish_postsEveryThreadEntryAsGiven() {
        when(gateway.post("gm kings", null)).thenReturn("1001");
        when(gateway.post("one", "1001")).thenReturn("1002");
        when(gateway.post(" ", "1002")).thenReturn("1003");
        when(gateway.post("two", "1003")).thenReturn("1004");
        LaunchPack pack = store.create(LaunchPackFixtures.withThread("gm kings", List.of("one", " ", "two")));

        LaunchPack result = orchestrator.publish(pack.id(), false);

        assertEquals(List.of("1001", "1002", "1003", "1004"), result.ops().xPublish().resultIds());
        verify(gateway, times(4)).post(any(), any());
    }

    @Test
    void publish_errorFromGatewayStillMarksChannelFailed() {
        when(gateway.post("gm kings", null)).thenThrow(new AssertionError("boom"));
        LaunchPack pack = store.create(LaunchPackFixtures.withThread("gm kings", List.of()));

        assertThrows(AssertionError.class, () -> orchestrator.publish(pack.id(), false));

        LaunchPack failed = store.get(pack.id()).orElseThrow();
        assertEquals(PublishStatus.FAILED, failed.ops().xPublish().status());
        assertEquals("X_PUBLISH_FAILED", failed.ops().xPublish().errorCode());
    }

    @Test
    void publish_failedThreadPartMarksChannelFailed() {
        when(gateway.post("gm kings", null)).thenReturn("1001");
        when(gateway.post("part one", "1001"))
            .thenThrow(LaunchKitException.external("X_PUBLISH_FAILED", "X API returned 429", Map.of("status", 429), null));
        LaunchPack pack = store.create(LaunchPackFixtures.withThread("gm kings", List.of("part one", "part two")));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> orchestrator.publish(pack.id(), false));

        assertEquals("X_PUBLISH_FAILED", e.getCode());
        LaunchPack failed = store.get(pack.id()).orElseThrow();
        assertEquals(PublishStatus.FAILED, failed.ops().xPublish().status());
        assertEquals("X_PUBLISH_FAILED", failed.ops().xPublish().errorCode());
        assertTrue(failed.ops().auditLog().get(0).message().startsWith("X publish failed"));
        verify(gateway, never()).post(eq("part two"), any());
    }

    @Test
    void publish_missingCredentialsAreAllNamed() {
        XPublishOrchestrator unconfigured = new XPublishOrchestrator(store,
            new XSettings(true, "key", null, null, "s"), gateway, null, Clock.systemUTC());
        LaunchPack pack = store.create(LaunchPackFixtures.withThread("gm", List.of()));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> unconfigured.publish(pack.id(), false));

        assertEquals("X_CONFIG_MISSING", e.getCode());
        assertEquals(List.of("X_API_SECRET", "X_ACCESS_TOKEN"), e.missingKeys());
    }
}
