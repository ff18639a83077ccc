package in.launchkit.application.service;

import in.launchkit.TestClock;
import in.launchkit.application.port.output.TelegramGateway;
import in.launchkit.config.TelegramSettings;
import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackFixtures;
import in.launchkit.domain.launchpack.LaunchPackInput;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.PublishStatus;
import in.launchkit.domain.launchpack.ScheduleItem;
import in.launchkit.infrastructure.persistence.InMemoryLaunchPackStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramPublishOrchestratorTest {

    private static final Instant START = Instant.parse("2026-01-10T12:00:00Z");
    private static final TelegramSettings SETTINGS = new TelegramSettings(true, "123456:ABC", "-1001");

    @Mock
    private TelegramGateway gateway;

    private TestClock clock;
    private InMemoryLaunchPackStore store;
    private TelegramPublishOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        store = new InMemoryLaunchPackStore(clock);
        orchestrator = new TelegramPublishOrchestrator(store, SETTINGS, gateway, null, clock);
    }

    @Test
    void publish_sendsAndPinsEachPinInOrder() {
        when(gateway.sendMessage(eq("-1001"), anyString())).thenReturn(101L, 102L, 103L);
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "how to buy", "memekit"));

        LaunchPack result = orchestrator.publish(pack.id(), false);

        assertEquals(PublishStatus.PUBLISHED, result.ops().tgPublish().status());
        assertEquals(List.of("101", "102", "103"), result.ops().tgPublish().resultIds());
        assertEquals(START, result.ops().tgPublish().publishedAt());
        assertTrue(result.ops().checked("tg_published"));
        assertEquals("Telegram publish complete", result.ops().auditLog().get(0).message());

        InOrder order = inOrder(gateway);
        order.verify(gateway).sendMessage("-1001", "welcome");
        order.verify(gateway).pinMessage("-1001", 101L);
        order.verify(gateway).sendMessage("-1001", "how to buy");
        order.verify(gateway).pinMessage("-1001", 102L);
        order.verify(gateway).sendMessage("-1001", "memekit");
        order.verify(gateway).pinMessage("-1001", 103L);
    }

    @Test
    void publish_secondCallReturnsSameIdsWithoutRemoteCalls() {
        when(gateway.sendMessage(anyString(), anyString())).thenReturn(101L, 102L, 103L);
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "how to buy", "memekit"));
        LaunchPack first = orchestrator.publish(pack.id(), false);
        clearInvocations(gateway);

        LaunchPack second = orchestrator.publish(pack.id(), false);

        assertEquals(first.ops().tgPublish().resultIds(), second.ops().tgPublish().resultIds());
        assertEquals(first.version(), second.version());
        verifyNoInteractions(gateway);
    }

    @Test
    void publish_skipsBlankPinsAndUsesPackChatId() {
        when(gateway.sendMessage("-2002", "welcome")).thenReturn(7L);
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "", " "));
        store.update(pack.id(), LaunchPackPatch.empty().set("tg.chat_id", "-2002"));

        LaunchPack result = orchestrator.publish(pack.id(), false);

        assertEquals(List.of("7"), result.ops().tgPublish().resultIds());
        verify(gateway, times(1)).sendMessage(anyString(), anyString());
        verify(gateway).pinMessage("-2002", 7L);
    }

    @Test
    void publish_snapshotsScheduleIntent() {
        when(gateway.sendMessage(anyString(), anyString())).thenReturn(1L);
        Instant when = Instant.parse("2026-01-10T16:00:00.123456Z");
        LaunchPack pack = store.create(LaunchPackFixtures.withTelegramSchedule(when));

        LaunchPack result = orchestrator.publish(pack.id(), false);

        List<ScheduleItem> intent = result.ops().tgPublish().scheduleIntent();
        assertEquals(1, intent.size());
        assertEquals(Instant.parse("2026-01-10T16:00:00.123Z"), intent.get(0).when());
        assertEquals("post 1", intent.get(0).text());
    }

    @Test
    void publish_failureIsPersistedAndRetryNeedsForceOrCooldown() {
        when(gateway.sendMessage(anyString(), anyString()))
            .thenThrow(LaunchKitException.external("TG_PUBLISH_FAILED", "Telegram sendMessage failed",
                Map.of("status", 502), null))
            .thenReturn(55L);
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "", ""));

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> orchestrator.publish(pack.id(), false));
        assertEquals("TG_PUBLISH_FAILED", e.getCode());

        LaunchPack failed = store.get(pack.id()).orElseThrow();
        assertEquals(PublishStatus.FAILED, failed.ops().tgPublish().status());
        assertEquals("TG_PUBLISH_FAILED", failed.ops().tgPublish().errorCode());
        assertEquals(START, failed.ops().tgPublish().failedAt());

        clock.advance(Duration.ofMinutes(2));
        LaunchKitException blocked = assertThrows(LaunchKitException.class, () -> orchestrator.publish(pack.id(), false));
        assertEquals("TG_PUBLISH_IN_PROGRESS", blocked.getCode());
        assertEquals(ErrorKind.CONFLICT, blocked.getKind());

        LaunchPack forced = orchestrator.publish(pack.id(), true);
        assertEquals(PublishStatus.PUBLISHED, forced.ops().tgPublish().status());
        assertEquals(List.of("55"), forced.ops().tgPublish().resultIds());
        assertNull(forced.ops().tgPublish().errorCode());
    }

    @Test
    void publish_retryAfterCooldownIsAccepted() {
        when(gateway.sendMessage(anyString(), anyString()))
            .thenThrow(new IllegalStateException("socket closed"))
            .thenReturn(9L);
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "", ""));

        assertThrows(IllegalStateException.class, () -> orchestrator.publish(pack.id(), false));
        assertEquals("TG_PUBLISH_FAILED", store.get(pack.id()).orElseThrow().ops().tgPublish().errorCode());

        clock.advance(Duration.ofMinutes(10));
        assertEquals(PublishStatus.PUBLISHED, orchestrator.publish(pack.id(), false).ops().tgPublish().status());
    }

    @Test
    void publish_pinFailureAbortsWholePublish() {
        when(gateway.sendMessage(anyString(), anyString())).thenReturn(1L, 2L);
        doNothing().doThrow(LaunchKitException.external("TG_PUBLISH_FAILED", "pin failed", Map.of(), null))
            .when(gateway).pinMessage(anyString(), anyLong());
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "how to buy", "memekit"));

        assertThrows(LaunchKitException.class, () -> orchestrator.publish(pack.id(), false));

        verify(gateway, times(2)).sendMessage(anyString(), anyString());
        assertEquals(PublishStatus.FAILED, store.get(pack.id()).orElseThrow().ops().tgPublish().status());
    }

    @Test
    void publish_errorFromGatewayIsPersistedAndForcedRetryCanClaim() {
        when(gateway.sendMessage(anyString(), anyString())).thenThrow(new AssertionError("boom")).thenReturn(7L);
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "", ""));

        AssertionError error = assertThrows(AssertionError.class, () -> orchestrator.publish(pack.id(), false));
        assertEquals("boom", error.getMessage());

        LaunchPack failed = store.get(pack.id()).orElseThrow();
        assertEquals(PublishStatus.FAILED, failed.ops().tgPublish().status());
        assertEquals("TG_PUBLISH_FAILED", failed.ops().tgPublish().errorCode());

        LaunchPack retried = orchestrator.publish(pack.id(), true);
        assertEquals(PublishStatus.PUBLISHED, retried.ops().tgPublish().status());
        assertEquals(List.of("7"), retried.ops().tgPublish().resultIds());
    }

    @Test
    void publish_rejectsDisabledAndMissingConfig() {
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "", ""));

        TelegramPublishOrchestrator disabled = new TelegramPublishOrchestrator(store,
            TelegramSettings.disabled(), gateway, null, clock);
        LaunchKitException off = assertThrows(LaunchKitException.class, () -> disabled.publish(pack.id(), false));
        assertEquals("TG_DISABLED", off.getCode());
        assertEquals(ErrorKind.DISABLED, off.getKind());

        TelegramPublishOrchestrator unconfigured = new TelegramPublishOrchestrator(store,
            new TelegramSettings(true, null, ""), gateway, null, clock);
        LaunchKitException missing = assertThrows(LaunchKitException.class, () -> unconfigured.publish(pack.id(), false));
        assertEquals("TG_CONFIG_MISSING", missing.getCode());
        assertEquals(List.of("TG_BOT_TOKEN", "TG_CHAT_ID"), missing.missingKeys());

        verifyNoInteractions(gateway);
    }

    @Test
    void publish_requiresReadinessChecklist() {
        LaunchPackInput input = LaunchPackFixtures.input("King Dog", "king");
        LaunchPack pack = store.create(input);

        LaunchKitException e = assertThrows(LaunchKitException.class, () -> orchestrator.publish(pack.id(), false));

        assertEquals("TG_NOT_READY", e.getCode());
        assertEquals(ErrorKind.VALIDATION, e.getKind());
        assertEquals(1, store.get(pack.id()).orElseThrow().version());
    }

    @Test
    void publish_concurrentCallerSeesConflictAndSideEffectHappensOnce() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(gateway.sendMessage(anyString(), anyString())).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return 77L;
        });
        LaunchPack pack = store.create(LaunchPackFixtures.withPins("welcome", "", ""));
        ExecutorService pool = Executors.newSingleThreadExecutor();

        Future<LaunchPack> first = pool.submit(() -> orchestrator.publish(pack.id(), false));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        LaunchKitException conflict = assertThrows(LaunchKitException.class, () -> orchestrator.publish(pack.id(), false));
        assertEquals("TG_PUBLISH_IN_PROGRESS", conflict.getCode());

        release.countDown();
        LaunchPack published = first.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(List.of("77"), published.ops().tgPublish().resultIds());
        verify(gateway, times(1)).sendMessage(anyString(), anyString());
        verify(gateway, times(1)).pinMessage(anyString(), anyLong());
    }
}
