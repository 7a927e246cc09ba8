package org.jstats.tipster_api.modules.entitlement.service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.jstats.tipster_api.core.upstream.TransportException;
import org.jstats.tipster_api.modules.entitlement.config.EntitlementConfig.EntitlementProperties;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementSet;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jstats.tipster_api.modules.entitlement.model.ModelChoice;
import org.jstats.tipster_api.modules.prediction.registry.ModelRegistry;
import org.jstats.tipster_api.modules.prediction.registry.UnknownModelException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class EntitlementGateTests {

    private static final Identity ALICE = new Identity("alice", "token-a");
    private static final Identity BOB = new Identity("bob", "token-b");
    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");
    private static final List<String> ALL_MODELS = List.of("Quick Pick", "Form Cruncher", "Deep Dive", "Stacked", "Edge Finder");

    BillingClient billing;
    ScheduledExecutorService scheduler;
    Clock clock;
    EntitlementGate gate;

    @BeforeEach
    void setUp() {
        billing = mock(BillingClient.class);
        scheduler = mock(ScheduledExecutorService.class);
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        gate = newGate(clock);
    }

    private EntitlementGate newGate(Clock clock) {
        return new EntitlementGate(billing, ModelRegistry.forHost("http://localhost"),
                new EntitlementProperties(Duration.ofSeconds(30), "Quick Pick", Duration.ofMinutes(30)), scheduler, clock);
    }

    private Runnable scheduledRefresh() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).execute(task.capture());
        return task.getValue();
    }

    @Test
    void unknownCaller_seesTheDefaultSet() {
        var set = gate.entitlementsFor(ALICE);

        assertEquals(Set.of("Quick Pick"), set.aliases());
        assertEquals(EntitlementSet.Origin.DEFAULT, set.origin());
        assertTrue(gate.redemptionAvailable(set));
        verifyNoInteractions(billing);
    }

    @Test
    void misconfiguredDefaultAlias_failsFast() {
        assertThrows(UnknownModelException.class, () -> new EntitlementGate(billing, ModelRegistry.forHost("http://localhost"),
                new EntitlementProperties(Duration.ofSeconds(30), "Missing", Duration.ofMinutes(30)), scheduler, clock));
    }

    @Test
    void successfulRefresh_storesTheSetForThatToken() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(List.of("Quick Pick", "Form Cruncher", "Deep Dive"));

        var refreshed = gate.refresh(ALICE);

        assertEquals(Set.of("Quick Pick", "Form Cruncher", "Deep Dive"), refreshed.aliases());
        assertEquals(EntitlementSet.Origin.FETCHED, refreshed.origin());
        assertEquals("alice", refreshed.subject());
        assertEquals(refreshed, gate.entitlementsFor(ALICE));
        assertTrue(gate.isEntitled(ALICE, "Deep Dive"));
        assertFalse(gate.isEntitled(ALICE, "Stacked"));
        assertTrue(gate.redemptionAvailable(refreshed));
    }

    @Test
    void callerWithoutToken_neverSeesTheSubjectsSet() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(ALL_MODELS);
        gate.refresh(ALICE);
        var noToken = new Identity("alice", null);

        assertEquals(Set.of("Quick Pick"), gate.switchIdentity(noToken).aliases());
        assertEquals(Set.of("Quick Pick"), gate.refresh(noToken).aliases());
        assertEquals(Set.of("Quick Pick"), gate.refresh(Identity.anonymous()).aliases());

        verify(billing, times(1)).fetchEntitlements(any());
        verify(scheduler, never()).execute(any());
        assertTrue(gate.isEntitled(ALICE, "Edge Finder"));
    }

    @Test
    void foreignTokenForTheSubject_isRefusedAndLeavesTheSessionAlone() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(ALL_MODELS);
        gate.refresh(ALICE);
        var mallory = new Identity("alice", "mallory-token");
        when(billing.fetchEntitlements(mallory))
                .thenThrow(new TransportException(BillingClient.SERVICE, 403, "Forbidden", false, null));

        assertEquals(Set.of("Quick Pick"), gate.switchIdentity(mallory).aliases());
        scheduledRefresh().run();

        assertFalse(gate.isEntitled(mallory, "Edge Finder"));
        assertEquals(EntitlementSet.Origin.FETCHED, gate.entitlementsFor(ALICE).origin());
        assertTrue(gate.isEntitled(ALICE, "Edge Finder"));
    }

    @Test
    void rotatedTokenAcceptedByBilling_takesOverTheSession() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(List.of("Quick Pick", "Stacked"));
        gate.refresh(ALICE);
        var rotated = new Identity("alice", "token-a2");
        when(billing.fetchEntitlements(rotated)).thenReturn(List.of("Quick Pick", "Stacked"));

        assertEquals(Set.of("Quick Pick"), gate.switchIdentity(rotated).aliases());
        scheduledRefresh().run();

        assertEquals(Set.of("Quick Pick", "Stacked"), gate.currentEntitlements(rotated));
        assertEquals(Set.of("Quick Pick"), gate.currentEntitlements(ALICE));
    }

    @Test
    void forbidden_resetsToQuickPickOnly() {
        when(billing.fetchEntitlements(ALICE))
                .thenReturn(ALL_MODELS)
                .thenThrow(new TransportException(BillingClient.SERVICE, 403, "Forbidden", false, null));

        assertFalse(gate.redemptionAvailable(gate.refresh(ALICE)));

        var refreshed = gate.refresh(ALICE);

        assertEquals(Set.of("Quick Pick"), refreshed.aliases());
        assertEquals(EntitlementSet.Origin.FAIL_CLOSED, gate.entitlementsFor(ALICE).origin());
        assertFalse(gate.isEntitled(ALICE, "Edge Finder"));
    }

    @Test
    void anyFailure_failsClosed() {
        var breaker = CircuitBreaker.ofDefaults("entitlements");
        when(billing.fetchEntitlements(ALICE))
                .thenReturn(List.of("Quick Pick", "Stacked"))
                .thenThrow(new TransportException(BillingClient.SERVICE, TransportException.NO_RESPONSE, "refused", false, null))
                .thenReturn(List.of("Quick Pick", "Stacked"))
                .thenThrow(new BillingClient.MalformedEntitlementsException("missing 'entitlements' array"))
                .thenReturn(List.of("Quick Pick", "Stacked"))
                .thenThrow(CallNotPermittedException.createCallNotPermittedException(breaker));

        for (int i = 0; i < 3; i++) {
            assertEquals(Set.of("Quick Pick", "Stacked"), gate.refresh(ALICE).aliases());
            assertEquals(Set.of("Quick Pick"), gate.refresh(ALICE).aliases());
            assertEquals(Set.of("Quick Pick"), gate.currentEntitlements(ALICE));
        }
    }

    @Test
    void newCaller_getsTheDefaultSetAndOneImmediateRefresh() {
        when(billing.fetchEntitlements(BOB)).thenReturn(List.of("Quick Pick", "Edge Finder"));

        assertEquals(Set.of("Quick Pick"), gate.switchIdentity(BOB).aliases());
        gate.switchIdentity(BOB);
        scheduledRefresh().run();

        assertEquals(Set.of("Quick Pick", "Edge Finder"), gate.currentEntitlements(BOB));
        assertTrue(gate.switchIdentity(BOB).contains("Edge Finder"));
        verify(scheduler, times(1)).execute(any());
    }

    @Test
    void callersAreIsolatedFromEachOther() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(ALL_MODELS);
        when(billing.fetchEntitlements(BOB))
                .thenThrow(new TransportException(BillingClient.SERVICE, 403, "Forbidden", false, null));

        gate.refresh(ALICE);
        gate.switchIdentity(BOB);
        gate.refresh(BOB);

        assertTrue(gate.isEntitled(ALICE, "Edge Finder"));
        assertFalse(gate.isEntitled(BOB, "Edge Finder"));
        assertEquals(EntitlementSet.Origin.FAIL_CLOSED, gate.entitlementsFor(BOB).origin());
    }

    @Test
    void interleavedCallers_neverSeeEachOthersSet() throws Exception {
        when(billing.fetchEntitlements(ALICE)).thenReturn(ALL_MODELS);
        when(billing.fetchEntitlements(BOB)).thenReturn(List.of("Quick Pick"));
        var leaked = new AtomicBoolean();

        var aliceRefreshes = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 200; i++) {
                gate.refresh(ALICE);
            }
        });
        var bobReads = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 200; i++) {
                gate.refresh(BOB);
                if (gate.switchIdentity(BOB).contains("Edge Finder")) {
                    leaked.set(true);
                }
            }
        });
        CompletableFuture.allOf(aliceRefreshes, bobReads).get(10, TimeUnit.SECONDS);

        assertFalse(leaked.get());
        assertTrue(gate.isEntitled(ALICE, "Edge Finder"));
    }

    @Test
    void readsDoNotBlockWhileARefreshIsInFlight() throws Exception {
        var fetchStarted = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        when(billing.fetchEntitlements(ALICE)).thenAnswer(inv -> {
            fetchStarted.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of("Quick Pick", "Deep Dive");
        });

        var refresh = CompletableFuture.supplyAsync(() -> gate.refresh(ALICE));
        assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));

        // old set stays visible until the swap
        assertEquals(Set.of("Quick Pick"), gate.currentEntitlements(ALICE));
        assertFalse(gate.isEntitled(ALICE, "Deep Dive"));

        release.countDown();
        assertEquals(Set.of("Quick Pick", "Deep Dive"), refresh.get(5, TimeUnit.SECONDS).aliases());
        assertTrue(gate.isEntitled(ALICE, "Deep Dive"));
    }

    @Test
    void refreshesOfDifferentCallers_doNotWaitOnEachOther() throws Exception {
        var release = new CountDownLatch(1);
        var fetchStarted = new CountDownLatch(1);
        when(billing.fetchEntitlements(ALICE)).thenAnswer(inv -> {
            fetchStarted.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of("Quick Pick", "Deep Dive");
        });
        when(billing.fetchEntitlements(BOB)).thenReturn(List.of("Quick Pick", "Stacked"));

        var aliceRefresh = CompletableFuture.supplyAsync(() -> gate.refresh(ALICE));
        assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));

        var bobRefresh = CompletableFuture.supplyAsync(() -> gate.refresh(BOB));
        assertEquals(Set.of("Quick Pick", "Stacked"), bobRefresh.get(5, TimeUnit.SECONDS).aliases());
        assertFalse(aliceRefresh.isDone());

        release.countDown();
        aliceRefresh.get(5, TimeUnit.SECONDS);
    }

    @Test
    void fetchCompletingAfterStop_isDiscarded() {
        when(billing.fetchEntitlements(ALICE)).thenAnswer(inv -> {
            // the gate shuts down while alice's fetch is in flight
            gate.stop();
            return ALL_MODELS;
        });

        var visible = gate.refresh(ALICE);

        assertEquals(Set.of("Quick Pick"), visible.aliases());
        assertEquals(Set.of("Quick Pick"), gate.currentEntitlements(ALICE));
        assertEquals(0, gate.sessionCount());
    }

    @Test
    void modelChoices_markLockedModels() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(List.of("Quick Pick", "Form Cruncher", "Stacked"));

        var choices = gate.modelChoices(gate.refresh(ALICE));

        assertEquals(5, choices.size());
        assertEquals(List.of("Quick Pick", "Form Cruncher", "Stacked"),
                choices.stream().filter(ModelChoice::allowed).map(ModelChoice::alias).toList());
        assertEquals(List.of("Deep Dive", "Edge Finder"),
                choices.stream().filter(ModelChoice::locked).map(ModelChoice::alias).toList());
    }

    @Test
    void unregisteredEntitlements_areKept() {
        when(billing.fetchEntitlements(ALICE)).thenReturn(List.of("Quick Pick", "Beta Model"));

        assertTrue(gate.refresh(ALICE).contains("Beta Model"));
    }

    @Test
    void startSchedulesPeriodicRefresh_andStopCancelsIt() {
        ScheduledFuture<?> task = mock(ScheduledFuture.class);
        doReturn(task).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(30_000L), eq(30_000L), eq(TimeUnit.MILLISECONDS));
        when(billing.fetchEntitlements(ALICE)).thenReturn(List.of("Quick Pick", "Stacked"));

        gate.start();
        gate.refresh(ALICE);
        gate.stop();

        verify(task).cancel(true);
        assertEquals(Set.of("Quick Pick"), gate.currentEntitlements(ALICE));
        assertEquals(0, gate.sessionCount());
    }

    @Test
    void scheduledRun_pollsActiveSessions_andDropsIdleOnes() {
        var mutableClock = mock(Clock.class);
        when(mutableClock.instant()).thenReturn(NOW);
        gate = newGate(mutableClock);
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        when(billing.fetchEntitlements(ALICE)).thenReturn(List.of("Quick Pick"), List.of("Quick Pick", "Deep Dive"));
        when(billing.fetchEntitlements(BOB)).thenReturn(List.of("Quick Pick", "Stacked"));
        gate.refresh(ALICE);
        gate.refresh(BOB);

        gate.start();
        ArgumentCaptor<Runnable> poll = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(poll.capture(), anyLong(), anyLong(), any(TimeUnit.class));

        when(mutableClock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(20)));
        gate.switchIdentity(ALICE);
        when(mutableClock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(40)));
        poll.getValue().run();

        verify(billing, times(2)).fetchEntitlements(ALICE);
        verify(billing, times(1)).fetchEntitlements(BOB);
        assertTrue(gate.isEntitled(ALICE, "Deep Dive"));
        assertFalse(gate.isEntitled(BOB, "Stacked"));
        assertEquals(1, gate.sessionCount());
    }
}
