package org.jstats.tipster_api.modules.entitlement.service;

import org.jstats.tipster_api.core.upstream.TransportException;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementSet;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedemptionServiceTests {

    private static final Identity ALICE = new Identity("alice", "token-a");

    BillingClient billing;
    EntitlementGate gate;
    RedemptionService service;

    @BeforeEach
    void setUp() {
        billing = mock(BillingClient.class);
        gate = mock(EntitlementGate.class);
        service = new RedemptionService(billing, gate);
    }

    @Test
    void redeemedCoupon_refreshesTheGateImmediately() {
        var unlocked = new EntitlementSet(Set.of("Quick Pick", "Deep Dive"), "alice",
                Instant.parse("2025-01-15T10:00:00Z"), EntitlementSet.Origin.FETCHED);
        when(gate.refresh(ALICE)).thenReturn(unlocked);

        var entitlements = service.redeemCoupon(ALICE, " SPRING25 ");

        assertEquals(unlocked, entitlements);
        InOrder order = inOrder(billing, gate);
        order.verify(billing).redeemCoupon(ALICE, "SPRING25");
        order.verify(gate).refresh(ALICE);
    }

    @Test
    void anonymousCoupon_isRejectedWithoutCallingBilling() {
        assertThrows(IllegalArgumentException.class, () -> service.redeemCoupon(Identity.anonymous(), "SPRING25"));

        verifyNoInteractions(billing, gate);
    }

    @Test
    void failedRedemption_doesNotRefresh() {
        doThrow(new TransportException(BillingClient.SERVICE, 400, "Invalid code", false, null))
                .when(billing).redeemOneTimeCode(any(), anyString(), anyString());

        var ex = assertThrows(TransportException.class, () -> service.redeemOneTimeCode(ALICE, "cs_1", "XYZ"));

        assertEquals("Invalid code", ex.detail());
        verify(gate, never()).refresh(any());
    }
}
