package org.jstats.tipster_api;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.jstats.tipster_api.core.upstream.TransportException;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jstats.tipster_api.modules.entitlement.service.BillingClient;
import org.jstats.tipster_api.modules.entitlement.service.EntitlementGate;
import org.jstats.tipster_api.modules.prediction.registry.ModelRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URI;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "tipster.upstream.models.base-url=http://models.test",
        // nothing listens here
        "tipster.upstream.billing.base-url=http://localhost:1",
        "tipster.entitlements.refresh-interval=1h"
})
class TipsterApiApplicationTests {

    @Autowired
    ModelRegistry registry;

    @Autowired
    EntitlementGate gate;

    @Autowired
    BillingClient billing;

    @Test
    void contextWiresTheRegistryFromConfiguration() {
        assertEquals(URI.create("http://models.test:8006/predict"), registry.require("Edge Finder").endpoint());
    }

    @Autowired
    CircuitBreakerRegistry breakers;

    @Test
    void unknownCallersStartOnTheFreeTier() {
        var alice = new Identity("alice", "token-a");
        assertTrue(gate.isEntitled(alice, "Quick Pick"));
        assertFalse(gate.isEntitled(alice, "Stacked"));
        assertFalse(gate.isEntitled(Identity.anonymous(), "Stacked"));
    }

    @Test
    void forbiddenAnswersDoNotOpenTheEntitlementBreaker() {
        var breaker = breakers.circuitBreaker("entitlements");
        try {
            for (int i = 0; i < 10; i++) {
                breaker.onError(0, TimeUnit.MILLISECONDS,
                        new TransportException("billing service", 403, "Forbidden", false, null));
            }
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
            assertTrue(breaker.tryAcquirePermission());
            breaker.releasePermission();

            for (int i = 0; i < 10; i++) {
                breaker.onError(0, TimeUnit.MILLISECONDS,
                        new TransportException("billing service", 503, "Unavailable", false, null));
            }
            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        } finally {
            breaker.reset();
        }
    }

    @Test
    void entitlementFetchIsGuardedByTheCircuitBreaker() {
        assertTrue(AopUtils.isAopProxy(billing));
    }
}
