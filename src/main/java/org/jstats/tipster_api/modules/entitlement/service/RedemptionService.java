package org.jstats.tipster_api.modules.entitlement.service;

import org.jstats.tipster_api.modules.entitlement.model.AccessStatus;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementSet;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coupon and one-time code redemption. A successful redemption refreshes the gate right away so
 * the unlocked models are usable without waiting for the next poll.
 */
@Service
public class RedemptionService {

    private static final Logger log = LoggerFactory.getLogger(RedemptionService.class);

    private final BillingClient billing;
    private final EntitlementGate gate;

    public RedemptionService(BillingClient billing, EntitlementGate gate) {
        this.billing = billing;
        this.gate = gate;
    }

    /**
     * @return the entitlement set after the post-redemption refresh
     * @throws IllegalArgumentException when the caller has no subject to credit the coupon to
     */
    public EntitlementSet redeemCoupon(Identity identity, String couponCode) {
        if (identity.isAnonymous()) {
            throw new IllegalArgumentException("Coupon redemption requires a signed-in user");
        }
        billing.redeemCoupon(identity, couponCode.trim());
        return refreshAfterRedemption(identity);
    }

    public EntitlementSet redeemOneTimeCode(Identity identity, String sessionId, String oneTimeCode) {
        billing.redeemOneTimeCode(identity, sessionId.trim(), oneTimeCode.trim());
        return refreshAfterRedemption(identity);
    }

    public AccessStatus accessStatus(Identity identity, @Nullable String sessionId) {
        return billing.accessStatus(identity, sessionId);
    }

    private EntitlementSet refreshAfterRedemption(Identity identity) {
        var entitlements = gate.refresh(identity);
        log.info("Entitlements after redemption for {}: {}", identity, entitlements.aliases());
        return entitlements;
    }
}
