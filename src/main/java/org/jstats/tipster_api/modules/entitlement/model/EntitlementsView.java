package org.jstats.tipster_api.modules.entitlement.model;

import java.time.Instant;
import java.util.Set;

/**
 * What the UI needs to render the model picker's lock state.
 */
public record EntitlementsView(
        Set<String> entitlements,
        EntitlementSet.Origin origin,
        Instant refreshedAt,
        boolean redemptionAvailable
) {

    public static EntitlementsView of(EntitlementSet set, boolean redemptionAvailable) {
        return new EntitlementsView(set.aliases(), set.origin(), set.refreshedAt(), redemptionAvailable);
    }
}
