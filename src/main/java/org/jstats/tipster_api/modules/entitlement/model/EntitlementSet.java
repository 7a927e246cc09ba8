package org.jstats.tipster_api.modules.entitlement.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Aliases a caller may currently use. Immutable; the gate replaces it wholesale.
 *
 * @param aliases     entitled model aliases, in the order the billing service listed them
 * @param subject     caller the set belongs to, null for anonymous callers
 * @param refreshedAt when the set was produced
 * @param origin      whether the set was fetched or is the default set
 */
public record EntitlementSet(
        Set<String> aliases,
        @Nullable String subject,
        Instant refreshedAt,
        Origin origin
) {

    public enum Origin {
        /** Session start or identity change; no fetch has completed yet. */
        DEFAULT,
        /** Returned by the billing service. */
        FETCHED,
        /** The last refresh failed and the set was reset to the default. */
        FAIL_CLOSED
    }

    public EntitlementSet {
        aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
    }

    public boolean contains(String alias) {
        return aliases.contains(alias);
    }
}
