package org.jstats.tipster_api.modules.entitlement.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.core.upstream.TransportException;
import org.jstats.tipster_api.modules.entitlement.config.EntitlementConfig;
import org.jstats.tipster_api.modules.entitlement.config.EntitlementConfig.EntitlementProperties;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementSet;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.jstats.tipster_api.modules.entitlement.model.ModelChoice;
import org.jstats.tipster_api.modules.prediction.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Locally cached view of the model aliases each signed-in caller may use.
 * <p>
 * One session per subject, bound to the bearer token the billing service accepted for it. A
 * caller only sees a session's set when it presents that same token; anyone else (no token, an
 * anonymous caller, or another token for the same subject) sees the default set until a fetch
 * with its own token succeeds.
 * <p>
 * Readers never block. Refreshes for one subject are serialized on that subject's lock, so
 * different callers never wait on each other's billing calls. Sessions are polled every
 * {@code tipster.entitlements.refresh-interval} and dropped after
 * {@code tipster.entitlements.session-idle-timeout} without requests. Any fetch failure resets
 * the session to the default set.
 */
@Component
public class EntitlementGate {

    private static final Logger log = LoggerFactory.getLogger(EntitlementGate.class);

    private record Session(Identity identity, EntitlementSet entitlements) {}

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        volatile @Nullable Session session;
        volatile Instant lastSeen;

        Slot(Instant lastSeen) {
            this.lastSeen = lastSeen;
        }
    }

    private final BillingClient billing;
    private final ModelRegistry registry;
    private final EntitlementProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final Set<Identity> pending = ConcurrentHashMap.newKeySet();
    private volatile @Nullable ScheduledFuture<?> periodicRefresh;

    public EntitlementGate(
            BillingClient billing,
            ModelRegistry registry,
            EntitlementProperties properties,
            @Qualifier(EntitlementConfig.ENTITLEMENT_SCHEDULER) ScheduledExecutorService scheduler,
            Clock clock) {
        this.billing = billing;
        this.registry = registry;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
        // fail fast on a misconfigured default; it must be a registered model
        registry.require(properties.defaultAlias());
    }

    @PostConstruct
    public void start() {
        var interval = properties.refreshInterval().toMillis();
        periodicRefresh = scheduler.scheduleWithFixedDelay(this::pollSessions, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Entitlement gate started (refresh every {} ms, default '{}')", interval, properties.defaultAlias());
    }

    /**
     * Cancels the periodic refresh and discards every cached session.
     */
    @PreDestroy
    public void stop() {
        var task = periodicRefresh;
        if (task != null) {
            task.cancel(true);
            periodicRefresh = null;
        }
        slots.clear();
        pending.clear();
        log.info("Entitlement gate stopped");
    }

    /**
     * The set visible to {@code identity} right now. Never blocks and never calls the billing service.
     */
    public EntitlementSet entitlementsFor(Identity identity) {
        if (!canHoldEntitlements(identity)) {
            return defaultSet(identity, EntitlementSet.Origin.DEFAULT);
        }
        var slot = slots.get(identity.subject());
        var session = slot == null ? null : slot.session;
        if (session == null || !Objects.equals(session.identity().credential(), identity.credential())) {
            return defaultSet(identity, EntitlementSet.Origin.DEFAULT);
        }
        return session.entitlements();
    }

    public Set<String> currentEntitlements(Identity identity) {
        return entitlementsFor(identity).aliases();
    }

    public boolean isEntitled(Identity identity, String alias) {
        return entitlementsFor(identity).contains(alias);
    }

    /**
     * @return true while at least one premium model is not in {@code entitlements}, i.e. redeeming a code would unlock something
     */
    public boolean redemptionAvailable(EntitlementSet entitlements) {
        return registry.premiumModels().stream().anyMatch(m -> !entitlements.contains(m.alias()));
    }

    public List<ModelChoice> modelChoices(EntitlementSet entitlements) {
        return registry.all().stream()
                .map(m -> ModelChoice.of(m, entitlements.contains(m.alias())))
                .toList();
    }

    /**
     * Records a request from {@code identity} and returns the set it may use for that request.
     * A signed-in caller without a session for its token gets the default set and an immediate
     * background refresh; the returned set is never wider than what that token was granted.
     */
    public EntitlementSet switchIdentity(Identity identity) {
        var visible = entitlementsFor(identity);
        if (!canHoldEntitlements(identity)) {
            return visible;
        }
        slotFor(identity).lastSeen = clock.instant();
        if (visible.origin() == EntitlementSet.Origin.DEFAULT && pending.add(identity)) {
            log.info("No entitlements cached for {}; refreshing", identity);
            try {
                scheduler.execute(() -> {
                    try {
                        safeRefresh(identity);
                    } finally {
                        pending.remove(identity);
                    }
                });
            } catch (RejectedExecutionException rejected) {
                pending.remove(identity);
                log.warn("Could not schedule entitlement refresh for {}: scheduler is shut down", identity);
            }
        }
        return visible;
    }

    /**
     * Fetches the entitlements of {@code identity} and stores them in its session. Never throws
     * for upstream failures: those reset the session to the default set. Callers without a
     * subject or a bearer token always get the default set and cause no billing call.
     *
     * @return the set visible to {@code identity} after this refresh
     */
    public EntitlementSet refresh(Identity identity) {
        if (!canHoldEntitlements(identity)) {
            if (log.isDebugEnabled()) {
                log.debug("Not fetching entitlements for {}: a subject and a bearer token are required", identity);
            }
            return defaultSet(identity, EntitlementSet.Origin.DEFAULT);
        }
        var slot = slotFor(identity);
        slot.lastSeen = clock.instant();
        slot.lock.lock();
        try {
            return store(identity.subject(), slot, identity, fetch(identity));
        } finally {
            slot.lock.unlock();
        }
    }

    int sessionCount() {
        return slots.size();
    }

    // caller holds slot.lock
    private EntitlementSet store(@Nullable String subject, Slot slot, Identity identity, EntitlementSet next) {
        if (subject == null || slots.get(subject) != slot) {
            log.info("Discarding entitlements fetched for {}: session ended", identity);
            return defaultSet(identity, EntitlementSet.Origin.DEFAULT);
        }
        var current = slot.session;
        if (next.origin() == EntitlementSet.Origin.FAIL_CLOSED && current != null
                && !Objects.equals(current.identity().credential(), identity.credential())) {
            // a rejected token leaves the session of the accepted one alone
            return next;
        }
        slot.session = new Session(identity, next);
        if (log.isDebugEnabled()) {
            log.debug("Entitlements for {} now {} ({})", identity, next.aliases(), next.origin());
        }
        return next;
    }

    private EntitlementSet fetch(Identity identity) {
        try {
            var aliases = billing.fetchEntitlements(identity);
            for (String alias : aliases) {
                if (registry.find(alias).isEmpty() && log.isDebugEnabled()) {
                    log.debug("Entitlement '{}' does not name a registered model", alias);
                }
            }
            return new EntitlementSet(new LinkedHashSet<>(aliases), identity.subject(), clock.instant(), EntitlementSet.Origin.FETCHED);
        } catch (TransportException te) {
            if (te.status() == 403) {
                log.warn("Not authorized for premium models (403) for {}. Defaulting to free tier.", identity);
            } else {
                log.error("Failed to fetch entitlements for {}: {}. Defaulting to free tier.", identity, te.getMessage());
            }
        } catch (RuntimeException ex) {
            log.error("Failed to fetch entitlements for {}: {}. Defaulting to free tier.", identity, ex.toString());
        }
        return defaultSet(identity, EntitlementSet.Origin.FAIL_CLOSED);
    }

    private void pollSessions() {
        var now = clock.instant();
        var idleTimeout = properties.sessionIdleTimeout();
        slots.forEach((subject, slot) -> {
            if (slot.lastSeen.plus(idleTimeout).isBefore(now)) {
                if (slots.remove(subject, slot)) {
                    log.info("Entitlement session for {} expired after {} without requests", subject, idleTimeout);
                }
                return;
            }
            // an exception escaping a scheduled task would cancel all later runs
            try {
                poll(subject, slot);
            } catch (RuntimeException ex) {
                log.error("Entitlement poll for {} failed unexpectedly", subject, ex);
            }
        });
    }

    private void poll(String subject, Slot slot) {
        slot.lock.lock();
        try {
            var session = slot.session;
            if (session != null) {
                store(subject, slot, session.identity(), fetch(session.identity()));
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private void safeRefresh(Identity identity) {
        try {
            refresh(identity);
        } catch (RuntimeException ex) {
            log.error("Entitlement refresh for {} failed unexpectedly", identity, ex);
        }
    }

    private Slot slotFor(Identity identity) {
        return slots.computeIfAbsent(Objects.requireNonNull(identity.subject()), s -> new Slot(clock.instant()));
    }

    private static boolean canHoldEntitlements(Identity identity) {
        return !identity.isAnonymous() && identity.credential() != null;
    }

    private EntitlementSet defaultSet(Identity identity, EntitlementSet.Origin origin) {
        return new EntitlementSet(Set.of(properties.defaultAlias()), identity.subject(), clock.instant(), origin);
    }
}
