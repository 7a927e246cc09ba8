package org.jstats.tipster_api.core.upstream;

import java.util.function.Predicate;

/**
 * Decides which upstream errors count against a circuit breaker.
 * <p>
 * A 4xx {@link TransportException} is the upstream answering the caller (a free-tier user gets
 * 403 from the billing service) and is not recorded. Server errors, missing responses, timeouts
 * and anything else are recorded.
 */
public class UpstreamFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof TransportException te) {
            return te.status() < 400 || te.status() >= 500;
        }
        return true;
    }
}
