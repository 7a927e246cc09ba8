package org.jstats.tipster_api.modules.entitlement.model;

import org.jspecify.annotations.Nullable;

/**
 * The caller on whose behalf upstream services are called.
 * <p>
 * Cached entitlements belong to a subject and the token they were fetched with; the same subject
 * with another token has to be confirmed by the billing service before it sees them.
 *
 * @param subject    user id from the identity provider, null for anonymous callers
 * @param credential bearer token, null when the caller is not signed in
 */
public record Identity(@Nullable String subject, @Nullable String credential) {

    public static final String USER_ID_HEADER = "X-User-Id";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Identity ANONYMOUS = new Identity(null, null);

    public Identity {
        subject = subject == null || subject.isBlank() ? null : subject.trim();
        credential = credential == null || credential.isBlank() ? null : credential.trim();
    }

    public static Identity anonymous() {
        return ANONYMOUS;
    }

    /**
     * Builds the identity of an HTTP caller from its {@code X-User-Id} and {@code Authorization}
     * headers. Only {@code Bearer} authorization is understood; any other scheme is ignored.
     */
    public static Identity fromHeaders(@Nullable String userId, @Nullable String authorization) {
        String token = null;
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            token = authorization.substring(BEARER_PREFIX.length());
        }
        return new Identity(userId, token);
    }

    public boolean isAnonymous() {
        return subject == null;
    }

    // never print the token
    @Override
    public String toString() {
        return "Identity[subject=" + (subject == null ? "anonymous" : subject)
                + ", credential=" + (credential == null ? "none" : "***") + "]";
    }
}
