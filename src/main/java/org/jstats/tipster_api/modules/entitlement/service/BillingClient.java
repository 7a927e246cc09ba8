package org.jstats.tipster_api.modules.entitlement.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.jspecify.annotations.Nullable;
import org.jstats.tipster_api.core.config.UpstreamClientsConfig;
import org.jstats.tipster_api.core.upstream.UpstreamErrors;
import org.jstats.tipster_api.modules.entitlement.model.AccessStatus;
import org.jstats.tipster_api.modules.entitlement.model.EntitlementsResponse;
import org.jstats.tipster_api.modules.entitlement.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP access to the billing service: entitlements, access status and code redemption.
 */
@Component
public class BillingClient {

    private static final Logger log = LoggerFactory.getLogger(BillingClient.class);

    static final String SERVICE = "billing service";

    private final RestClient http;
    private final ObjectMapper mapper;

    public BillingClient(
            @Qualifier(UpstreamClientsConfig.BILLING) RestClient http,
            ObjectMapper mapper) {
        this.http = http;
        this.mapper = mapper;
    }

    /**
     * GET /entitlements
     * - 2xx {"entitlements": [...]} -> the aliases
     * - 2xx without a readable entitlements array -> MalformedEntitlementsException
     * - 403 / other non-2xx / IO -> TransportException
     * <p>
     * Guarded by the {@code entitlements} circuit breaker; while it is open the call fails
     * immediately with {@code CallNotPermittedException}.
     */
    @CircuitBreaker(name = "entitlements")
    public List<String> fetchEntitlements(Identity identity) {
        if (log.isDebugEnabled()) {
            log.debug("Calling billing GET /entitlements for {}", identity);
        }
        String body;
        try {
            body = http.get()
                    .uri(u -> {
                        u.path("/entitlements");
                        if (identity.subject() != null) {
                            u.queryParam("firebase_uid", identity.subject());
                        }
                        return u.build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> bearer(h, identity.credential()))
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(), (req, res) -> {
                        throw UpstreamErrors.statusError(res);
                    })
                    .body(String.class);
        } catch (RestClientException ex) {
            throw UpstreamErrors.translate(SERVICE, ex, mapper);
        }
        return parseEntitlements(body);
    }

    /**
     * GET /purchase/status
     */
    public AccessStatus accessStatus(Identity identity, @Nullable String sessionId) {
        try {
            var status = http.get()
                    .uri(u -> {
                        u.path("/purchase/status");
                        if (identity.subject() != null) {
                            u.queryParam("firebase_uid", identity.subject());
                        }
                        if (sessionId != null && !sessionId.isBlank()) {
                            u.queryParam("session_id", sessionId);
                        }
                        return u.build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> bearer(h, identity.credential()))
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(), (req, res) -> {
                        throw UpstreamErrors.statusError(res);
                    })
                    .body(AccessStatus.class);
            return status == null ? new AccessStatus(false, null, null) : status;
        } catch (RestClientException ex) {
            throw UpstreamErrors.translate(SERVICE, ex, mapper);
        }
    }

    /**
     * POST /purchase/coupon {firebase_uid, coupon_code}
     */
    public void redeemCoupon(Identity identity, String couponCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("firebase_uid", identity.subject());
        body.put("coupon_code", couponCode);
        post("/purchase/coupon", body, identity.credential());
        log.info("Coupon redeemed for {}", identity);
    }

    /**
     * POST /purchase/one-time {session_id, one_time_code}
     */
    public void redeemOneTimeCode(Identity identity, String sessionId, String oneTimeCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("one_time_code", oneTimeCode);
        post("/purchase/one-time", body, identity.credential());
        log.info("One-time code redeemed for session {}", sessionId);
    }

    private void post(String path, Map<String, Object> body, @Nullable String credential) {
        try {
            http.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> bearer(h, credential))
                    .body(body)
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(), (req, res) -> {
                        throw UpstreamErrors.statusError(res);
                    })
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw UpstreamErrors.translate(SERVICE, ex, mapper);
        }
    }

    private List<String> parseEntitlements(@Nullable String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedEntitlementsException("empty body");
        }
        EntitlementsResponse parsed;
        try {
            parsed = mapper.readValue(body, EntitlementsResponse.class);
        } catch (JsonProcessingException jpe) {
            throw new MalformedEntitlementsException(jpe.getOriginalMessage());
        }
        if (parsed == null || parsed.entitlements() == null) {
            throw new MalformedEntitlementsException("missing 'entitlements' array");
        }
        for (String alias : parsed.entitlements()) {
            if (alias == null || alias.isBlank()) {
                throw new MalformedEntitlementsException("blank entitlement in " + parsed.entitlements());
            }
        }
        return List.copyOf(parsed.entitlements());
    }

    private static void bearer(HttpHeaders headers, @Nullable String credential) {
        if (credential != null) {
            headers.setBearerAuth(credential);
        }
    }

    /**
     * The billing service answered 2xx with a body that is not {@code {"entitlements": [string]}}.
     */
    public static final class MalformedEntitlementsException extends RuntimeException {
        MalformedEntitlementsException(String msg) {
            super("Malformed entitlements response: " + msg);
        }
    }
}
