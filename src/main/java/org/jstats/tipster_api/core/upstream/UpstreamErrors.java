package org.jstats.tipster_api.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;

/**
 * Translates {@link RestClientException}s into {@link TransportException}s.
 * <p>
 * Upstream services answer errors FastAPI-style ({@code {"detail": ...}}); the detail is lifted
 * out of the body when present, otherwise a short body preview is kept.
 */
public final class UpstreamErrors {

    private static final Logger log = LoggerFactory.getLogger(UpstreamErrors.class);

    private static final int PREVIEW_LIMIT = 500;

    private UpstreamErrors() {
    }

    /**
     * Returns the exception to throw for a failed call. When the calling thread was interrupted
     * the call was cancelled, and a {@link CancellationException} is returned instead.
     */
    public static RuntimeException translate(String service, RestClientException ex, ObjectMapper mapper) {
        if (Thread.currentThread().isInterrupted()) {
            var cancelled = new CancellationException("Call to " + service + " was cancelled");
            cancelled.initCause(ex);
            return cancelled;
        }
        if (ex instanceof RestClientResponseException rre) {
            var status = rre.getStatusCode().value();
            var detail = extractDetail(rre.getResponseBodyAsByteArray(), mapper);
            if (log.isWarnEnabled()) {
                log.warn("{} answered HTTP {}{}", service, status, detail == null ? "" : ": " + detail);
            }
            return new TransportException(service, status, detail, false, ex);
        }
        if (ex instanceof ResourceAccessException) {
            var timedOut = isTimeout(ex);
            if (log.isWarnEnabled()) {
                log.warn("{} unreachable ({}): {}", service, timedOut ? "timeout" : "I/O", ex.getMessage());
            }
            return new TransportException(service, TransportException.NO_RESPONSE, ex.getMessage(), timedOut, ex);
        }
        if (log.isWarnEnabled()) {
            log.warn("Call to {} failed: {}", service, ex.getMessage());
        }
        return new TransportException(service, TransportException.NO_RESPONSE, ex.getMessage(), false, ex);
    }

    /**
     * Handler body for {@code onStatus(s -> !s.is2xxSuccessful(), ...)}: reads the error body and
     * raises it as a {@link RestClientResponseException} so that {@link #translate} sees every
     * non-2xx status, including 3xx.
     */
    public static RestClientResponseException statusError(ClientHttpResponse response) throws IOException {
        var status = response.getStatusCode();
        var statusText = response.getStatusText();
        var body = response.getBody().readAllBytes();
        return new RestClientResponseException("HTTP " + status.value() + " " + statusText,
                status, statusText, response.getHeaders(), body, StandardCharsets.UTF_8);
    }

    static @Nullable String extractDetail(byte @Nullable [] body, ObjectMapper mapper) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            JsonNode parsed = mapper.readTree(body);
            if (parsed != null && parsed.hasNonNull("detail")) {
                var detail = parsed.get("detail");
                // FastAPI validation errors carry a list of objects rather than a string
                return detail.isTextual() ? detail.asText() : detail.toString();
            }
        } catch (IOException notJson) {
            if (log.isDebugEnabled()) {
                log.debug("Error body is not JSON, keeping a preview: {}", notJson.getMessage());
            }
        }
        var preview = new String(body, 0, Math.min(body.length, PREVIEW_LIMIT), StandardCharsets.UTF_8).trim();
        return preview.isEmpty() ? null : preview;
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
