package org.jstats.tipster_api.core.upstream;

import org.jspecify.annotations.Nullable;

/**
 * A call to an upstream service did not produce a 2xx response.
 * <p>
 * {@code status} is the HTTP status the upstream answered with, or {@link #NO_RESPONSE}
 * when the call failed before a response arrived (connection refused, timeout, DNS).
 * No automatic retry is attempted for these; the caller decides.
 */
public class TransportException extends RuntimeException {

    public static final int NO_RESPONSE = 0;

    private final String service;
    private final int status;
    private final @Nullable String detail;
    private final boolean timedOut;

    public TransportException(String service, int status, @Nullable String detail, boolean timedOut, @Nullable Throwable cause) {
        super(describe(service, status, detail, timedOut), cause);
        this.service = service;
        this.status = status;
        this.detail = detail;
        this.timedOut = timedOut;
    }

    public String service() {
        return service;
    }

    public int status() {
        return status;
    }

    public @Nullable String detail() {
        return detail;
    }

    public boolean timedOut() {
        return timedOut;
    }

    public boolean hasResponse() {
        return status != NO_RESPONSE;
    }

    private static String describe(String service, int status, @Nullable String detail, boolean timedOut) {
        String leading;
        if (timedOut) {
            leading = "Request to " + service + " timed out";
        } else if (status == NO_RESPONSE) {
            leading = "Request to " + service + " failed without a response";
        } else {
            leading = "Request to " + service + " failed with status " + status;
        }
        return detail == null || detail.isBlank() ? leading : leading + ": " + detail;
    }
}
