package com.fieldpulse.locationtracking.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What the geocoding provider said about one coordinate, reduced to the cases
 * the resolver treats differently.
 */
@Getter
@AllArgsConstructor
@ToString
public class ReverseGeocodeResponse {

    public enum Status {
        OK,
        /** Definitive: nothing at this coordinate. Not retried. */
        ZERO_RESULTS,
        /** HTTP 429 or provider quota response. Retried with backoff. */
        RATE_LIMITED,
        /** Timeout, connection failure, 5xx. Retried with backoff. */
        TRANSIENT_FAILURE,
        /** Any other non-OK answer (bad key, denied request). Not retried. */
        REJECTED
    }

    private final Status status;
    private final String address;
    private final String message;

    public static ReverseGeocodeResponse ok(String address) {
        return new ReverseGeocodeResponse(Status.OK, address, null);
    }

    public static ReverseGeocodeResponse zeroResults() {
        return new ReverseGeocodeResponse(Status.ZERO_RESULTS, null, "No address found for these coordinates");
    }

    public static ReverseGeocodeResponse rateLimited(String message) {
        return new ReverseGeocodeResponse(Status.RATE_LIMITED, null, message);
    }

    public static ReverseGeocodeResponse transientFailure(String message) {
        return new ReverseGeocodeResponse(Status.TRANSIENT_FAILURE, null, message);
    }

    public static ReverseGeocodeResponse rejected(String message) {
        return new ReverseGeocodeResponse(Status.REJECTED, null, message);
    }

    public boolean isRetryable() {
        return status == Status.RATE_LIMITED || status == Status.TRANSIENT_FAILURE;
    }
}
