package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.ReverseGeocodeResponse;

/**
 * One reverse-geocoding request against an external provider. Implementations
 * never throw for provider or network failures; they report them as a status.
 */
public interface ReverseGeocodingClient {

    ReverseGeocodeResponse reverseGeocode(double latitude, double longitude);
}
