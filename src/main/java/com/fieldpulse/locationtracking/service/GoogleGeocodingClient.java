package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.GoogleGeocodeResponse;
import com.fieldpulse.locationtracking.dto.ReverseGeocodeResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Google Maps reverse-geocoding over HTTP.
 *
 * GET {base-url}?latlng={lat},{lon}&key={api-key}. Timeouts are set on the
 * RestTemplate (see GeocodingClientConfig). The first result's formatted
 * address is used.
 */
@Service
@Slf4j
public class GoogleGeocodingClient implements ReverseGeocodingClient {

    private final RestTemplate restTemplate;

    @Value("${tracking.geocoding.api-key:}")
    private String apiKey;

    @Value("${tracking.geocoding.base-url:https://maps.googleapis.com/maps/api/geocode/json}")
    private String baseUrl;

    public GoogleGeocodingClient(@Qualifier("geocodingRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ReverseGeocodeResponse reverseGeocode(double latitude, double longitude) {
        if (!StringUtils.hasText(apiKey)) {
            return ReverseGeocodeResponse.rejected("Geocoding API key not configured");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("latlng", latitude + "," + longitude)
                .queryParam("key", apiKey)
                .build()
                .toUri();

        try {
            GoogleGeocodeResponse body = restTemplate.getForObject(uri, GoogleGeocodeResponse.class);
            return interpret(body);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return ReverseGeocodeResponse.rateLimited("Geocoding API rate limit exceeded");
            }
            return ReverseGeocodeResponse.rejected("Geocoding API error: HTTP " + e.getStatusCode().value());
        } catch (HttpServerErrorException e) {
            return ReverseGeocodeResponse.transientFailure("Geocoding API error: HTTP " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.debug("Geocoding request to {} failed: {}", baseUrl, e.getMessage());
            return ReverseGeocodeResponse.transientFailure("Geocoding failed: " + e.getMessage());
        } catch (RestClientException e) {
            return ReverseGeocodeResponse.transientFailure("Geocoding failed: " + e.getMessage());
        }
    }

    private ReverseGeocodeResponse interpret(GoogleGeocodeResponse body) {
        if (body == null || body.getStatus() == null) {
            return ReverseGeocodeResponse.transientFailure("Empty geocoding response");
        }
        switch (body.getStatus()) {
            case "OK":
                if (body.getResults() == null || body.getResults().isEmpty()
                        || !StringUtils.hasText(body.getResults().get(0).getFormattedAddress())) {
                    return ReverseGeocodeResponse.rejected("No results in geocoding response");
                }
                return ReverseGeocodeResponse.ok(body.getResults().get(0).getFormattedAddress());
            case "ZERO_RESULTS":
                return ReverseGeocodeResponse.zeroResults();
            case "OVER_QUERY_LIMIT":
                return ReverseGeocodeResponse.rateLimited("Geocoding API rate limit exceeded");
            case "UNKNOWN_ERROR":
                return ReverseGeocodeResponse.transientFailure("Geocoding API error: UNKNOWN_ERROR");
            default:
                String detail = body.getErrorMessage() != null ? " (" + body.getErrorMessage() + ")" : "";
                return ReverseGeocodeResponse.rejected("Geocoding API error: " + body.getStatus() + detail);
        }
    }
}
