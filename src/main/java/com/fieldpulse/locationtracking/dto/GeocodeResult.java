package com.fieldpulse.locationtracking.dto;

import lombok.*;

/**
 * Result of resolving one coordinate pair. Exactly one of address / error is set.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeocodeResult {

    private String address;
    private String error;

    // true when the provider answered definitively that nothing is there
    private boolean noResults;

    public static GeocodeResult resolved(String address) {
        return GeocodeResult.builder().address(address).build();
    }

    public static GeocodeResult failed(String error) {
        return GeocodeResult.builder().error(error).build();
    }

    public static GeocodeResult empty(String error) {
        return GeocodeResult.builder().error(error).noResults(true).build();
    }

    public boolean isResolved() {
        return address != null;
    }

}
