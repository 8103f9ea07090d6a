package com.fieldpulse.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeocodingStatus {

    private int successful;
    private int failed;
    private boolean usedFallback;

}
