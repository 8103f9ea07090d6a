package com.fieldpulse.locationtracking.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.*;

/** A stop annotated with a productivity label (High / Medium / Low / Minimal). */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KeyLocation {

    @JsonUnwrapped
    private Stop stop;

    private String productivity;

}
