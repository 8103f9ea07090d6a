package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one ingestion attempt. A rejected sample is not an error:
 * {@code stored} is false and the reason travels in {@code warnings}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestResult {

    private boolean stored;
    private String message;
    private TrackingPointView data;

    @Builder.Default
    private List<IngestWarning> warnings = new ArrayList<>();

    public static IngestResult skipped(String message, IngestWarning warning) {
        return IngestResult.builder()
                .stored(false)
                .message(message)
                .warnings(new ArrayList<>(List.of(warning)))
                .build();
    }

}
