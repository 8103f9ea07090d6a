package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchIngestResult {

    private int total;
    private int stored;
    private int skipped;
    private int failed;
    private List<IngestResult> results;

}
