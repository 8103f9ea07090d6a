package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestWarning {

    private WarningType type;
    private String message;
    private Map<String, Object> details;

}
