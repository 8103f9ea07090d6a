package com.fieldpulse.locationtracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * Envelope for every REST response: {success, message, data, warnings}.
 * Warnings are only serialized when present (ingestion endpoints).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiResponse {

    private boolean success;
    private String message;
    private Object data;
    private List<IngestWarning> warnings;

    public static ApiResponse success(Object data, String message) {
        return ApiResponse.builder().success(true).message(message).data(data).build();
    }

    public static ApiResponse error(String message) {
        return ApiResponse.builder().success(false).message(message).build();
    }

    public static ApiResponse error(String message, Object data) {
        return ApiResponse.builder().success(false).message(message).data(data).build();
    }

}
