package com.fieldpulse.locationtracking.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MultiUserReportRequest {

    @NotEmpty(message = "At least one user ID is required")
    @Size(max = 100, message = "Maximum of 100 users can be processed at once")
    private List<Long> userIds;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate startDate;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate endDate;

    private Long organisationId;

    private Long branchId;

}
