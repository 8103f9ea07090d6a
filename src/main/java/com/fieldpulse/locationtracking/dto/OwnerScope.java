package com.fieldpulse.locationtracking.dto;

import lombok.*;

/**
 * Identity record as returned by the owner directory: who the user is and
 * which organisation / branch their points are scoped to by default.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OwnerScope {

    private Long uid;
    private String name;
    private String surname;
    private String email;
    private Long organisationId;
    private String organisation;
    private Long branchId;
    private String branch;

}
