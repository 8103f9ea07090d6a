package com.fieldpulse.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Read model of the user directory: the people whose devices report locations.
 * Only existence and organisational scope matter to tracking.
 */
@Entity
@Table(name = "tracked_users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackedUser {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    private String surname;

    private String email;

    private Long organisationId;

    private String organisationName;

    private Long branchId;

    private String branchName;

}
