package com.fieldpulse.locationtracking.config;

import com.fieldpulse.locationtracking.entity.TrackedUser;
import com.fieldpulse.locationtracking.repository.TrackedUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds a small user directory on startup so the API can be tried locally.
 * Disabled with {@code tracking.seed-data=false}.
 */
@Component
@ConditionalOnProperty(name = "tracking.seed-data", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final TrackedUserRepository trackedUserRepository;

    @Override
    public void run(String... args) {
        if (trackedUserRepository.count() > 0) {
            log.info("User directory already populated, skipping seed");
            return;
        }

        List<TrackedUser> users = List.of(
                TrackedUser.builder().id(1L).name("Thandi").surname("Nkosi").email("thandi.nkosi@fieldpulse.example")
                        .organisationId(10L).organisationName("FieldPulse Gauteng")
                        .branchId(100L).branchName("Johannesburg Central").build(),
                TrackedUser.builder().id(2L).name("Pieter").surname("van Wyk").email("pieter.vanwyk@fieldpulse.example")
                        .organisationId(10L).organisationName("FieldPulse Gauteng")
                        .branchId(101L).branchName("Pretoria East").build(),
                TrackedUser.builder().id(3L).name("Aisha").surname("Patel").email("aisha.patel@fieldpulse.example")
                        .organisationId(20L).organisationName("FieldPulse Western Cape")
                        .branchId(200L).branchName("Cape Town CBD").build()
        );
        trackedUserRepository.saveAll(users);

        log.info("========================================");
        log.info("Seeded {} tracked users", users.size());
        users.forEach(u -> log.info("User ID: {}, {} {}, Branch: {}", u.getId(), u.getName(), u.getSurname(), u.getBranchName()));
        log.info("========================================");
    }
}
