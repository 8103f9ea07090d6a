package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.config.CacheConfig;
import com.fieldpulse.locationtracking.dto.OwnerScope;
import com.fieldpulse.locationtracking.entity.TrackedUser;
import com.fieldpulse.locationtracking.repository.TrackedUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * {@link OwnerDirectory} over the local tracked_users table.
 * Hits are cached; unknown ids are not, so a newly added user is visible at once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaOwnerDirectory implements OwnerDirectory {

    private final TrackedUserRepository trackedUserRepository;

    @Override
    @Cacheable(value = CacheConfig.CACHE_OWNER_SCOPES, key = "#ownerId", unless = "#result == null")
    public Optional<OwnerScope> find(Long ownerId) {
        log.debug("[CACHE MISS] Loading owner scope for user {}", ownerId);
        return trackedUserRepository.findById(ownerId).map(JpaOwnerDirectory::toScope);
    }

    private static OwnerScope toScope(TrackedUser user) {
        return OwnerScope.builder()
                .uid(user.getId())
                .name(user.getName())
                .surname(user.getSurname())
                .email(user.getEmail())
                .organisationId(user.getOrganisationId())
                .organisation(user.getOrganisationName())
                .branchId(user.getBranchId())
                .branch(user.getBranchName())
                .build();
    }
}
