package com.psyos.pipeline.repository.scope;

import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The single permitted cross-tenant read: resolving a user by global email while logging in,
 * before any tenant is known. It is a separate type so that no tenant-scoped store can be
 * asked to skip its guard.
 */
@Component
@Slf4j
public class CrossTenantLoginLookup {

    private final UserRepository userRepository;

    public CrossTenantLoginLookup(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Optional<UserEntity> findUserByGlobalEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        Optional<UserEntity> user = userRepository.findFirstByEmailIgnoreCase(email.trim());
        log.info("Cross-tenant login lookup: found={}, tenantId={}",
                user.isPresent(), user.map(UserEntity::getTenantId).orElse(null));
        return user;
    }
}
