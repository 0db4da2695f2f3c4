package com.flagship.telehealth_booking.identity;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only lookups of user roles.
 */
@Service
@RequiredArgsConstructor
public class UserDirectory {

    private final UserAccountRepository userAccountRepository;

    @Transactional(readOnly = true)
    public Optional<Caller> resolve(UUID userId) {
        return userAccountRepository.findById(userId)
                .map(UserAccountEntity::toCaller);
    }

    @Transactional(readOnly = true)
    public Optional<Role> roleOf(UUID userId) {
        return userAccountRepository.findById(userId)
                .map(UserAccountEntity::getRole);
    }
}
