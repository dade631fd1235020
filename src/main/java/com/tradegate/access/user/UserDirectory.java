package com.tradegate.access.user;

import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.DomainModels.User;
import com.tradegate.access.domain.NotFoundException;
import com.tradegate.access.repository.UserJdbcRepository;
import com.tradegate.access.validation.AccessValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Optional;

/**
 * Read side of the subscription/role store, plus the writes the billing system and the
 * admin console push into it.
 */
@Service
public class UserDirectory {
    private static final Logger log = LoggerFactory.getLogger(UserDirectory.class);

    private final UserJdbcRepository repository;

    public UserDirectory(UserJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public User register(User user) {
        if (user.id() == null || user.id().isBlank()) {
            throw new AccessValidationException("MISSING_FIELD", "user.id required", null);
        }
        if (repository.findById(user.id()).isPresent()) {
            throw new AccessValidationException("DUPLICATE_USER", "User already exists: " + user.id(), user.id());
        }
        if (user.guardianId() != null && repository.findById(user.guardianId()).isEmpty()) {
            throw new AccessValidationException("GUARDIAN_NOT_FOUND", "Unknown guardian: " + user.guardianId(), user.id());
        }

        User normalized = new User(user.id(), user.displayName(), user.birthdate(),
                user.roles() == null || user.roles().isEmpty() ? EnumSet.of(Role.USER) : EnumSet.copyOf(user.roles()),
                user.tier() == null ? SubscriptionTier.FREE : user.tier(),
                user.guardianId());
        repository.insert(normalized);
        log.info("Registered user {} tier={} roles={}", normalized.id(), normalized.tier(), normalized.roles());
        return normalized;
    }

    public Optional<User> find(String userId) {
        return repository.findById(userId);
    }

    public User user(String userId) {
        return repository.findById(userId).orElseThrow(() -> new NotFoundException("user", userId));
    }

    @Transactional
    public User changeSubscription(String userId, SubscriptionTier tier) {
        if (repository.updateTier(userId, tier) == 0) {
            throw new NotFoundException("user", userId);
        }
        log.info("Subscription of user {} changed to {}", userId, tier);
        return user(userId);
    }
}
