package com.matchatime.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.matchatime.backend.modules.auth.domain.FederatedIdentity;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.domain.UserStats;
import com.matchatime.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.matchatime.backend.modules.user.infrastructure.persistence.UserStatsRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts a federated account together with its stats row. Each call commits or rolls back on its own so a
 * username collision can be retried with another candidate.
 */
@Component
public class FederatedAccountWriter {

    private final AppUserRepository appUserRepository;
    private final UserStatsRepository userStatsRepository;
    private final Clock clock;

    public FederatedAccountWriter(AppUserRepository appUserRepository, UserStatsRepository userStatsRepository,
                                  Clock clock) {
        this.appUserRepository = appUserRepository;
        this.userStatsRepository = userStatsRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AppUser create(String username, String email, FederatedIdentity identity) {
        AppUser user = AppUser.federated(username, email, identity.externalId(), identity.pictureUrl());
        AppUser saved = appUserRepository.saveAndFlush(user);
        userStatsRepository.save(new UserStats(saved.getId(), OffsetDateTime.now(clock)));
        return saved;
    }
}
