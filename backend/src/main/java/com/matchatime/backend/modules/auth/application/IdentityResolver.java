package com.matchatime.backend.modules.auth.application;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import com.matchatime.backend.modules.auth.domain.FederatedIdentity;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps a provider-verified identity to a local account: by external id, then by email (linking the identity to
 * an existing password account), else by creating a new account.
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final int MAX_USERNAME_LENGTH = 30;
    static final String FALLBACK_USERNAME = "user";

    private final AppUserRepository appUserRepository;
    private final FederatedAccountWriter accountWriter;

    public IdentityResolver(AppUserRepository appUserRepository, FederatedAccountWriter accountWriter) {
        this.appUserRepository = appUserRepository;
        this.accountWriter = accountWriter;
    }

    @Transactional
    public AppUser resolve(FederatedIdentity identity) {
        String email = identity.email().trim().toLowerCase(Locale.ROOT);
        return findExisting(email, identity).orElseGet(() -> createWithAvailableUsername(email, identity));
    }

    private Optional<AppUser> findExisting(String email, FederatedIdentity identity) {
        Optional<AppUser> byExternalId = appUserRepository.findByGoogleId(identity.externalId());
        if (byExternalId.isPresent()) {
            AppUser user = byExternalId.get();
            refreshPicture(user, identity.pictureUrl());
            return byExternalId;
        }

        Optional<AppUser> byEmail = appUserRepository.findByEmail(email);
        if (byEmail.isPresent()) {
            AppUser user = byEmail.get();
            if (!user.getCredentials().isFederated()) {
                user.linkFederatedIdentity(identity.externalId());
                if (identity.pictureUrl() != null) {
                    user.setProfilePictureUrl(identity.pictureUrl());
                }
                log.info("Linked federated identity to existing account {}", user.getId());
            } else {
                refreshPicture(user, identity.pictureUrl());
            }
        }
        return byEmail;
    }

    private AppUser createWithAvailableUsername(String email, FederatedIdentity identity) {
        String base = baseUsername(identity.name(), email);
        int suffix = 1;
        while (true) {
            String candidate = candidate(base, suffix);
            if (appUserRepository.existsByUsername(candidate)) {
                suffix++;
                continue;
            }
            try {
                AppUser created = accountWriter.create(candidate, email, identity);
                log.info("Created federated account {} with username {}", created.getId(), candidate);
                return created;
            } catch (DataIntegrityViolationException e) {
                // a parallel first sign-in for the same identity committed first
                Optional<AppUser> winner = findExisting(email, identity);
                if (winner.isPresent()) {
                    log.info("Federated account created concurrently; using account {}", winner.get().getId());
                    return winner.get();
                }
                if (!appUserRepository.existsByUsername(candidate)) {
                    throw e;
                }
                log.debug("Username {} taken concurrently, trying next suffix", candidate);
                suffix++;
            }
        }
    }

    static String baseUsername(String displayName, String email) {
        String source = (displayName != null && !displayName.isBlank())
                ? displayName
                : email.substring(0, Math.max(0, email.indexOf('@')));
        String sanitized = source.replaceAll("[^A-Za-z0-9_-]", "");
        if (sanitized.length() < 3) {
            return FALLBACK_USERNAME;
        }
        return sanitized.length() > MAX_USERNAME_LENGTH ? sanitized.substring(0, MAX_USERNAME_LENGTH) : sanitized;
    }

    /**
     * First attempt is the bare base; later attempts append 2, 3, ... and shorten the base to stay within the limit.
     */
    static String candidate(String base, int attempt) {
        if (attempt <= 1) {
            return base;
        }
        String suffix = Integer.toString(attempt);
        int room = MAX_USERNAME_LENGTH - suffix.length();
        String head = base.length() > room ? base.substring(0, room) : base;
        return head + suffix;
    }

    private static void refreshPicture(AppUser user, String pictureUrl) {
        if (pictureUrl != null && !Objects.equals(pictureUrl, user.getProfilePictureUrl())) {
            user.setProfilePictureUrl(pictureUrl);
        }
    }
}
