package com.matchatime.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.global.error.AuthFailureException;
import com.matchatime.backend.modules.auth.domain.AccessToken;
import com.matchatime.backend.modules.user.application.InputValidator;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Password login and the session lifecycle that follows it. Every credential failure answers with the same
 * message; the actual reason is only logged.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String INVALID_CREDENTIALS_MESSAGE = "Invalid email or password";

    private final AppUserRepository appUserRepository;
    private final PasswordHasher passwordHasher;
    private final SessionIssuer sessionIssuer;
    private final AccessTokenService accessTokenService;
    private final RefreshSessionService refreshSessionService;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordHasher passwordHasher,
            SessionIssuer sessionIssuer,
            AccessTokenService accessTokenService,
            RefreshSessionService refreshSessionService
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordHasher = passwordHasher;
        this.sessionIssuer = sessionIssuer;
        this.accessTokenService = accessTokenService;
        this.refreshSessionService = refreshSessionService;
    }

    public SessionTokens login(String email, String password, String clientIp, String deviceInfo) {
        Optional<AppUser> found = appUserRepository.findByEmail(InputValidator.normalizeEmail(email));
        String storedHash = found.flatMap(user -> user.getCredentials().findPasswordHash()).orElse(null);

        // runs the same BCrypt work whether or not there is a hash to compare against
        boolean passwordMatches = passwordHasher.verify(password, storedHash).join();

        if (found.isEmpty()) {
            log.info("Login failed: no account for the given email");
            throw invalidCredentials();
        }
        AppUser user = found.get();
        if (storedHash == null) {
            log.info("Login failed: account {} has no password credential", user.getId());
            throw invalidCredentials();
        }
        if (!passwordMatches) {
            log.info("Login failed: wrong password for account {}", user.getId());
            throw invalidCredentials();
        }
        if (!user.isEmailVerified()) {
            log.info("Login refused: email not verified for account {}", user.getId());
            throw invalidCredentials();
        }

        log.info("User {} logged in", user.getId());
        return sessionIssuer.startSession(user, clientIp, deviceInfo);
    }

    public RefreshResult refresh(String refreshSecret) {
        RotatedRefreshToken rotated = refreshSessionService.rotate(refreshSecret);

        Optional<AppUser> user = appUserRepository.findById(rotated.userId());
        if (user.isEmpty() || !user.get().isEmailVerified()) {
            log.warn("Refresh refused for user {}: account missing or unverified", rotated.userId());
            refreshSessionService.revoke(rotated.secret());
            throw new AuthFailureException("INVALID_REFRESH_TOKEN", RefreshSessionService.INVALID_REFRESH_TOKEN);
        }

        AccessToken accessToken = accessTokenService.mint(user.get().getId(), user.get().getEmail());
        return new RefreshResult(accessToken, rotated);
    }

    /**
     * Never fails: a missing or unknown session is already logged out.
     */
    public void logout(String refreshSecret) {
        if (refreshSecret == null || refreshSecret.isBlank()) {
            return;
        }
        try {
            if (!refreshSessionService.revoke(refreshSecret)) {
                log.debug("Logout with unknown refresh session");
            }
        } catch (DataAccessException e) {
            log.warn("Could not revoke refresh session during logout", e);
        }
    }

    public AppUser currentUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new AuthFailureException("USER_NOT_FOUND", "User not found"));
    }

    private static AuthFailureException invalidCredentials() {
        return new AuthFailureException("INVALID_CREDENTIALS", INVALID_CREDENTIALS_MESSAGE);
    }
}
