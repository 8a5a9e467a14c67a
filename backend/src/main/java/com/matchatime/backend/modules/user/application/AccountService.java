package com.matchatime.backend.modules.user.application;

import java.util.Objects;
import java.util.UUID;

import com.matchatime.backend.global.error.AuthFailureException;
import com.matchatime.backend.global.error.ConflictFailureException;
import com.matchatime.backend.global.error.NotFoundException;
import com.matchatime.backend.modules.auth.application.ActionTokenService;
import com.matchatime.backend.modules.auth.application.PasswordHasher;
import com.matchatime.backend.modules.auth.application.RefreshSessionService;
import com.matchatime.backend.modules.auth.application.SessionIssuer;
import com.matchatime.backend.modules.auth.application.SessionTokens;
import com.matchatime.backend.modules.auth.domain.ActionTokenPurpose;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.infrastructure.mail.EmailSender;
import com.matchatime.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Self-service changes to the signed-in account.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AppUserRepository appUserRepository;
    private final ActionTokenService actionTokenService;
    private final RefreshSessionService refreshSessionService;
    private final SessionIssuer sessionIssuer;
    private final PasswordHasher passwordHasher;
    private final EmailSender emailSender;
    private final InputValidator inputValidator;
    private final TransactionTemplate transactionTemplate;

    public AccountService(
            AppUserRepository appUserRepository,
            ActionTokenService actionTokenService,
            RefreshSessionService refreshSessionService,
            SessionIssuer sessionIssuer,
            PasswordHasher passwordHasher,
            EmailSender emailSender,
            InputValidator inputValidator,
            TransactionTemplate transactionTemplate
    ) {
        this.appUserRepository = appUserRepository;
        this.actionTokenService = actionTokenService;
        this.refreshSessionService = refreshSessionService;
        this.sessionIssuer = sessionIssuer;
        this.passwordHasher = passwordHasher;
        this.emailSender = emailSender;
        this.inputValidator = inputValidator;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Applies the non-null fields. A new email address has to be verified again.
     */
    public AppUser updateProfile(UUID userId, String username, String email) {
        if (username != null) {
            inputValidator.validateUsername(username);
        }
        if (email != null) {
            inputValidator.validateEmail(email);
        }
        String normalizedEmail = email == null ? null : InputValidator.normalizeEmail(email);

        ProfileChange change = transactionTemplate.execute(status -> {
            AppUser user = appUserRepository.findById(userId)
                    .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User not found"));

            if (username != null && !username.equals(user.getUsername())) {
                if (appUserRepository.existsByUsername(username)) {
                    throw new ConflictFailureException("USERNAME_TAKEN", "Username is already taken");
                }
                user.setUsername(username);
            }

            String verificationToken = null;
            if (normalizedEmail != null && !Objects.equals(normalizedEmail, user.getEmail())) {
                if (appUserRepository.existsByEmail(normalizedEmail)) {
                    throw new ConflictFailureException("EMAIL_TAKEN", "Email is already in use");
                }
                user.setEmail(normalizedEmail);
                user.setEmailVerified(false);
                verificationToken = actionTokenService.issue(user.getId(), ActionTokenPurpose.EMAIL_VERIFICATION);
            }
            appUserRepository.flush();
            return new ProfileChange(user, verificationToken);
        });

        if (change.verificationToken() != null) {
            log.info("Email changed for account {}; verification required", userId);
            try {
                emailSender.sendVerificationEmail(change.user().getEmail(), change.user().getUsername(),
                        change.verificationToken());
            } catch (RuntimeException e) {
                log.error("Failed to send verification email", e);
            }
        }
        return change.user();
    }

    /**
     * Replaces the password after checking the current one, ends every other session and starts a fresh one.
     */
    public SessionTokens changePassword(UUID userId, String currentPassword, String newPassword, String clientIp,
                                        String deviceInfo) {
        inputValidator.validatePassword(newPassword);
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new AuthFailureException("USER_NOT_FOUND", "User not found"));

        String storedHash = user.getCredentials().findPasswordHash().orElse(null);
        boolean matches = passwordHasher.verify(currentPassword, storedHash).join();
        if (!matches) {
            log.info("Password change refused for account {}: current password did not match", userId);
            throw new AuthFailureException("INVALID_CREDENTIALS", "Current password is incorrect");
        }
        String newHash = passwordHasher.hash(newPassword).join();

        AppUser updated = transactionTemplate.execute(status -> {
            AppUser account = appUserRepository.findById(userId)
                    .orElseThrow(() -> new AuthFailureException("USER_NOT_FOUND", "User not found"));
            account.changePasswordHash(newHash);
            int revoked = refreshSessionService.revokeAll(userId);
            log.info("Password changed for account {}; {} sessions revoked", userId, revoked);
            return account;
        });

        try {
            emailSender.sendPasswordChangedNotification(updated.getEmail(), updated.getUsername());
        } catch (RuntimeException e) {
            log.error("Failed to send password changed notification", e);
        }
        return sessionIssuer.startSession(updated, clientIp, deviceInfo);
    }

    @Transactional
    public AppUser updateLanguagePreferences(UUID userId, String nativeLanguage, String learningLanguage) {
        String nativeCode = inputValidator.validateLanguageCode(nativeLanguage);
        String learningCode = inputValidator.validateLanguageCode(learningLanguage);
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User not found"));
        user.changeLanguagePreferences(nativeCode, learningCode);
        return user;
    }

    @Transactional
    public void deleteAccount(UUID userId) {
        if (!appUserRepository.existsById(userId)) {
            throw new NotFoundException("USER_NOT_FOUND", "User not found");
        }
        appUserRepository.deleteById(userId);
        log.info("Account {} deleted", userId);
    }

    private record ProfileChange(AppUser user, String verificationToken) {
    }
}
