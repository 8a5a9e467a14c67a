package com.matchatime.backend.modules.user.application;

import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.global.error.AuthFailureException;
import com.matchatime.backend.modules.auth.application.ActionTokenService;
import com.matchatime.backend.modules.auth.application.PasswordHasher;
import com.matchatime.backend.modules.auth.application.RefreshSessionService;
import com.matchatime.backend.modules.auth.domain.ActionTokenPurpose;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.infrastructure.mail.EmailSender;
import com.matchatime.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    public static final String INVALID_RESET_TOKEN_MESSAGE = "Reset token is invalid or expired";

    private final AppUserRepository appUserRepository;
    private final ActionTokenService actionTokenService;
    private final RefreshSessionService refreshSessionService;
    private final PasswordHasher passwordHasher;
    private final EmailSender emailSender;
    private final InputValidator inputValidator;
    private final TransactionTemplate transactionTemplate;

    public PasswordResetService(
            AppUserRepository appUserRepository,
            ActionTokenService actionTokenService,
            RefreshSessionService refreshSessionService,
            PasswordHasher passwordHasher,
            EmailSender emailSender,
            InputValidator inputValidator,
            TransactionTemplate transactionTemplate
    ) {
        this.appUserRepository = appUserRepository;
        this.actionTokenService = actionTokenService;
        this.refreshSessionService = refreshSessionService;
        this.passwordHasher = passwordHasher;
        this.emailSender = emailSender;
        this.inputValidator = inputValidator;
        this.transactionTemplate = transactionTemplate;
    }

    public void requestPasswordReset(String email) {
        inputValidator.validateEmail(email);
        Optional<AppUser> found = appUserRepository.findByEmail(InputValidator.normalizeEmail(email));
        if (found.isEmpty()) {
            log.info("Password reset skipped: no account for the given email");
            return;
        }
        AppUser user = found.get();
        if (!user.getCredentials().canUsePassword()) {
            log.info("Password reset skipped: account {} signs in through the federated provider only", user.getId());
            return;
        }

        String token = actionTokenService.issue(user.getId(), ActionTokenPurpose.PASSWORD_RESET);
        try {
            emailSender.sendPasswordResetEmail(user.getEmail(), user.getUsername(), token);
        } catch (RuntimeException e) {
            log.error("Failed to send password reset email", e);
        }
    }

    /**
     * Consumes the reset token, replaces the password and signs the account out everywhere.
     */
    public void resetPassword(String token, String newPassword) {
        inputValidator.validatePassword(newPassword);
        String newHash = passwordHasher.hash(newPassword).join();

        AppUser user = transactionTemplate.execute(status -> {
            Optional<UUID> userId = actionTokenService.consume(token, ActionTokenPurpose.PASSWORD_RESET);
            if (userId.isEmpty()) {
                log.info("Password reset token rejected");
                throw new AuthFailureException("INVALID_RESET_TOKEN", INVALID_RESET_TOKEN_MESSAGE);
            }
            AppUser account = appUserRepository.findById(userId.get())
                    .orElseThrow(() -> new AuthFailureException("INVALID_RESET_TOKEN", INVALID_RESET_TOKEN_MESSAGE));
            account.changePasswordHash(newHash);
            int revoked = refreshSessionService.revokeAll(account.getId());
            log.info("Password reset for account {}; {} sessions revoked", account.getId(), revoked);
            return account;
        });

        try {
            emailSender.sendPasswordChangedNotification(user.getEmail(), user.getUsername());
        } catch (RuntimeException e) {
            log.error("Failed to send password changed notification", e);
        }
    }
}
