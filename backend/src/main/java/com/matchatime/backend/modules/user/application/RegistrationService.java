package com.matchatime.backend.modules.user.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.modules.auth.application.ActionTokenService;
import com.matchatime.backend.modules.auth.application.PasswordHasher;
import com.matchatime.backend.modules.auth.domain.ActionTokenPurpose;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.domain.UserStats;
import com.matchatime.backend.modules.user.infrastructure.mail.EmailSender;
import com.matchatime.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.matchatime.backend.modules.user.infrastructure.persistence.UserStatsRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Sign-up and email verification. Outcomes that would reveal whether an account exists are logged and then
 * reported to the caller exactly like success.
 */
@Service
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final AppUserRepository appUserRepository;
    private final UserStatsRepository userStatsRepository;
    private final ActionTokenService actionTokenService;
    private final PasswordHasher passwordHasher;
    private final EmailSender emailSender;
    private final InputValidator inputValidator;
    private final TransactionTemplate transactionTemplate;
    private final Duration unverifiedRetention;
    private final Clock clock;

    public RegistrationService(
            AppUserRepository appUserRepository,
            UserStatsRepository userStatsRepository,
            ActionTokenService actionTokenService,
            PasswordHasher passwordHasher,
            EmailSender emailSender,
            InputValidator inputValidator,
            TransactionTemplate transactionTemplate,
            @Value("${app.jobs.unverified-retention:P7D}") Duration unverifiedRetention,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userStatsRepository = userStatsRepository;
        this.actionTokenService = actionTokenService;
        this.passwordHasher = passwordHasher;
        this.emailSender = emailSender;
        this.inputValidator = inputValidator;
        this.transactionTemplate = transactionTemplate;
        this.unverifiedRetention = unverifiedRetention;
        this.clock = clock;
    }

    public void register(String username, String email, String password) {
        inputValidator.validateUsername(username);
        inputValidator.validateEmail(email);
        inputValidator.validatePassword(password);
        String normalizedEmail = InputValidator.normalizeEmail(email);

        // hash even on conflict so both paths cost the same
        String passwordHash = passwordHasher.hash(password).join();

        if (appUserRepository.existsByUsername(username) || appUserRepository.existsByEmail(normalizedEmail)) {
            log.info("Registration skipped: username or email already in use");
            return;
        }

        PendingVerification pending;
        try {
            pending = transactionTemplate.execute(status -> {
                AppUser user = appUserRepository.saveAndFlush(AppUser.withPassword(username, normalizedEmail, passwordHash));
                userStatsRepository.save(new UserStats(user.getId(), OffsetDateTime.now(clock)));
                String token = actionTokenService.issue(user.getId(), ActionTokenPurpose.EMAIL_VERIFICATION);
                return new PendingVerification(user.getEmail(), user.getUsername(), token);
            });
        } catch (DataIntegrityViolationException e) {
            log.info("Registration skipped: concurrent sign-up took the username or email");
            return;
        }

        log.info("Registered new account for username {}", username);
        sendVerification(pending);
    }

    /**
     * @return {@code true} only when this call verified the address
     */
    @Transactional
    public boolean verifyEmail(String token) {
        Optional<UUID> userId = actionTokenService.consume(token, ActionTokenPurpose.EMAIL_VERIFICATION);
        if (userId.isEmpty()) {
            log.info("Email verification token rejected");
            return false;
        }
        Optional<AppUser> user = appUserRepository.findById(userId.get());
        if (user.isEmpty()) {
            return false;
        }
        if (user.get().isEmailVerified()) {
            return false;
        }
        user.get().setEmailVerified(true);
        log.info("Email verified for account {}", userId.get());
        return true;
    }

    public void resendVerification(String email) {
        inputValidator.validateEmail(email);
        Optional<AppUser> found = appUserRepository.findByEmail(InputValidator.normalizeEmail(email));
        if (found.isEmpty()) {
            log.info("Verification resend skipped: no account for the given email");
            return;
        }
        AppUser user = found.get();
        if (user.isEmailVerified()) {
            log.info("Verification resend skipped: account {} already verified", user.getId());
            return;
        }
        String token = actionTokenService.issue(user.getId(), ActionTokenPurpose.EMAIL_VERIFICATION);
        sendVerification(new PendingVerification(user.getEmail(), user.getUsername(), token));
    }

    @Transactional
    public int purgeStaleUnverifiedAccounts() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(unverifiedRetention);
        return appUserRepository.deleteUnverifiedCreatedBefore(cutoff);
    }

    private void sendVerification(PendingVerification pending) {
        try {
            emailSender.sendVerificationEmail(pending.email(), pending.username(), pending.token());
        } catch (RuntimeException e) {
            log.error("Failed to send verification email", e);
        }
    }

    private record PendingVerification(String email, String username, String token) {
    }
}
