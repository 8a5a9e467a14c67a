package com.matchatime.backend.modules.user.presentation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import com.matchatime.backend.global.security.SecurityUtils;
import com.matchatime.backend.modules.auth.application.AuthService;
import com.matchatime.backend.modules.auth.application.SessionTokens;
import com.matchatime.backend.modules.auth.presentation.ClientContext;
import com.matchatime.backend.modules.auth.presentation.SessionResponses;
import com.matchatime.backend.modules.auth.presentation.dto.LoginResponse;
import com.matchatime.backend.modules.auth.presentation.dto.MessageResponse;
import com.matchatime.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.matchatime.backend.modules.user.application.AccountService;
import com.matchatime.backend.modules.user.application.PasswordResetService;
import com.matchatime.backend.modules.user.application.RegistrationService;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.modules.user.presentation.dto.ChangePasswordRequest;
import com.matchatime.backend.modules.user.presentation.dto.EmailRequest;
import com.matchatime.backend.modules.user.presentation.dto.LanguagePreferencesResponse;
import com.matchatime.backend.modules.user.presentation.dto.LoginRequest;
import com.matchatime.backend.modules.user.presentation.dto.RegisterRequest;
import com.matchatime.backend.modules.user.presentation.dto.ResetPasswordRequest;
import com.matchatime.backend.modules.user.presentation.dto.UpdateLanguagePreferencesRequest;
import com.matchatime.backend.modules.user.presentation.dto.UpdateProfileRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    static final String REGISTERED_MESSAGE = "Registration successful. Please check your email to verify your account.";
    static final String RESET_REQUESTED_MESSAGE = "If an account exists with that email, a password reset link has been sent.";
    static final String RESET_DONE_MESSAGE = "Password has been reset successfully";
    static final String VERIFIED_MESSAGE = "Email verified successfully";
    static final String VERIFICATION_PROCESSED_MESSAGE = "Verification request processed successfully";
    static final String VERIFICATION_RESENT_MESSAGE = "If an unverified account exists with that email, a verification link has been sent.";
    static final String ACCOUNT_DELETED_MESSAGE = "Account deleted successfully";
    static final String LANGUAGES_UPDATED_MESSAGE = "Language preferences updated successfully";

    private final RegistrationService registrationService;
    private final PasswordResetService passwordResetService;
    private final AccountService accountService;
    private final AuthService authService;
    private final SessionResponses sessionResponses;
    private final ClientContext clientContext;

    public UserController(
            RegistrationService registrationService,
            PasswordResetService passwordResetService,
            AccountService accountService,
            AuthService authService,
            SessionResponses sessionResponses,
            ClientContext clientContext
    ) {
        this.registrationService = registrationService;
        this.passwordResetService = passwordResetService;
        this.accountService = accountService;
        this.authService = authService;
        this.sessionResponses = sessionResponses;
        this.clientContext = clientContext;
    }

    @Operation(summary = "Register with email and password",
            description = "Always answers with the same message, also when the username or email is taken.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted"),
            @ApiResponse(responseCode = "400", description = "Input does not meet the format rules")
    })
    @PostMapping("/register")
    public ResponseEntity<MessageResponse> register(@Valid @RequestBody RegisterRequest request) {
        registrationService.register(request.username(), request.email(), request.password());
        return ResponseEntity.ok(new MessageResponse(REGISTERED_MESSAGE));
    }

    @Operation(summary = "Password login")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in; access and refresh cookies set"),
            @ApiResponse(responseCode = "401", description = "Invalid email or password")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        SessionTokens session = authService.login(request.email(), request.password(),
                clientContext.clientIp(http), clientContext.deviceInfo(http));
        return sessionResponses.loginResponse(session);
    }

    @PostMapping("/request-password-reset")
    public ResponseEntity<MessageResponse> requestPasswordReset(@Valid @RequestBody EmailRequest request) {
        passwordResetService.requestPasswordReset(request.email());
        return ResponseEntity.ok(new MessageResponse(RESET_REQUESTED_MESSAGE));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetPassword(request.token(), request.newPassword());
        return ResponseEntity.ok(new MessageResponse(RESET_DONE_MESSAGE));
    }

    @GetMapping("/verify-email")
    public ResponseEntity<MessageResponse> verifyEmail(@RequestParam(name = "token", required = false) String token) {
        boolean verified = registrationService.verifyEmail(token);
        return ResponseEntity.ok(new MessageResponse(verified ? VERIFIED_MESSAGE : VERIFICATION_PROCESSED_MESSAGE));
    }

    @PostMapping("/resend-verification")
    public ResponseEntity<MessageResponse> resendVerification(@Valid @RequestBody EmailRequest request) {
        registrationService.resendVerification(request.email());
        return ResponseEntity.ok(new MessageResponse(VERIFICATION_RESENT_MESSAGE));
    }

    @PatchMapping("/me")
    public ResponseEntity<UserProfileResponse> updateProfile(@RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(UserProfileResponse.from(
                accountService.updateProfile(SecurityUtils.getCurrentUserId(), request.username(), request.email())));
    }

    @PatchMapping("/me/language-preferences")
    public ResponseEntity<LanguagePreferencesResponse> updateLanguagePreferences(
            @RequestBody UpdateLanguagePreferencesRequest request) {
        AppUser user = accountService.updateLanguagePreferences(SecurityUtils.getCurrentUserId(),
                request.nativeLanguage(), request.learningLanguage());
        return ResponseEntity.ok(new LanguagePreferencesResponse(LANGUAGES_UPDATED_MESSAGE,
                UserProfileResponse.from(user)));
    }

    @Operation(summary = "Change password", description = "Signs out every other session and returns a fresh one.")
    @PostMapping("/me/password")
    public ResponseEntity<LoginResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request,
                                                        HttpServletRequest http) {
        SessionTokens session = accountService.changePassword(SecurityUtils.getCurrentUserId(),
                request.currentPassword(), request.newPassword(),
                clientContext.clientIp(http), clientContext.deviceInfo(http));
        return sessionResponses.loginResponse(session);
    }

    @DeleteMapping("/me")
    public ResponseEntity<MessageResponse> deleteAccount() {
        accountService.deleteAccount(SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok()
                .headers(sessionResponses.clearedSessionCookies())
                .body(new MessageResponse(ACCOUNT_DELETED_MESSAGE));
    }
}
