package com.matchatime.backend.modules.user.domain;

import java.util.Objects;

import com.matchatime.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

/**
 * Account row. The password hash and federated id columns are only reachable through {@link UserCredentials}.
 */
@Entity
@Table(name = "users")
public class AppUser extends AbstractAuditedEntity {

    @Column(name = "username", nullable = false, unique = true, length = 30)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "google_id", unique = true, length = 255)
    private String googleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "auth_provider", nullable = false, length = 16)
    private AuthProvider authProvider;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "profile_picture_url", length = 2048)
    private String profilePictureUrl;

    @Column(name = "native_language", length = 2)
    private String nativeLanguage;

    @Column(name = "learning_language", length = 2)
    private String learningLanguage;

    protected AppUser() {
    }

    private AppUser(String username, String email, UserCredentials credentials, AuthProvider authProvider,
                    boolean emailVerified) {
        this.username = username;
        this.email = email;
        this.authProvider = authProvider;
        this.emailVerified = emailVerified;
        setCredentials(credentials);
    }

    public static AppUser withPassword(String username, String email, String passwordHash) {
        return new AppUser(username, email, new UserCredentials.PasswordOnly(passwordHash), AuthProvider.PASSWORD, false);
    }

    /**
     * Federated sign-ups start verified: the provider vouched for the email address.
     */
    public static AppUser federated(String username, String email, String federatedId, String profilePictureUrl) {
        AppUser user = new AppUser(username, email, new UserCredentials.FederatedOnly(federatedId),
                AuthProvider.FEDERATED, true);
        user.profilePictureUrl = profilePictureUrl;
        return user;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public UserCredentials getCredentials() {
        return UserCredentials.of(passwordHash, googleId);
    }

    public void setCredentials(UserCredentials credentials) {
        Objects.requireNonNull(credentials, "credentials");
        this.passwordHash = credentials.findPasswordHash().orElse(null);
        this.googleId = credentials.findFederatedId().orElse(null);
    }

    public void linkFederatedIdentity(String federatedId) {
        setCredentials(getCredentials().withFederatedId(federatedId));
        this.authProvider = AuthProvider.FEDERATED;
        this.emailVerified = true;
    }

    public void changePasswordHash(String newPasswordHash) {
        setCredentials(getCredentials().withPasswordHash(newPasswordHash));
    }

    public AuthProvider getAuthProvider() {
        return authProvider;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public void setEmailVerified(boolean emailVerified) {
        this.emailVerified = emailVerified;
    }

    public String getProfilePictureUrl() {
        return profilePictureUrl;
    }

    public void setProfilePictureUrl(String profilePictureUrl) {
        this.profilePictureUrl = profilePictureUrl;
    }

    public String getNativeLanguage() {
        return nativeLanguage;
    }

    public String getLearningLanguage() {
        return learningLanguage;
    }

    public void changeLanguagePreferences(String nativeLanguage, String learningLanguage) {
        this.nativeLanguage = nativeLanguage;
        this.learningLanguage = learningLanguage;
    }
}
