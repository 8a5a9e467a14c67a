package com.matchatime.backend.modules.user.infrastructure.mail;

/**
 * Outbound account mail. Implementations may throw; callers log and carry on.
 */
public interface EmailSender {

    void sendVerificationEmail(String to, String username, String token);

    void sendPasswordResetEmail(String to, String username, String token);

    void sendPasswordChangedNotification(String to, String username);
}
