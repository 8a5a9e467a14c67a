package com.matchatime.backend.support;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import com.matchatime.backend.modules.user.infrastructure.mail.EmailSender;

/**
 * Keeps outbound mail in memory so tests can pick up the tokens that would have been emailed.
 */
public class RecordingEmailSender implements EmailSender {

    public enum Kind {
        VERIFICATION,
        PASSWORD_RESET,
        PASSWORD_CHANGED
    }

    public record SentMail(Kind kind, String to, String token) {
    }

    private final List<SentMail> sent = new CopyOnWriteArrayList<>();

    @Override
    public void sendVerificationEmail(String to, String username, String token) {
        sent.add(new SentMail(Kind.VERIFICATION, to, token));
    }

    @Override
    public void sendPasswordResetEmail(String to, String username, String token) {
        sent.add(new SentMail(Kind.PASSWORD_RESET, to, token));
    }

    @Override
    public void sendPasswordChangedNotification(String to, String username) {
        sent.add(new SentMail(Kind.PASSWORD_CHANGED, to, null));
    }

    public List<SentMail> sent() {
        return List.copyOf(sent);
    }

    public List<SentMail> sentTo(String to, Kind kind) {
        return sent.stream().filter(mail -> mail.to().equals(to) && mail.kind() == kind).toList();
    }

    public Optional<String> lastToken(String to, Kind kind) {
        List<SentMail> matching = sentTo(to, kind);
        return matching.isEmpty() ? Optional.empty() : Optional.ofNullable(matching.get(matching.size() - 1).token());
    }

    public void clear() {
        sent.clear();
    }
}
