package com.matchatime.backend.global.web.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.Arrays;

import com.matchatime.backend.support.AbstractIntegrationTest;
import com.matchatime.backend.support.TestUserFactory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultMatcher;

@TestPropertySource(properties = "app.timing.floor=150ms")
class TimingNormalizationIntegrationTest extends AbstractIntegrationTest {

    private static final long FLOOR_MILLIS = 150;
    private static final long TOLERANCE_MILLIS = 30;
    private static final int SAMPLES = 5;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    @DisplayName("reset requests for known and unknown emails are indistinguishable by latency")
    void passwordResetLatencyDoesNotRevealAccounts() throws Exception {
        testUserFactory.createVerifiedUser("alice", "alice@example.com", "password123");
        requestReset("warmup@example.com");

        long[] existing = new long[SAMPLES];
        long[] missing = new long[SAMPLES];
        // interleaved so drift in the test machine hits both sides equally
        for (int i = 0; i < SAMPLES; i++) {
            existing[i] = requestReset("alice@example.com");
            missing[i] = requestReset("nobody@example.com");
        }

        assertThat(Arrays.stream(existing).min().getAsLong()).isGreaterThanOrEqualTo(FLOOR_MILLIS);
        assertThat(Arrays.stream(missing).min().getAsLong()).isGreaterThanOrEqualTo(FLOOR_MILLIS);
        assertThat(Math.abs(median(existing) - median(missing))).isLessThanOrEqualTo(TOLERANCE_MILLIS);
    }

    @Test
    @DisplayName("wrong password and unknown account fail login in the same time")
    void loginLatencyDoesNotRevealAccounts() throws Exception {
        testUserFactory.createVerifiedUser("alice", "alice@example.com", "password123");
        login("warmup@example.com", "password123", status().isUnauthorized());

        long[] wrongPassword = new long[SAMPLES];
        long[] unknownAccount = new long[SAMPLES];
        for (int i = 0; i < SAMPLES; i++) {
            wrongPassword[i] = login("alice@example.com", "wrong-password1", status().isUnauthorized());
            unknownAccount[i] = login("nobody@example.com", "wrong-password1", status().isUnauthorized());
        }

        assertThat(Arrays.stream(wrongPassword).min().getAsLong()).isGreaterThanOrEqualTo(FLOOR_MILLIS);
        assertThat(Arrays.stream(unknownAccount).min().getAsLong()).isGreaterThanOrEqualTo(FLOOR_MILLIS);
        assertThat(Math.abs(median(wrongPassword) - median(unknownAccount))).isLessThanOrEqualTo(TOLERANCE_MILLIS);
    }

    @Test
    void successfulLoginIsPaddedToo() throws Exception {
        testUserFactory.createVerifiedUser("alice", "alice@example.com", "password123");

        assertThat(login("alice@example.com", "password123", status().isOk())).isGreaterThanOrEqualTo(FLOOR_MILLIS);
    }

    private long requestReset(String email) throws Exception {
        long startedAt = System.nanoTime();
        mockMvc.perform(post("/users/request-password-reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s"}
                                """.formatted(email)))
                .andExpect(status().isOk());
        return Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
    }

    private long login(String email, String password, ResultMatcher expected) throws Exception {
        long startedAt = System.nanoTime();
        mockMvc.perform(post("/users/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s"}
                                """.formatted(email, password)))
                .andExpect(expected);
        return Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
    }

    private static long median(long[] samples) {
        long[] sorted = samples.clone();
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }
}
