package com.matchatime.backend.modules.auth.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import jakarta.servlet.http.Cookie;

import com.matchatime.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.matchatime.backend.modules.user.domain.AppUser;
import com.matchatime.backend.support.AbstractIntegrationTest;
import com.matchatime.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

class SessionFlowIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    private AppUser user;

    @BeforeEach
    void setUp() {
        user = testUserFactory.createVerifiedUser("alice", "alice@example.com", "password123");
    }

    @Test
    @DisplayName("refresh rotates the cookie and the previous refresh secret is refused afterwards")
    void refreshRotatesAndRejectsReuse() throws Exception {
        MvcResult login = login();
        String firstSecret = setCookieValue(login, AuthCookieFactory.REFRESH_COOKIE).orElseThrow();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .cookie(new Cookie(AuthCookieFactory.REFRESH_COOKIE, firstSecret)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(AuthController.REFRESH_SUCCESS_MESSAGE))
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andReturn();
        String secondSecret = setCookieValue(refreshed, AuthCookieFactory.REFRESH_COOKIE).orElseThrow();
        String accessToken = setCookieValue(refreshed, AuthCookieFactory.ACCESS_COOKIE).orElseThrow();
        assertThat(secondSecret).isNotEqualTo(firstSecret);

        mockMvc.perform(post("/auth/refresh")
                        .cookie(new Cookie(AuthCookieFactory.REFRESH_COOKIE, firstSecret)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"))
                .andExpect(jsonPath("$.detail").value("Invalid refresh token"));

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(user.getId().toString()));
        assertThat(refreshTokenRepository.countByUserId(user.getId())).isEqualTo(1);
    }

    @Test
    void refreshWithoutCookieIsUnauthorized() throws Exception {
        mockMvc.perform(post("/auth/refresh"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void logoutRevokesSessionAndClearsCookies() throws Exception {
        String secret = setCookieValue(login(), AuthCookieFactory.REFRESH_COOKIE).orElseThrow();

        MvcResult logout = mockMvc.perform(post("/auth/logout")
                        .cookie(new Cookie(AuthCookieFactory.REFRESH_COOKIE, secret)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(AuthController.LOGOUT_MESSAGE))
                .andReturn();

        assertThat(setCookieHeader(logout, AuthCookieFactory.REFRESH_COOKIE))
                .hasValueSatisfying(cookie -> assertThat(cookie).contains("Max-Age=0"));
        assertThat(setCookieHeader(logout, AuthCookieFactory.ACCESS_COOKIE))
                .hasValueSatisfying(cookie -> assertThat(cookie).contains("Max-Age=0"));
        assertThat(refreshTokenRepository.countByUserId(user.getId())).isZero();

        mockMvc.perform(post("/auth/refresh")
                        .cookie(new Cookie(AuthCookieFactory.REFRESH_COOKIE, secret)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void logoutWithoutSessionStillSucceeds() throws Exception {
        mockMvc.perform(post("/auth/logout"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/auth/logout").cookie(new Cookie(AuthCookieFactory.REFRESH_COOKIE, "unknown")))
                .andExpect(status().isOk());
    }

    @Test
    void protectedRoutesNeedValidAccessToken() throws Exception {
        mockMvc.perform(get("/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mockMvc.perform(get("/auth/me").cookie(new Cookie(AuthCookieFactory.ACCESS_COOKIE, "forged.token.value")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void responsesCarryRequestId() throws Exception {
        mockMvc.perform(get("/auth/me").header("X-Request-Id", "trace-123"))
                .andExpect(header().string("X-Request-Id", "trace-123"));
        mockMvc.perform(get("/auth/me"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void refreshForUnverifiedAccountIsRefused() throws Exception {
        String secret = setCookieValue(login(), AuthCookieFactory.REFRESH_COOKIE).orElseThrow();
        jdbcTemplate.update("UPDATE users SET email_verified = FALSE WHERE id = ?", user.getId());

        mockMvc.perform(post("/auth/refresh").cookie(new Cookie(AuthCookieFactory.REFRESH_COOKIE, secret)))
                .andExpect(status().isUnauthorized());
        assertThat(refreshTokenRepository.countByUserId(user.getId())).isZero();
    }

    private MvcResult login() throws Exception {
        return mockMvc.perform(post("/users/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"alice@example.com","password":"password123"}
                                """))
                .andExpect(status().isOk())
                .andReturn();
    }
}
