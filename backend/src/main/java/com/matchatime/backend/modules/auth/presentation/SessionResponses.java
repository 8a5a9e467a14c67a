package com.matchatime.backend.modules.auth.presentation;

import com.matchatime.backend.modules.auth.application.SessionTokens;
import com.matchatime.backend.modules.auth.presentation.dto.LoginResponse;
import com.matchatime.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Turns a new session into the login response: body plus access and refresh cookies.
 */
@Component
public class SessionResponses {

    private final AuthCookieFactory cookieFactory;

    public SessionResponses(AuthCookieFactory cookieFactory) {
        this.cookieFactory = cookieFactory;
    }

    public ResponseEntity<LoginResponse> loginResponse(SessionTokens session) {
        return ResponseEntity.ok()
                .headers(sessionCookies(session))
                .body(new LoginResponse(
                        session.accessToken().value(),
                        session.refreshToken().secret(),
                        UserProfileResponse.from(session.user())
                ));
    }

    public HttpHeaders sessionCookies(SessionTokens session) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.SET_COOKIE, cookieFactory.accessCookie(session.accessToken().value()).toString());
        headers.add(HttpHeaders.SET_COOKIE, cookieFactory.refreshCookie(session.refreshToken().secret()).toString());
        return headers;
    }

    public HttpHeaders clearedSessionCookies() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.SET_COOKIE, cookieFactory.clearAccessCookie().toString());
        headers.add(HttpHeaders.SET_COOKIE, cookieFactory.clearRefreshCookie().toString());
        return headers;
    }
}
