package com.matchatime.backend.modules.auth.presentation;

import java.net.URI;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matchatime.backend.global.config.WebProperties;
import com.matchatime.backend.global.error.AuthFailureException;
import com.matchatime.backend.global.security.SecurityUtils;
import com.matchatime.backend.modules.auth.application.AuthService;
import com.matchatime.backend.modules.auth.application.FederatedLoginService;
import com.matchatime.backend.modules.auth.application.RefreshResult;
import com.matchatime.backend.modules.auth.application.RefreshSessionService;
import com.matchatime.backend.modules.auth.application.SessionTokens;
import com.matchatime.backend.modules.auth.presentation.dto.MessageResponse;
import com.matchatime.backend.modules.auth.presentation.dto.RefreshResponse;
import com.matchatime.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    static final String REFRESH_SUCCESS_MESSAGE = "Token refreshed successfully";
    static final String LOGOUT_MESSAGE = "Logged out successfully";

    private final AuthService authService;
    private final FederatedLoginService federatedLoginService;
    private final AuthCookieFactory cookieFactory;
    private final SessionResponses sessionResponses;
    private final ClientContext clientContext;
    private final ObjectMapper objectMapper;
    private final String frontendUrl;

    public AuthController(
            AuthService authService,
            FederatedLoginService federatedLoginService,
            AuthCookieFactory cookieFactory,
            SessionResponses sessionResponses,
            ClientContext clientContext,
            ObjectMapper objectMapper,
            WebProperties webProperties
    ) {
        this.authService = authService;
        this.federatedLoginService = federatedLoginService;
        this.cookieFactory = cookieFactory;
        this.sessionResponses = sessionResponses;
        this.clientContext = clientContext;
        this.objectMapper = objectMapper;
        this.frontendUrl = webProperties.frontendUrl();
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(UserProfileResponse.from(authService.currentUser(SecurityUtils.getCurrentUserId())));
    }

    @Operation(summary = "Rotate the refresh session", description = "Exchanges the refresh cookie for a new one and a new access token.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rotated"),
            @ApiResponse(responseCode = "401", description = "Missing, unknown, expired or already used refresh token")
    })
    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh(
            @CookieValue(name = AuthCookieFactory.REFRESH_COOKIE, required = false) String refreshSecret
    ) {
        if (refreshSecret == null || refreshSecret.isBlank()) {
            throw new AuthFailureException("INVALID_REFRESH_TOKEN", RefreshSessionService.INVALID_REFRESH_TOKEN);
        }
        RefreshResult result = authService.refresh(refreshSecret);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.accessCookie(result.accessToken().value()).toString())
                .header(HttpHeaders.SET_COOKIE, cookieFactory.refreshCookie(result.refreshToken().secret()).toString())
                .body(new RefreshResponse(result.accessToken().value(), REFRESH_SUCCESS_MESSAGE));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = AuthCookieFactory.REFRESH_COOKIE, required = false) String refreshSecret
    ) {
        authService.logout(refreshSecret);
        return ResponseEntity.ok()
                .headers(sessionResponses.clearedSessionCookies())
                .body(new MessageResponse(LOGOUT_MESSAGE));
    }

    @Operation(summary = "Start Google sign-in", description = "Sets the encrypted flow cookie and redirects to the provider.")
    @GetMapping("/google")
    public ResponseEntity<Void> beginGoogleLogin() {
        FederatedLoginService.FlowStart start = federatedLoginService.begin();
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(start.authorizationUrl()))
                .header(HttpHeaders.SET_COOKIE, cookieFactory.flowCookie(start.flowCookieValue()).toString())
                .build();
    }

    @GetMapping("/callback")
    public ResponseEntity<String> googleCallback(
            @CookieValue(name = AuthCookieFactory.FLOW_COOKIE, required = false) String flowCookie,
            @RequestParam(name = "code", required = false) String code,
            @RequestParam(name = "state", required = false) String state,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        // the flow cookie is single use, so it goes away on failures too
        response.addHeader(HttpHeaders.SET_COOKIE, cookieFactory.clearFlowCookie().toString());

        SessionTokens session = federatedLoginService.complete(flowCookie, code, state,
                clientContext.clientIp(request), clientContext.deviceInfo(request));
        return ResponseEntity.ok()
                .headers(sessionResponses.sessionCookies(session))
                .contentType(MediaType.TEXT_HTML)
                .body(popupCompletionPage());
    }

    private String popupCompletionPage() {
        String origin;
        try {
            origin = objectMapper.writeValueAsString(frontendUrl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Frontend URL could not be encoded", e);
        }
        return """
                <!DOCTYPE html>
                <html>
                <head><title>Authentication Successful</title></head>
                <body>
                <script>
                    (function () {
                        var origin = %s;
                        if (window.opener) {
                            window.opener.postMessage({ type: 'google-auth-success' }, origin);
                            window.close();
                        } else {
                            window.location.replace(origin);
                        }
                    })();
                </script>
                </body>
                </html>
                """.formatted(origin);
    }
}
