package com.matchatime.backend.modules.auth.application;

import com.matchatime.backend.modules.auth.domain.AccessToken;
import com.matchatime.backend.modules.user.domain.AppUser;

import org.springframework.stereotype.Component;

/**
 * Single place where password, federated and password-change sign-ins turn into tokens.
 */
@Component
public class SessionIssuer {

    private final AccessTokenService accessTokenService;
    private final RefreshSessionService refreshSessionService;

    public SessionIssuer(AccessTokenService accessTokenService, RefreshSessionService refreshSessionService) {
        this.accessTokenService = accessTokenService;
        this.refreshSessionService = refreshSessionService;
    }

    public SessionTokens startSession(AppUser user, String clientIp, String deviceInfo) {
        AccessToken accessToken = accessTokenService.mint(user.getId(), user.getEmail());
        IssuedRefreshToken refreshToken = refreshSessionService.issue(user.getId(), deviceInfo, clientIp);
        return new SessionTokens(accessToken, refreshToken, user);
    }
}
