package com.matchatime.backend.modules.auth.application;

import com.matchatime.backend.modules.auth.domain.AccessToken;
import com.matchatime.backend.modules.user.domain.AppUser;

/**
 * Result of a successful sign-in: the access token, a fresh refresh session and the signed-in user.
 */
public record SessionTokens(AccessToken accessToken, IssuedRefreshToken refreshToken, AppUser user) {
}
