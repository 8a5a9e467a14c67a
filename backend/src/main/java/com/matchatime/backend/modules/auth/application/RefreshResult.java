package com.matchatime.backend.modules.auth.application;

import com.matchatime.backend.modules.auth.domain.AccessToken;

public record RefreshResult(AccessToken accessToken, RotatedRefreshToken refreshToken) {
}
