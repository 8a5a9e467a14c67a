package com.matchatime.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class TokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(TokenCleanupScheduler.class);

    private final RefreshSessionService refreshSessionService;
    private final ActionTokenService actionTokenService;

    public TokenCleanupScheduler(RefreshSessionService refreshSessionService, ActionTokenService actionTokenService) {
        this.refreshSessionService = refreshSessionService;
        this.actionTokenService = actionTokenService;
    }

    @Scheduled(initialDelayString = "${app.jobs.token-cleanup-initial-delay:PT1H}",
            fixedDelayString = "${app.jobs.token-cleanup-interval:PT6H}")
    public void purgeExpiredTokens() {
        try {
            int refreshRemoved = refreshSessionService.cleanupExpired();
            int actionRemoved = actionTokenService.cleanupExpired();
            log.info("Token cleanup removed {} refresh tokens and {} action tokens", refreshRemoved, actionRemoved);
        } catch (RuntimeException e) {
            log.error("Token cleanup failed", e);
        }
    }
}
