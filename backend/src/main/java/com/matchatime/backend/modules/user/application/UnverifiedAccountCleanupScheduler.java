package com.matchatime.backend.modules.user.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class UnverifiedAccountCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(UnverifiedAccountCleanupScheduler.class);

    private final RegistrationService registrationService;

    public UnverifiedAccountCleanupScheduler(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @Scheduled(initialDelayString = "${app.jobs.unverified-cleanup-initial-delay:PT2H}",
            fixedDelayString = "${app.jobs.unverified-cleanup-interval:PT24H}")
    public void deleteStaleUnverifiedAccounts() {
        try {
            int deleted = registrationService.purgeStaleUnverifiedAccounts();
            if (deleted > 0) {
                log.info("Deleted {} unverified accounts past the retention window", deleted);
            }
        } catch (RuntimeException e) {
            log.error("Unverified account cleanup failed", e);
        }
    }
}
