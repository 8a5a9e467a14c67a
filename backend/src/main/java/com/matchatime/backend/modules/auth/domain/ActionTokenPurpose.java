package com.matchatime.backend.modules.auth.domain;

public enum ActionTokenPurpose {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
