package com.matchatime.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Bad credentials, bad/expired/reused token or missing session. The detail is always a generic,
 * client-safe message; the specific cause belongs in the server log only.
 */
public class AuthFailureException extends ProblemException {

    public AuthFailureException(String code, String genericDetail) {
        super(HttpStatus.UNAUTHORIZED, code, genericDetail);
    }

    public AuthFailureException(String code, String genericDetail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, code, genericDetail, cause);
    }
}
