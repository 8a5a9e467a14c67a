package com.matchatime.backend.global.error;

import org.springframework.http.HttpStatus;

public class ValidationFailureException extends ProblemException {

    public ValidationFailureException(String detail) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", detail);
    }
}
