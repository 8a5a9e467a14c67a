package com.matchatime.backend.global.error;

import org.springframework.http.HttpStatus;

public class ConflictFailureException extends ProblemException {

    public ConflictFailureException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }
}
