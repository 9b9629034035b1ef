package com.habitrack.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Wrong secret for a known account; tells the caller how many tries are left before lockout.
 */
public class BadCredentialsProblemException extends ProblemException {

    public static final String CODE = "BAD_CREDENTIALS";

    private final int remainingAttempts;

    public BadCredentialsProblemException(int remainingAttempts) {
        super(HttpStatus.UNAUTHORIZED, CODE, "Invalid credentials");
        this.remainingAttempts = Math.max(0, remainingAttempts);
    }

    @Override
    public Integer getRemainingAttempts() {
        return remainingAttempts;
    }
}
