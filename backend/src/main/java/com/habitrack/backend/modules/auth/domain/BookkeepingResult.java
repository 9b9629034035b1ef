package com.habitrack.backend.modules.auth.domain;

/**
 * Outcome of a best-effort write to the login-attempt log. Callers may ignore it; a failure has
 * already been logged.
 */
public record BookkeepingResult(boolean recorded, String failureReason) {

    private static final BookkeepingResult OK = new BookkeepingResult(true, null);

    public static BookkeepingResult ok() {
        return OK;
    }

    public static BookkeepingResult failed(String reason) {
        return new BookkeepingResult(false, reason);
    }
}
