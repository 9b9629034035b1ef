package com.habitrack.backend.global.error;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        Long retryAfter,
        Integer remainingAttempts
) {

    private static final String DEFAULT_TYPE_PREFIX = "https://habitrack.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        String type = DEFAULT_TYPE_PREFIX + normalized;
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance, safeCode,
                null, null);
    }

    public ProblemResponse withRetryAfter(long seconds) {
        return new ProblemResponse(type, title, status, detail, instance, code, seconds, remainingAttempts);
    }

    public ProblemResponse withRemainingAttempts(Integer remaining) {
        return new ProblemResponse(type, title, status, detail, instance, code, retryAfter, remaining);
    }
}
