package com.contactbook.backend.global.error;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

/**
 * Problem JSON body shared by the exception handler and the security entry point.
 * {@code code} is the machine readable value clients branch on; {@code type} is derived from it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    static final String TYPE_PREFIX = "urn:contactbook:problem:";

    public static ProblemResponse from(ProblemException problem, String instance) {
        return of(problem.getHttpStatus(), problem.getCode(), problem.getDetailMessage(), instance);
    }

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance) {
        String resolvedCode = (code == null || code.isBlank()) ? status.name() : code;
        String resolvedDetail = (detail == null || detail.isBlank()) ? status.getReasonPhrase() : detail;
        return new ProblemResponse(
                TYPE_PREFIX + slug(resolvedCode),
                status.getReasonPhrase(),
                status.value(),
                resolvedDetail,
                instance,
                resolvedCode
        );
    }

    private static String slug(String code) {
        return code.toLowerCase(Locale.ROOT).replace('_', '-').replaceAll("[^a-z0-9-]+", "-");
    }
}
