package com.melo.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:melo:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return of(httpStatus, safeCode, safeDetail, instance, DEFAULT_TYPE_PREFIX + normalized);
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance, String type) {
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), detail, instance, code);
    }
}
