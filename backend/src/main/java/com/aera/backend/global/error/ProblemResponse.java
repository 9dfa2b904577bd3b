package com.aera.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    static final String TYPE_PREFIX = "urn:problem:aera:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(typeOf(safeCode), httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance, safeCode);
    }

    static String typeOf(String code) {
        return TYPE_PREFIX + code.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
    }
}
