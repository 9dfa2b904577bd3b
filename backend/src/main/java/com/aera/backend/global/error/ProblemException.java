package com.aera.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Business rule violation rendered as a problem+json body. {@code code} is the stable,
 * upper-snake identifier clients branch on (e.g. {@code ALREADY_MEMBER}).
 */
public class ProblemException extends ResponseStatusException {

    private final HttpStatus status;
    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, requireCode(code));
        this.status = status;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public ProblemResponse toResponse(String instance) {
        return ProblemResponse.of(status, code, detail, instance);
    }

    private static String requireCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        return code;
    }
}
