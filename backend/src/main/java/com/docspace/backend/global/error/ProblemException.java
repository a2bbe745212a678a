package com.docspace.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Typed failure raised by application services. Carries a stable machine-readable code;
 * translation to a wire response happens only in {@link RestExceptionHandler}.
 */
public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:docspace:";

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException badRequest(String code) {
        return new ProblemException(HttpStatus.BAD_REQUEST, code);
    }

    public static ProblemException unauthorized(String code) {
        return new ProblemException(HttpStatus.UNAUTHORIZED, code);
    }

    public static ProblemException forbidden(String code) {
        return new ProblemException(HttpStatus.FORBIDDEN, code);
    }

    public static ProblemException notFound(String code) {
        return new ProblemException(HttpStatus.NOT_FOUND, code);
    }

    public static ProblemException conflict(String code) {
        return new ProblemException(HttpStatus.CONFLICT, code);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
