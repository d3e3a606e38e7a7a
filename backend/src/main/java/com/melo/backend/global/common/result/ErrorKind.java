package com.melo.backend.global.common.result;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy shared by the permission, role and moderation services.
 */
public enum ErrorKind {

    /** Caller's level is insufficient, or the caller targets themselves. */
    UNAUTHORIZED(HttpStatus.FORBIDDEN),

    /** Room, member, role or record is absent. */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Duplicate role name, deleting the default role. */
    CONFLICT(HttpStatus.CONFLICT),

    /** The protocol client call itself failed. */
    UPSTREAM_FAILURE(HttpStatus.BAD_GATEWAY),

    /** Bad duration, bad name, out of range level. */
    INVALID_INPUT(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
