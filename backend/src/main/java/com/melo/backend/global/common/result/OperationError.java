package com.melo.backend.global.common.result;

import java.util.Objects;

public record OperationError(ErrorKind kind, String code, String message) {

    public OperationError {
        Objects.requireNonNull(kind, "kind is required");
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("OperationError code must not be blank");
        }
        if (message == null || message.isBlank()) {
            message = code;
        }
    }
}
