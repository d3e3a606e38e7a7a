package com.melo.backend.global.common.result;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a public service operation. Services report expected failures through this
 * type instead of throwing, so callers never infer state from an exception.
 *
 * @param <T> value carried on success, {@link Void} for side-effect-only operations
 */
public final class OperationResult<T> {

    private final T value;
    private final OperationError error;

    private OperationResult(T value, OperationError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }

    public static OperationResult<Void> success() {
        return new OperationResult<>(null, null);
    }

    public static <T> OperationResult<T> failure(OperationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error is required for a failed result");
        }
        return new OperationResult<>(null, error);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String code, String message) {
        return failure(new OperationError(kind, code, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on a failed result: " + error.code());
        }
        return value;
    }

    public Optional<OperationError> error() {
        return Optional.ofNullable(error);
    }

    public OperationError errorOrNull() {
        return error;
    }

    /**
     * Re-types a failure so it can be returned from an operation with a different value type.
     */
    public <R> OperationResult<R> propagate() {
        if (error == null) {
            throw new IllegalStateException("Only failed results can be propagated");
        }
        return new OperationResult<>(null, error);
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return propagate();
        }
        return new OperationResult<>(mapper.apply(value), null);
    }

    @Override
    public String toString() {
        return error == null
                ? "OperationResult{success, value=" + value + "}"
                : "OperationResult{failure, kind=" + error.kind() + ", code=" + error.code() + "}";
    }
}
