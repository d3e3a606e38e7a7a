package com.melo.backend.global.protocol;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;

/**
 * Converts homeserver exceptions into failed results.
 */
public final class ProtocolFailures {

    private ProtocolFailures() {
    }

    /**
     * Failure of a write or action call. The homeserver's message is surfaced as-is.
     */
    public static <T> OperationResult<T> upstream(String code, ProtocolClientException ex) {
        return OperationResult.failure(ErrorKind.UPSTREAM_FAILURE, code, describe(ex));
    }

    /**
     * Failure while resolving a room or member: a missing room (or one the service account
     * cannot see) is NOT_FOUND, anything else is an upstream failure.
     */
    public static <T> OperationResult<T> resolution(String notFoundCode, ProtocolClientException ex) {
        if (ex.isNotFound() || ProtocolClientException.ERRCODE_FORBIDDEN.equals(ex.getErrcode())) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, notFoundCode, describe(ex));
        }
        return upstream("UPSTREAM_FAILURE", ex);
    }

    public static String describe(ProtocolClientException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "homeserver call failed";
        return ex.getErrcode() + ": " + message;
    }
}
