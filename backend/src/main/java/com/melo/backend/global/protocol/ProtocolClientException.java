package com.melo.backend.global.protocol;

/**
 * Raised when a homeserver call fails: transport error, non-2xx answer or unreadable body.
 */
public class ProtocolClientException extends RuntimeException {

    public static final String ERRCODE_NOT_FOUND = "M_NOT_FOUND";
    public static final String ERRCODE_FORBIDDEN = "M_FORBIDDEN";
    public static final String ERRCODE_TRANSPORT = "M_TRANSPORT";

    private final int status;
    private final String errcode;

    public ProtocolClientException(int status, String errcode, String message) {
        this(status, errcode, message, null);
    }

    public ProtocolClientException(int status, String errcode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errcode = errcode == null ? "M_UNKNOWN" : errcode;
    }

    public int getStatus() {
        return status;
    }

    public String getErrcode() {
        return errcode;
    }

    public boolean isNotFound() {
        return status == 404 || ERRCODE_NOT_FOUND.equals(errcode);
    }
}
