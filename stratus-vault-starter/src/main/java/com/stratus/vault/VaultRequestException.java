package com.stratus.vault;

/**
 * The backend rejected a request with a client error. These are never retried.
 */
public class VaultRequestException extends VaultException {

    public static final String CODE = "BACKEND_REQUEST_REJECTED";

    private final int statusCode;

    public VaultRequestException(String message, int statusCode, Throwable cause) {
        super(CODE, message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
