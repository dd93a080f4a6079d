package com.stratus.vault;

/**
 * The backend could not be reached: authentication or the health probe failed
 * during {@code connect()}, or a call kept failing with I/O errors or 5xx
 * responses until the retry budget ran out.
 */
public class VaultConnectionException extends VaultException {

    public static final String CODE = "CONNECTION_ERROR";

    public VaultConnectionException(String message) {
        super(CODE, message);
    }

    public VaultConnectionException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
