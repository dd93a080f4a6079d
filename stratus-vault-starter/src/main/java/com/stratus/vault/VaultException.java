package com.stratus.vault;

/**
 * Base type for failures raised by a {@link VaultConnector}.
 * <p>
 * Every failure carries a stable {@link #getCode() code} so callers can branch
 * on the kind of failure without parsing messages.
 */
public class VaultException extends RuntimeException {

    private final String code;

    public VaultException(String code, String message) {
        super(message);
        this.code = code;
    }

    public VaultException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
