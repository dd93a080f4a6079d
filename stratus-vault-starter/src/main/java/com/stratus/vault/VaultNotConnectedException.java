package com.stratus.vault;

/**
 * A connector operation was invoked before a successful {@code connect()}.
 */
public class VaultNotConnectedException extends VaultException {

    public static final String CODE = "NOT_CONNECTED";

    public VaultNotConnectedException() {
        super(CODE, "Not connected to Vault. Call connect() first.");
    }
}
