package io.vaultclient.sdk;

/**
 * Base exception thrown by the Vault Java SDK.
 */
public class VaultException extends Exception {

    private static final long serialVersionUID = 1L;

    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
