package io.vaultclient.sdk;

/**
 * Raised when the request never produced an HTTP response: connection refused, TLS failure, timeout.
 */
public final class VaultTransportException extends VaultException {

    private static final long serialVersionUID = 1L;

    public VaultTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
