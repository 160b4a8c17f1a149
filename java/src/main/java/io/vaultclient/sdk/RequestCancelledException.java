package io.vaultclient.sdk;

/**
 * Raised when the calling thread is interrupted while a request is in flight. The interrupt flag is restored
 * before this exception is thrown.
 */
public final class RequestCancelledException extends VaultException {

    private static final long serialVersionUID = 1L;

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
