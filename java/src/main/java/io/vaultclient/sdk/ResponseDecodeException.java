package io.vaultclient.sdk;

/**
 * Raised when a successful response body does not match the expected shape.
 */
public final class ResponseDecodeException extends VaultException {

    private static final long serialVersionUID = 1L;

    public ResponseDecodeException(String message) {
        super(message);
    }

    public ResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
