package io.vaultclient.sdk;

import java.util.List;

/**
 * Exception representing an error returned by the Vault server. When the server responds with a non-2xx status
 * the SDK hydrates this type so callers can inspect both the HTTP status and the error messages Vault reported
 * in its {@code errors} array.
 */
public class VaultApiException extends VaultException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final List<String> errors;

    public VaultApiException(int statusCode, List<String> errors) {
        super(buildMessage(statusCode, errors));
        this.statusCode = statusCode;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * @return HTTP status code returned by Vault.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return error messages from the response body; empty when Vault sent none.
     */
    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(int status, List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Vault request failed with status " + status;
        }
        return "Vault request failed with status " + status + ": " + String.join("; ", errors);
    }
}
