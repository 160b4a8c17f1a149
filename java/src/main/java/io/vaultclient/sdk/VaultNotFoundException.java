package io.vaultclient.sdk;

import java.util.List;

/**
 * Raised when Vault answers {@code 404 Not Found}, typically because the named resource does not exist.
 */
public final class VaultNotFoundException extends VaultApiException {

    private static final long serialVersionUID = 1L;

    public VaultNotFoundException(List<String> errors) {
        super(404, errors);
    }
}
