package io.vaultclient.sdk.auth;

import io.vaultclient.sdk.VaultException;

/**
 * Contract for obtaining the Vault token sent with each request.
 */
public interface TokenProvider {

    String token() throws VaultException;

    default void invalidate() {
        // default no-op
    }
}
