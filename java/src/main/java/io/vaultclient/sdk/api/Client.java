package io.vaultclient.sdk.api;

import io.vaultclient.sdk.VaultException;

/**
 * Transport capability used by the operation classes. Implementations send the described request and hand back the
 * raw response for every status code; interpreting the status is left to {@link Api}.
 *
 * <p>Implementations must be safe for concurrent use.</p>
 */
public interface Client {

    /**
     * Executes the request described by {@code endpoint}.
     *
     * @throws io.vaultclient.sdk.VaultTransportException when no HTTP response was received.
     * @throws io.vaultclient.sdk.RequestCancelledException when the calling thread was interrupted.
     */
    RawResponse execute(Endpoint endpoint) throws VaultException;
}
