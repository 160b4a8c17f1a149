package io.vaultclient.sdk.api;

import java.util.List;

/**
 * Decoded response envelope together with its typed {@code data}. Leased secrets (dynamic credentials) carry
 * the lease id and duration needed to renew or revoke them.
 */
public record Secret<T>(
    String requestId,
    String leaseId,
    long leaseDuration,
    boolean renewable,
    List<String> warnings,
    T data
) {
    public Secret {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
