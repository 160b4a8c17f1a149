package io.vaultclient.sdk.database;

import java.util.List;

/**
 * Names returned by a list call. {@code keys} is never {@code null}.
 */
public record ListResponse(List<String> keys) {

    public ListResponse {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static ListResponse empty() {
        return new ListResponse(List.of());
    }
}
