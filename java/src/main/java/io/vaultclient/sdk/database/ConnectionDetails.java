package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plugin-specific connection settings echoed back by a connection read. Secrets such as the root password are never
 * returned.
 */
public record ConnectionDetails(
    @JsonProperty("connection_url") String connectionUrl,
    String username,
    @JsonProperty("max_open_connections") Integer maxOpenConnections,
    @JsonProperty("max_idle_connections") Integer maxIdleConnections,
    @JsonProperty("max_connection_lifetime") String maxConnectionLifetime,
    @JsonProperty("username_template") String usernameTemplate
) {
}
