package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Connection configuration returned by {@code GET <mount>/config/<name>}.
 */
public record ReadConnectionResponse(
    @JsonProperty("plugin_name") String pluginName,
    @JsonProperty("plugin_version") String pluginVersion,
    @JsonProperty("connection_details") ConnectionDetails connectionDetails,
    @JsonProperty("allowed_roles") List<String> allowedRoles,
    @JsonProperty("root_credentials_rotate_statements") List<String> rootCredentialsRotateStatements,
    @JsonProperty("password_policy") String passwordPolicy,
    @JsonProperty("verify_connection") Boolean verifyConnection
) {
}
