package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dynamic role definition. TTLs are in seconds.
 */
public record ReadRoleResponse(
    @JsonProperty("db_name") String dbName,
    @JsonProperty("default_ttl") Long defaultTtl,
    @JsonProperty("max_ttl") Long maxTtl,
    @JsonProperty("creation_statements") List<String> creationStatements,
    @JsonProperty("revocation_statements") List<String> revocationStatements,
    @JsonProperty("rollback_statements") List<String> rollbackStatements,
    @JsonProperty("renew_statements") List<String> renewStatements
) {
}
