package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Static role definition. {@code rotationPeriod} is in seconds.
 */
public record ReadStaticRoleResponse(
    @JsonProperty("db_name") String dbName,
    String username,
    @JsonProperty("rotation_period") Long rotationPeriod,
    @JsonProperty("rotation_statements") List<String> rotationStatements,
    @JsonProperty("last_vault_rotation") OffsetDateTime lastVaultRotation
) {
}
