package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

/**
 * Current credentials of a static role. {@code ttl} is the number of seconds until the next scheduled rotation.
 */
public record GetStaticCredentialsResponse(
    String username,
    String password,
    @JsonProperty("rotation_period") Long rotationPeriod,
    Long ttl,
    @JsonProperty("last_vault_rotation") OffsetDateTime lastVaultRotation
) {

    @Override
    public String toString() {
        return "GetStaticCredentialsResponse[username=" + username + ", password=***, rotationPeriod="
            + rotationPeriod + ", ttl=" + ttl + ", lastVaultRotation=" + lastVaultRotation + "]";
    }
}
