package io.vaultclient.sdk.database;

import io.vaultclient.sdk.VaultException;
import io.vaultclient.sdk.api.Api;
import io.vaultclient.sdk.api.Client;
import io.vaultclient.sdk.api.HttpMethod;

/**
 * Static roles, stored under {@code <mount>/static-roles/<name>}.
 */
public final class StaticRoleOperations extends ResourceOperations<SetStaticRoleRequest, ReadStaticRoleResponse> {

    public StaticRoleOperations(Client client) {
        super(client, ResourceKind.STATIC_ROLE);
    }

    /**
     * Returns the credentials currently stored for the role. Nothing is generated; the same values come back until
     * the next rotation.
     */
    public GetStaticCredentialsResponse creds(String mount, String name) throws VaultException {
        return Api.execWithResult(client, endpoint(HttpMethod.GET, "static-creds", mount, name),
            GetStaticCredentialsResponse.class);
    }

    /**
     * Rotates the role's password immediately and restarts its rotation period.
     */
    public void rotate(String mount, String name) throws VaultException {
        Api.execWithEmpty(client, endpoint(HttpMethod.POST, "rotate-role", mount, name));
    }
}
