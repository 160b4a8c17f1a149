package io.vaultclient.sdk.database;

import io.vaultclient.sdk.VaultException;
import io.vaultclient.sdk.api.Api;
import io.vaultclient.sdk.api.Client;
import io.vaultclient.sdk.api.HttpMethod;
import io.vaultclient.sdk.api.Secret;

/**
 * Dynamic roles, stored under {@code <mount>/roles/<name>}.
 */
public final class RoleOperations extends ResourceOperations<SetRoleRequest, ReadRoleResponse> {

    public RoleOperations(Client client) {
        super(client, ResourceKind.ROLE);
    }

    /**
     * Generates a new set of credentials. Each call creates a new database user.
     */
    public GenerateCredentialsResponse creds(String mount, String name) throws VaultException {
        return credsWithLease(mount, name).data();
    }

    /**
     * Generates a new set of credentials and returns them with their lease, which is needed to renew or revoke them.
     */
    public Secret<GenerateCredentialsResponse> credsWithLease(String mount, String name) throws VaultException {
        return Api.execWithSecret(client, endpoint(HttpMethod.GET, "creds", mount, name),
            GenerateCredentialsResponse.class);
    }
}
