package io.vaultclient.sdk.database;

import io.vaultclient.sdk.VaultException;
import io.vaultclient.sdk.api.Api;
import io.vaultclient.sdk.api.Client;
import io.vaultclient.sdk.api.HttpMethod;

/**
 * Database connections, stored under {@code <mount>/config/<name>}.
 */
public final class ConnectionOperations extends ResourceOperations<PostgreSqlConnectionRequest, ReadConnectionResponse> {

    public ConnectionOperations(Client client) {
        super(client, ResourceKind.CONNECTION);
    }

    /**
     * Creates or updates a PostgreSQL connection.
     *
     * @param request connection settings; {@code connection_url} is required.
     */
    public void postgres(String mount, String name, PostgreSqlConnectionRequest request) throws VaultException {
        set(mount, name, request);
    }

    /**
     * Closes the connection and its underlying plugin and restarts it with the stored configuration.
     */
    public void reset(String mount, String name) throws VaultException {
        Api.execWithEmpty(client, endpoint(HttpMethod.POST, "reset", mount, name));
    }

    /**
     * Rotates the root credentials stored in the connection configuration. Afterwards only Vault knows the new
     * password.
     */
    public void rotate(String mount, String name) throws VaultException {
        Api.execWithEmpty(client, endpoint(HttpMethod.POST, "rotate-root", mount, name));
    }
}
