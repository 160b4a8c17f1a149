package io.vaultclient.sdk.database;

import io.vaultclient.sdk.api.Client;

import java.util.Objects;

/**
 * Entry point for the database secrets engine. Every operation takes the engine's mount path explicitly, so one
 * instance serves any number of mounts.
 */
public final class DatabaseSecrets {

    private final ConnectionOperations connections;
    private final RoleOperations roles;
    private final StaticRoleOperations staticRoles;

    public DatabaseSecrets(Client client) {
        Objects.requireNonNull(client, "client");
        this.connections = new ConnectionOperations(client);
        this.roles = new RoleOperations(client);
        this.staticRoles = new StaticRoleOperations(client);
    }

    public ConnectionOperations connections() {
        return connections;
    }

    public RoleOperations roles() {
        return roles;
    }

    public StaticRoleOperations staticRoles() {
        return staticRoles;
    }
}
