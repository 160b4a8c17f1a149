package io.vaultclient.sdk.database;

import io.vaultclient.sdk.RequestBuildException;
import io.vaultclient.sdk.VaultException;
import io.vaultclient.sdk.VaultNotFoundException;
import io.vaultclient.sdk.api.Api;
import io.vaultclient.sdk.api.Client;
import io.vaultclient.sdk.api.Endpoint;
import io.vaultclient.sdk.api.HttpMethod;
import io.vaultclient.sdk.internal.Json;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Create, read, list and delete calls shared by every resource kind of the database secrets engine. Subclasses add
 * the verbs specific to their kind (rotation, credential retrieval, connection reset).
 * </p>
 *
 * <p>
 * Each call is a single independent request. Mount and name are validated, and write bodies are checked against the
 * kind's required fields, before anything is sent; a {@link RequestBuildException} therefore means the client was
 * never invoked. Instances hold no mutable state and are safe to share across threads.
 * </p>
 *
 * @param <C> request type accepted by {@link #set(String, String, ResourceRequest)}.
 * @param <R> record type returned by {@link #read(String, String)}.
 */
public abstract class ResourceOperations<C extends ResourceRequest<C>, R> {

    private static final Logger LOGGER = Logger.getLogger(ResourceOperations.class.getName());

    protected final Client client;
    protected final ResourceKind<C, R> kind;

    protected ResourceOperations(Client client, ResourceKind<C, R> kind) {
        this.client = Objects.requireNonNull(client, "client");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ResourceKind<C, R> kind() {
        return kind;
    }

    /**
     * Creates or updates the resource. Engine defaults are applied first, then the caller's values on top of them.
     *
     * @param request caller overrides; {@code null} sends only the defaults, which fails when the kind has required
     *                fields without a default.
     * @throws RequestBuildException when mount, name or a required body field is missing.
     */
    public void set(String mount, String name, C request) throws VaultException {
        C merged = (request == null ? kind.emptyRequest() : request).withDefaults();
        Map<String, Object> body = Json.toBody(merged);
        Endpoint endpoint = Endpoint.builder(HttpMethod.POST)
            .mount(mount)
            .segment(kind.segment())
            .name(name)
            .body(body)
            .build();
        kind.checkRequired(body);
        Api.execWithEmptyResult(client, endpoint);
    }

    /**
     * Deletes the resource. Vault reports success whether or not it existed.
     */
    public void delete(String mount, String name) throws VaultException {
        Api.execWithEmpty(client, endpoint(HttpMethod.DELETE, kind.segment(), mount, name));
    }

    /**
     * Lists resource names under the mount; an empty listing yields an empty response rather than an error.
     *
     * @throws VaultNotFoundException when Vault reports a 404 with error messages, e.g. for an unknown mount.
     */
    public ListResponse list(String mount) throws VaultException {
        Endpoint endpoint = Endpoint.builder(HttpMethod.LIST)
            .mount(mount)
            .segment(kind.segment())
            .build();
        try {
            return Api.execWithResult(client, endpoint, ListResponse.class);
        } catch (VaultNotFoundException ex) {
            if (!ex.getErrors().isEmpty()) {
                throw ex;
            }
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[vault-sdk] no %s entries under %s", kind.displayName(), endpoint.getMount()));
            return ListResponse.empty();
        }
    }

    /**
     * Reads the resource.
     *
     * @throws VaultNotFoundException when no resource of this kind has the given name.
     */
    public R read(String mount, String name) throws VaultException {
        return Api.execWithResult(client, endpoint(HttpMethod.GET, kind.segment(), mount, name), kind.readType());
    }

    protected static Endpoint endpoint(HttpMethod method, String segment, String mount, String name)
        throws RequestBuildException {
        return Endpoint.builder(method)
            .mount(mount)
            .segment(segment)
            .name(name)
            .build();
    }
}
