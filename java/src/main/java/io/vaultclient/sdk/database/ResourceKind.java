package io.vaultclient.sdk.database;

import io.vaultclient.sdk.RequestBuildException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Describes one kind of resource managed by the database secrets engine: where it lives below the mount, which body
 * fields a write must carry and what a read returns.
 *
 * @param <C> request type accepted by create-or-update calls.
 * @param <R> record type returned by reads.
 */
public final class ResourceKind<C extends ResourceRequest<C>, R> {

    public static final ResourceKind<PostgreSqlConnectionRequest, ReadConnectionResponse> CONNECTION =
        new ResourceKind<>(
            "connection",
            "config",
            List.of("plugin_name", "connection_url"),
            () -> PostgreSqlConnectionRequest.builder().build(),
            ReadConnectionResponse.class);

    public static final ResourceKind<SetRoleRequest, ReadRoleResponse> ROLE =
        new ResourceKind<>(
            "role",
            "roles",
            List.of("db_name", "creation_statements"),
            () -> SetRoleRequest.builder().build(),
            ReadRoleResponse.class);

    public static final ResourceKind<SetStaticRoleRequest, ReadStaticRoleResponse> STATIC_ROLE =
        new ResourceKind<>(
            "static role",
            "static-roles",
            List.of("db_name", "username", "rotation_period"),
            () -> SetStaticRoleRequest.builder().build(),
            ReadStaticRoleResponse.class);

    private final String displayName;
    private final String segment;
    private final List<String> requiredFields;
    private final Supplier<C> emptyRequest;
    private final Class<R> readType;

    public ResourceKind(
        String displayName,
        String segment,
        List<String> requiredFields,
        Supplier<C> emptyRequest,
        Class<R> readType
    ) {
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.segment = Objects.requireNonNull(segment, "segment");
        this.requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        this.emptyRequest = Objects.requireNonNull(emptyRequest, "emptyRequest");
        this.readType = Objects.requireNonNull(readType, "readType");
    }

    public String displayName() {
        return displayName;
    }

    public String segment() {
        return segment;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public C emptyRequest() {
        return emptyRequest.get();
    }

    public Class<R> readType() {
        return readType;
    }

    /**
     * Checks the write body against {@link #requiredFields()}. Blank strings and empty collections count as absent.
     *
     * @throws RequestBuildException naming the first absent field.
     */
    public void checkRequired(Map<String, Object> body) throws RequestBuildException {
        for (String field : requiredFields) {
            Object value = body == null ? null : body.get(field);
            if (value == null
                || (value instanceof String && ((String) value).isBlank())
                || (value instanceof Collection && ((Collection<?>) value).isEmpty())) {
                throw new RequestBuildException(field);
            }
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
