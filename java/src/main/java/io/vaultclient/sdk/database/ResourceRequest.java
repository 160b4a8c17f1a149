package io.vaultclient.sdk.database;

/**
 * Body of a create-or-update call. Implementations are immutable; the JSON body is produced from their
 * {@code @JsonProperty} getters.
 *
 * @param <C> the implementing request type.
 */
public interface ResourceRequest<C extends ResourceRequest<C>> {

    /**
     * Returns a copy with engine defaults filled in wherever the caller left a field unset. Fields the caller set are
     * never overridden.
     */
    C withDefaults();
}
