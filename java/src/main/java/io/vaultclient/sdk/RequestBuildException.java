package io.vaultclient.sdk;

/**
 * Raised before any network call when a request is missing a required field.
 */
public final class RequestBuildException extends VaultException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public RequestBuildException(String field) {
        super(field + " is required");
        this.field = field;
    }

    /**
     * @return wire name of the missing field, for example {@code mount} or {@code connection_url}.
     */
    public String getField() {
        return field;
    }
}
