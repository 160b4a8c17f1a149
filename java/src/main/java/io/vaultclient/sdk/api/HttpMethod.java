package io.vaultclient.sdk.api;

/**
 * HTTP verbs understood by Vault. {@link #LIST} is not a standard verb; it is sent as {@code GET} with the
 * {@code list=true} query parameter.
 */
public enum HttpMethod {
    GET,
    POST,
    DELETE,
    LIST;

    /**
     * @return the verb put on the wire.
     */
    public String wireMethod() {
        return this == LIST ? "GET" : name();
    }
}
