package io.vaultclient.sdk.database;

/**
 * Freshly generated credentials for a dynamic role.
 */
public record GenerateCredentialsResponse(String username, String password) {

    @Override
    public String toString() {
        return "GenerateCredentialsResponse[username=" + username + ", password=***]";
    }
}
