package io.vaultclient.sdk.auth;

/**
 * TokenProvider returning a fixed token, typically read from configuration or {@code VAULT_TOKEN}.
 */
public final class StaticTokenProvider implements TokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
        this.token = token.trim();
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public String toString() {
        return "StaticTokenProvider[token=***]";
    }
}
