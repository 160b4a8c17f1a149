package io.vaultclient.sdk;

import io.vaultclient.sdk.auth.StaticTokenProvider;
import io.vaultclient.sdk.auth.TokenProvider;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link VaultClient} instances.
 */
public final class Config {

    public static final String DEFAULT_ADDRESS = "http://127.0.0.1:8200";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String ENV_ADDRESS = "VAULT_ADDR";
    public static final String ENV_TOKEN = "VAULT_TOKEN";
    public static final String ENV_NAMESPACE = "VAULT_NAMESPACE";

    private final String address;
    private final String token;
    private final TokenProvider tokenProvider;
    private final String namespace;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.address = builder.address;
        this.token = builder.token;
        this.tokenProvider = builder.tokenProvider;
        this.namespace = builder.namespace;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from the process environment ({@code VAULT_ADDR}, {@code VAULT_TOKEN},
     * {@code VAULT_NAMESPACE}).
     */
    public static Config fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds a configuration from the supplied environment map. Absent variables fall back to the defaults.
     */
    public static Config fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
            .address(env.get(ENV_ADDRESS))
            .token(env.get(ENV_TOKEN))
            .namespace(env.get(ENV_NAMESPACE))
            .build();
    }

    public Config withDefaults() {
        String resolvedAddress = sanitizeUrl(Optional.ofNullable(address)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_ADDRESS));

        TokenProvider resolvedProvider = tokenProvider;
        if (resolvedProvider == null) {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("Token is required");
            }
            resolvedProvider = new StaticTokenProvider(token);
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedNamespace = Optional.ofNullable(namespace)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(null);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .address(resolvedAddress)
            .token(token)
            .tokenProvider(resolvedProvider)
            .namespace(resolvedNamespace)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getAddress() {
        return address;
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public String getNamespace() {
        return namespace;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private String address;
        private String token;
        private TokenProvider tokenProvider;
        private String namespace;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Supplies tokens dynamically; takes precedence over {@link #token(String)}.
         */
        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
