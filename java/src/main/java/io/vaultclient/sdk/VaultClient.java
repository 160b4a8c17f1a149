package io.vaultclient.sdk;

import io.vaultclient.sdk.api.Client;
import io.vaultclient.sdk.api.Endpoint;
import io.vaultclient.sdk.api.HttpMethod;
import io.vaultclient.sdk.api.RawResponse;
import io.vaultclient.sdk.auth.TokenProvider;
import io.vaultclient.sdk.database.DatabaseSecrets;
import io.vaultclient.sdk.internal.HttpUtil;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * HTTP transport for the Vault API. The client holds no per-request state and is thread-safe: create one instance
 * per Vault server and share it across threads.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Resolves request URLs as {@code <address>/v1/<path>}; {@link HttpMethod#LIST} requests are sent as
 *       {@code GET} with {@code list=true}.</li>
 *   <li>Sends the token from the configured {@link TokenProvider} as {@code X-Vault-Token} and, when configured,
 *       the namespace as {@code X-Vault-Namespace}.</li>
 *   <li>Returns every HTTP status to the caller; only failures that produced no response are raised here.</li>
 *   <li>Does not retry. Timeouts come from {@link Config#getHttpTimeout()}.</li>
 * </ul>
 */
public final class VaultClient implements Client, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(VaultClient.class.getName());

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    private final Config config;
    private final HttpClient httpClient;
    private final String address;
    private final TokenProvider tokenProvider;
    private final Duration timeout;

    /**
     * Constructs a new Vault client using the supplied configuration.
     *
     * @param config caller-supplied configuration; defaults are applied to a copy, so later changes to the builder
     *               do not affect this client.
     */
    public VaultClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.address = this.config.getAddress();
        this.httpClient = this.config.getHttpClient();
        this.tokenProvider = this.config.getTokenProvider();
        this.timeout = this.config.getHttpTimeout();
    }

    /**
     * @return operations for the database secrets engine, dispatched through this client.
     */
    public DatabaseSecrets database() {
        return new DatabaseSecrets(this);
    }

    public Config getConfig() {
        return config;
    }

    @Override
    public RawResponse execute(Endpoint endpoint) throws VaultException {
        Objects.requireNonNull(endpoint, "endpoint");

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(TOKEN_HEADER, tokenProvider.token());
        headers.put(NAMESPACE_HEADER, config.getNamespace());

        String url = url(endpoint);
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(
                httpClient, endpoint.getMethod().wireMethod(), url, endpoint.getBody(), headers, timeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(endpoint + " interrupted", ex);
        } catch (IOException ex) {
            throw new VaultTransportException(endpoint + ": " + ex.getMessage(), ex);
        }

        if (response.statusCode() == 403) {
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[vault-sdk] %s was forbidden; invalidating token", endpoint));
            tokenProvider.invalidate();
        }

        try (InputStream bodyStream = response.body()) {
            byte[] body = bodyStream == null ? new byte[0] : bodyStream.readAllBytes();
            return new RawResponse(response.statusCode(), body);
        } catch (IOException ex) {
            throw new VaultTransportException("read " + endpoint + " response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Closes the client. Currently a no-op because the underlying {@link HttpClient} does not require explicit shutdown.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private String url(Endpoint endpoint) {
        String url = address + "/v1/" + endpoint.getPath();
        if (endpoint.getMethod() == HttpMethod.LIST) {
            url += "?list=true";
        }
        return url;
    }
}
