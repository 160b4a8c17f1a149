package io.vaultclient.sdk.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultclient.sdk.ResponseDecodeException;
import io.vaultclient.sdk.VaultException;
import io.vaultclient.sdk.internal.ApiErrorDecoder;
import io.vaultclient.sdk.internal.Json;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Executes {@link Endpoint} descriptors against a {@link Client} and interprets the response.
 *
 * <p>
 * Every call shape raises {@link io.vaultclient.sdk.VaultApiException} (or its 404 subtype) for non-2xx statuses and
 * lets transport failures from the client propagate unchanged. Nothing is retried.
 * </p>
 */
public final class Api {

    private static final Logger LOGGER = Logger.getLogger(Api.class.getName());

    private Api() {
    }

    /**
     * Executes a write whose response data is not needed. A body, when Vault sends one, is decoded only to surface
     * the {@code warnings} it carries.
     */
    public static void execWithEmptyResult(Client client, Endpoint endpoint) throws VaultException {
        RawResponse response = send(client, endpoint);
        if (response.hasBody()) {
            JsonNode root = parse(endpoint, response);
            logWarnings(endpoint, warnings(root));
        }
    }

    /**
     * Executes a request Vault answers with {@code 204 No Content}. Any body is ignored.
     */
    public static void execWithEmpty(Client client, Endpoint endpoint) throws VaultException {
        send(client, endpoint);
    }

    /**
     * Executes a request and maps the {@code data} object of the response envelope into {@code type}.
     *
     * @throws ResponseDecodeException when the body is not JSON, has no {@code data} or does not fit {@code type}.
     */
    public static <T> T execWithResult(Client client, Endpoint endpoint, Class<T> type) throws VaultException {
        return execWithSecret(client, endpoint, type).data();
    }

    /**
     * Like {@link #execWithResult(Client, Endpoint, Class)} but keeps the envelope metadata, including lease details.
     */
    public static <T> Secret<T> execWithSecret(Client client, Endpoint endpoint, Class<T> type) throws VaultException {
        Objects.requireNonNull(type, "type");
        RawResponse response = send(client, endpoint);
        if (!response.hasBody()) {
            throw new ResponseDecodeException("decode " + endpoint + ": empty response body");
        }

        JsonNode root = parse(endpoint, response);
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            throw new ResponseDecodeException("decode " + endpoint + ": response missing data");
        }

        T value;
        try {
            value = Json.mapper().treeToValue(data, type);
        } catch (IOException | IllegalArgumentException ex) {
            throw new ResponseDecodeException("decode " + endpoint + ": " + ex.getMessage(), ex);
        }

        List<String> warnings = warnings(root);
        logWarnings(endpoint, warnings);
        return new Secret<>(
            textOrNull(root.get("request_id")),
            textOrNull(root.get("lease_id")),
            root.path("lease_duration").asLong(0),
            root.path("renewable").asBoolean(false),
            warnings,
            value
        );
    }

    private static RawResponse send(Client client, Endpoint endpoint) throws VaultException {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(endpoint, "endpoint");
        LOGGER.fine(() -> "[vault-sdk] " + endpoint);
        RawResponse response = client.execute(endpoint);
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[vault-sdk] %s returned status %d", endpoint, response.statusCode()));
        if (!response.isSuccess()) {
            throw ApiErrorDecoder.decode(response.statusCode(), response.body());
        }
        return response;
    }

    private static JsonNode parse(Endpoint endpoint, RawResponse response) throws ResponseDecodeException {
        try {
            JsonNode root = Json.mapper().readTree(response.body());
            if (root == null || !root.isObject()) {
                throw new ResponseDecodeException("decode " + endpoint + ": expected a JSON object");
            }
            return root;
        } catch (IOException ex) {
            throw new ResponseDecodeException("decode " + endpoint + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> warnings(JsonNode root) {
        JsonNode node = root.path("warnings");
        if (!node.isArray()) {
            return List.of();
        }
        List<String> warnings = new ArrayList<>();
        for (JsonNode warning : node) {
            warnings.add(warning.asText());
        }
        return warnings;
    }

    private static void logWarnings(Endpoint endpoint, List<String> warnings) {
        for (String warning : warnings) {
            LOGGER.warning(() -> String.format(Locale.ROOT, "[vault-sdk] %s: %s", endpoint, warning));
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }
}
