package io.vaultclient.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultclient.sdk.VaultApiException;
import io.vaultclient.sdk.VaultNotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility for decoding Vault error payloads of the form {@code {"errors": ["..."]}}.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static VaultApiException decode(int statusCode, byte[] body) {
        List<String> errors = errors(body);
        if (statusCode == 404) {
            return new VaultNotFoundException(errors);
        }
        return new VaultApiException(statusCode, errors);
    }

    private static List<String> errors(byte[] body) {
        if (body == null || body.length == 0) {
            return List.of();
        }

        try {
            JsonNode node = MAPPER.readTree(body);
            JsonNode errors = node.path("errors");
            List<String> result = new ArrayList<>();
            if (errors.isArray()) {
                for (JsonNode error : errors) {
                    String text = error.asText();
                    if (text != null && !text.isBlank()) {
                        result.add(text);
                    }
                }
            }
            return result;
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8).trim();
            return fallback.isEmpty() ? List.of() : List.of(fallback);
        }
    }
}
