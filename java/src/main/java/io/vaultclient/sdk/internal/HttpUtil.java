package io.vaultclient.sdk.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for issuing HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> sendJson(
        HttpClient client,
        String method,
        String url,
        Object payload,
        Map<String, String> headers,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getValue() != null && !header.getValue().isBlank()) {
                builder.header(header.getKey(), header.getValue());
            }
        }

        builder.header("Accept", "application/json");
        if (timeout != null) {
            builder.timeout(timeout);
        }

        HttpRequest request = builder.build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }
}
