package io.vaultclient.sdk.database;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.vaultclient.sdk.api.Client;
import io.vaultclient.sdk.api.Endpoint;
import io.vaultclient.sdk.api.HttpMethod;
import io.vaultclient.sdk.api.RawResponse;
import io.vaultclient.sdk.internal.Json;

import java.io.UncheckedIOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for the database secrets engine, answering the way a Vault server does.
 */
final class FakeVault implements Client {

    private static final OffsetDateTime ROTATED_AT = OffsetDateTime.of(2024, 5, 6, 15, 26, 42, 0, ZoneOffset.UTC);

    private final Map<String, Map<String, Object>> resources = new TreeMap<>();
    private final Map<String, Map<String, Object>> staticCredentials = new LinkedHashMap<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger generated = new AtomicInteger();
    private final List<Endpoint> requests = new ArrayList<>();

    int invocations() {
        return invocations.get();
    }

    synchronized Endpoint lastRequest() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1);
    }

    @Override
    public synchronized RawResponse execute(Endpoint endpoint) {
        invocations.incrementAndGet();
        requests.add(endpoint);

        String mount = endpoint.getMount();
        String segment = endpoint.getSegment();
        String name = endpoint.getName();
        HttpMethod method = endpoint.getMethod();

        if (method == HttpMethod.LIST) {
            return list(mount + "/" + segment + "/");
        }

        switch (segment) {
            case "config":
            case "roles":
            case "static-roles":
                return crud(method, mount, segment, name, endpoint.getBody());
            case "creds":
                return generateCredentials(mount, name);
            case "static-creds":
                return staticCredentials(mount, name);
            case "rotate-role":
                return rotateRole(mount, name);
            case "reset":
            case "rotate-root":
                return exists(key(mount, "config", name)) ? noContent() : notFound();
            default:
                return respond(404, Map.of("errors", List.of("no handler for route \"" + endpoint.getPath() + "\"")));
        }
    }

    private RawResponse crud(HttpMethod method, String mount, String segment, String name, Map<String, Object> body) {
        String key = key(mount, segment, name);
        switch (method) {
            case POST:
                resources.put(key, new LinkedHashMap<>(body));
                if ("static-roles".equals(segment)) {
                    staticCredentials.put(key(mount, "static-creds", name), newStaticCredentials(body));
                }
                if ("config".equals(segment) && body.containsKey("password")) {
                    return respond(200, Map.of("warnings", List.of("Password found in connection_url, use a templated url")));
                }
                return noContent();
            case DELETE:
                resources.remove(key);
                staticCredentials.remove(key(mount, "static-creds", name));
                return noContent();
            case GET:
                Map<String, Object> stored = resources.get(key);
                if (stored == null) {
                    return notFound();
                }
                return data(readView(segment, stored));
            default:
                return respond(405, Map.of("errors", List.of("unsupported operation")));
        }
    }

    private RawResponse list(String prefix) {
        List<String> keys = new ArrayList<>();
        for (String key : resources.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key.substring(prefix.length()));
            }
        }
        if (keys.isEmpty()) {
            return notFound();
        }
        return data(Map.of("keys", keys));
    }

    private RawResponse generateCredentials(String mount, String name) {
        if (!exists(key(mount, "roles", name))) {
            return respond(400, Map.of("errors", List.of("unknown role: " + name)));
        }
        int serial = generated.incrementAndGet();
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("request_id", UUID.randomUUID().toString());
        envelope.put("lease_id", mount + "/creds/" + name + "/lease-" + serial);
        envelope.put("lease_duration", 3600);
        envelope.put("renewable", true);
        envelope.put("data", Map.of(
            "username", "v-token-" + name + "-" + serial,
            "password", UUID.randomUUID().toString()));
        return respond(200, envelope);
    }

    private RawResponse staticCredentials(String mount, String name) {
        Map<String, Object> credentials = staticCredentials.get(key(mount, "static-creds", name));
        if (credentials == null) {
            return respond(400, Map.of("errors", List.of("unknown role: " + name)));
        }
        return data(credentials);
    }

    private RawResponse rotateRole(String mount, String name) {
        String key = key(mount, "static-creds", name);
        Map<String, Object> credentials = staticCredentials.get(key);
        if (credentials == null) {
            return respond(400, Map.of("errors", List.of("unknown role: " + name)));
        }
        credentials.put("password", UUID.randomUUID().toString());
        return noContent();
    }

    private static Map<String, Object> newStaticCredentials(Map<String, Object> role) {
        Map<String, Object> credentials = new LinkedHashMap<>();
        credentials.put("username", role.get("username"));
        credentials.put("password", UUID.randomUUID().toString());
        credentials.put("rotation_period", seconds(role.get("rotation_period")));
        credentials.put("ttl", seconds(role.get("rotation_period")));
        credentials.put("last_vault_rotation", ROTATED_AT.toString());
        return credentials;
    }

    private static Map<String, Object> readView(String segment, Map<String, Object> stored) {
        Map<String, Object> view = new LinkedHashMap<>();
        switch (segment) {
            case "config":
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("connection_url", stored.get("connection_url"));
                details.put("username", stored.get("username"));
                view.put("plugin_name", stored.get("plugin_name"));
                view.put("plugin_version", "");
                view.put("connection_details", details);
                view.put("allowed_roles", stored.getOrDefault("allowed_roles", List.of()));
                view.put("root_credentials_rotate_statements",
                    stored.getOrDefault("root_rotation_statements", List.of()));
                view.put("password_policy", stored.getOrDefault("password_policy", ""));
                view.put("verify_connection", stored.getOrDefault("verify_connection", true));
                return view;
            case "roles":
                view.putAll(stored);
                view.put("default_ttl", seconds(stored.get("default_ttl")));
                view.put("max_ttl", seconds(stored.get("max_ttl")));
                return view;
            default:
                view.putAll(stored);
                view.put("rotation_period", seconds(stored.get("rotation_period")));
                view.put("last_vault_rotation", ROTATED_AT.toString());
                return view;
        }
    }

    private static long seconds(Object duration) {
        if (duration == null) {
            return 0;
        }
        String text = duration.toString().trim();
        char unit = text.charAt(text.length() - 1);
        if (Character.isDigit(unit)) {
            return Long.parseLong(text);
        }
        long value = Long.parseLong(text.substring(0, text.length() - 1));
        switch (unit) {
            case 'h':
                return value * 3600;
            case 'm':
                return value * 60;
            default:
                return value;
        }
    }

    private boolean exists(String key) {
        return resources.containsKey(key);
    }

    private static String key(String mount, String segment, String name) {
        return mount + "/" + segment + "/" + name;
    }

    private static RawResponse data(Map<String, Object> data) {
        return respond(200, Map.of("data", data));
    }

    private static RawResponse noContent() {
        return new RawResponse(204, null);
    }

    private static RawResponse notFound() {
        return respond(404, Map.of("errors", List.of()));
    }

    private static RawResponse respond(int status, Map<String, Object> body) {
        try {
            return new RawResponse(status, Json.mapper().writeValueAsBytes(body));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
