package io.vaultclient.sdk.api;

import io.vaultclient.sdk.RequestBuildException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of a single Vault request: the verb, the path below {@code /v1/} and an optional JSON body.
 * Paths take the form {@code <mount>/<segment>/<name>}, or {@code <mount>/<segment>} when no name is given.
 */
public final class Endpoint {

    private final HttpMethod method;
    private final String mount;
    private final String segment;
    private final String name;
    private final Map<String, Object> body;

    private Endpoint(Builder builder, String mount, String name) {
        this.method = builder.method;
        this.mount = mount;
        this.segment = builder.segment;
        this.name = name;
        this.body = builder.body == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.body));
    }

    public static Builder builder(HttpMethod method) {
        return new Builder(method);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getMount() {
        return mount;
    }

    public String getSegment() {
        return segment;
    }

    /**
     * @return resource name, or {@code null} for collection endpoints.
     */
    public String getName() {
        return name;
    }

    /**
     * @return request body, or {@code null} when the request carries none.
     */
    public Map<String, Object> getBody() {
        return body;
    }

    /**
     * @return path relative to {@code /v1/}, with each mount segment and the name percent-encoded.
     */
    public String getPath() {
        StringBuilder path = new StringBuilder();
        for (String part : mount.split("/", -1)) {
            if (path.length() > 0) {
                path.append('/');
            }
            path.append(encodeSegment(part));
        }
        if (segment != null) {
            path.append('/').append(segment);
        }
        if (name != null) {
            path.append('/').append(encodeSegment(name));
        }
        return path.toString();
    }

    @Override
    public String toString() {
        return method + " " + getPath();
    }

    private static String encodeSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Fluent builder for {@link Endpoint}.
     *
     * <p>Builders are mutable and not thread-safe; create a fresh instance per request.</p>
     */
    public static final class Builder {
        private final HttpMethod method;
        private String mount;
        private String segment;
        private String name;
        private boolean nameRequired;
        private Map<String, Object> body;

        private Builder(HttpMethod method) {
            if (method == null) {
                throw new IllegalArgumentException("method is required");
            }
            this.method = method;
        }

        public Builder mount(String mount) {
            this.mount = mount;
            return this;
        }

        public Builder segment(String segment) {
            this.segment = segment;
            return this;
        }

        /**
         * Sets the resource name. Once called the name becomes mandatory: {@link #build()} fails when it is
         * {@code null} or blank.
         */
        public Builder name(String name) {
            this.name = name;
            this.nameRequired = true;
            return this;
        }

        public Builder body(Map<String, Object> body) {
            this.body = body;
            return this;
        }

        /**
         * @throws RequestBuildException when the mount, or a declared name, is missing or blank.
         */
        public Endpoint build() throws RequestBuildException {
            String resolvedMount = trimSlashes(mount);
            if (resolvedMount.isEmpty()) {
                throw new RequestBuildException("mount");
            }
            String resolvedName = null;
            if (nameRequired) {
                if (name == null || name.isBlank()) {
                    throw new RequestBuildException("name");
                }
                resolvedName = name;
            }
            return new Endpoint(this, resolvedMount, resolvedName);
        }

        private static String trimSlashes(String value) {
            if (value == null) {
                return "";
            }
            String trimmed = value.trim();
            int start = 0;
            int end = trimmed.length();
            while (start < end && trimmed.charAt(start) == '/') {
                start++;
            }
            while (end > start && trimmed.charAt(end - 1) == '/') {
                end--;
            }
            return trimmed.substring(start, end);
        }
    }
}
