package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Connection settings for the PostgreSQL database plugin, written to {@code <mount>/config/<name>}.
 *
 * <p>
 * Only {@code connection_url} has to be supplied; {@code plugin_name} defaults to {@link #PLUGIN_NAME}.
 * The URL is usually a template such as {@code postgresql://{{username}}:{{password}}@db:5432/app}, with
 * {@code username} and {@code password} holding the root account Vault manages.
 * </p>
 */
public final class PostgreSqlConnectionRequest implements ResourceRequest<PostgreSqlConnectionRequest> {

    public static final String PLUGIN_NAME = "postgresql-database-plugin";

    private final String pluginName;
    private final String pluginVersion;
    private final String connectionUrl;
    private final Boolean verifyConnection;
    private final List<String> allowedRoles;
    private final List<String> rootRotationStatements;
    private final String passwordPolicy;
    private final String username;
    private final String password;
    private final String usernameTemplate;
    private final Boolean disableEscaping;
    private final Integer maxOpenConnections;
    private final Integer maxIdleConnections;
    private final String maxConnectionLifetime;

    private PostgreSqlConnectionRequest(Builder builder) {
        this.pluginName = builder.pluginName;
        this.pluginVersion = builder.pluginVersion;
        this.connectionUrl = builder.connectionUrl;
        this.verifyConnection = builder.verifyConnection;
        this.allowedRoles = builder.allowedRoles == null ? null : List.copyOf(builder.allowedRoles);
        this.rootRotationStatements = builder.rootRotationStatements == null
            ? null : List.copyOf(builder.rootRotationStatements);
        this.passwordPolicy = builder.passwordPolicy;
        this.username = builder.username;
        this.password = builder.password;
        this.usernameTemplate = builder.usernameTemplate;
        this.disableEscaping = builder.disableEscaping;
        this.maxOpenConnections = builder.maxOpenConnections;
        this.maxIdleConnections = builder.maxIdleConnections;
        this.maxConnectionLifetime = builder.maxConnectionLifetime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .pluginName(pluginName)
            .pluginVersion(pluginVersion)
            .connectionUrl(connectionUrl)
            .verifyConnection(verifyConnection)
            .allowedRoles(allowedRoles)
            .rootRotationStatements(rootRotationStatements)
            .passwordPolicy(passwordPolicy)
            .username(username)
            .password(password)
            .usernameTemplate(usernameTemplate)
            .disableEscaping(disableEscaping)
            .maxOpenConnections(maxOpenConnections)
            .maxIdleConnections(maxIdleConnections)
            .maxConnectionLifetime(maxConnectionLifetime);
    }

    @Override
    public PostgreSqlConnectionRequest withDefaults() {
        if (pluginName != null && !pluginName.isBlank()) {
            return this;
        }
        return toBuilder().pluginName(PLUGIN_NAME).build();
    }

    @JsonProperty("plugin_name")
    public String getPluginName() {
        return pluginName;
    }

    @JsonProperty("plugin_version")
    public String getPluginVersion() {
        return pluginVersion;
    }

    @JsonProperty("connection_url")
    public String getConnectionUrl() {
        return connectionUrl;
    }

    @JsonProperty("verify_connection")
    public Boolean getVerifyConnection() {
        return verifyConnection;
    }

    @JsonProperty("allowed_roles")
    public List<String> getAllowedRoles() {
        return allowedRoles;
    }

    @JsonProperty("root_rotation_statements")
    public List<String> getRootRotationStatements() {
        return rootRotationStatements;
    }

    @JsonProperty("password_policy")
    public String getPasswordPolicy() {
        return passwordPolicy;
    }

    @JsonProperty("username")
    public String getUsername() {
        return username;
    }

    @JsonProperty("password")
    public String getPassword() {
        return password;
    }

    @JsonProperty("username_template")
    public String getUsernameTemplate() {
        return usernameTemplate;
    }

    @JsonProperty("disable_escaping")
    public Boolean getDisableEscaping() {
        return disableEscaping;
    }

    @JsonProperty("max_open_connections")
    public Integer getMaxOpenConnections() {
        return maxOpenConnections;
    }

    @JsonProperty("max_idle_connections")
    public Integer getMaxIdleConnections() {
        return maxIdleConnections;
    }

    @JsonProperty("max_connection_lifetime")
    public String getMaxConnectionLifetime() {
        return maxConnectionLifetime;
    }

    @Override
    public String toString() {
        return "PostgreSqlConnectionRequest[pluginName=" + pluginName
            + ", connectionUrl=" + connectionUrl
            + ", allowedRoles=" + allowedRoles
            + ", username=" + username + "]";
    }

    /**
     * Fluent builder for {@link PostgreSqlConnectionRequest}.
     *
     * <p>Builders are mutable and not thread-safe; create a fresh instance per request.</p>
     */
    public static final class Builder {
        private String pluginName;
        private String pluginVersion;
        private String connectionUrl;
        private Boolean verifyConnection;
        private List<String> allowedRoles;
        private List<String> rootRotationStatements;
        private String passwordPolicy;
        private String username;
        private String password;
        private String usernameTemplate;
        private Boolean disableEscaping;
        private Integer maxOpenConnections;
        private Integer maxIdleConnections;
        private String maxConnectionLifetime;

        private Builder() {
        }

        public Builder pluginName(String pluginName) {
            this.pluginName = pluginName;
            return this;
        }

        public Builder pluginVersion(String pluginVersion) {
            this.pluginVersion = pluginVersion;
            return this;
        }

        public Builder connectionUrl(String connectionUrl) {
            this.connectionUrl = connectionUrl;
            return this;
        }

        public Builder verifyConnection(Boolean verifyConnection) {
            this.verifyConnection = verifyConnection;
            return this;
        }

        public Builder allowedRoles(List<String> allowedRoles) {
            this.allowedRoles = allowedRoles;
            return this;
        }

        public Builder rootRotationStatements(List<String> rootRotationStatements) {
            this.rootRotationStatements = rootRotationStatements;
            return this;
        }

        public Builder passwordPolicy(String passwordPolicy) {
            this.passwordPolicy = passwordPolicy;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder usernameTemplate(String usernameTemplate) {
            this.usernameTemplate = usernameTemplate;
            return this;
        }

        public Builder disableEscaping(Boolean disableEscaping) {
            this.disableEscaping = disableEscaping;
            return this;
        }

        public Builder maxOpenConnections(Integer maxOpenConnections) {
            this.maxOpenConnections = maxOpenConnections;
            return this;
        }

        public Builder maxIdleConnections(Integer maxIdleConnections) {
            this.maxIdleConnections = maxIdleConnections;
            return this;
        }

        /**
         * @param maxConnectionLifetime duration string such as {@code "0s"} or {@code "30m"}.
         */
        public Builder maxConnectionLifetime(String maxConnectionLifetime) {
            this.maxConnectionLifetime = maxConnectionLifetime;
            return this;
        }

        public PostgreSqlConnectionRequest build() {
            return new PostgreSqlConnectionRequest(this);
        }
    }
}
