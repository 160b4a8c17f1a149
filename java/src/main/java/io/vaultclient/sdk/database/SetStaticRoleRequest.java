package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Binding of an existing database account to a rotation schedule, written to {@code <mount>/static-roles/<name>}.
 */
public final class SetStaticRoleRequest implements ResourceRequest<SetStaticRoleRequest> {

    private final String dbName;
    private final String username;
    private final String rotationPeriod;
    private final List<String> rotationStatements;

    private SetStaticRoleRequest(Builder builder) {
        this.dbName = builder.dbName;
        this.username = builder.username;
        this.rotationPeriod = builder.rotationPeriod;
        this.rotationStatements = builder.rotationStatements == null ? null : List.copyOf(builder.rotationStatements);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public SetStaticRoleRequest withDefaults() {
        return this;
    }

    @JsonProperty("db_name")
    public String getDbName() {
        return dbName;
    }

    @JsonProperty("username")
    public String getUsername() {
        return username;
    }

    @JsonProperty("rotation_period")
    public String getRotationPeriod() {
        return rotationPeriod;
    }

    @JsonProperty("rotation_statements")
    public List<String> getRotationStatements() {
        return rotationStatements;
    }

    public static final class Builder {
        private String dbName;
        private String username;
        private String rotationPeriod;
        private List<String> rotationStatements;

        private Builder() {
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        /**
         * @param rotationPeriod duration string such as {@code "24h"}, or a number of seconds.
         */
        public Builder rotationPeriod(String rotationPeriod) {
            this.rotationPeriod = rotationPeriod;
            return this;
        }

        public Builder rotationStatements(List<String> rotationStatements) {
            this.rotationStatements = rotationStatements;
            return this;
        }

        public SetStaticRoleRequest build() {
            return new SetStaticRoleRequest(this);
        }
    }
}
