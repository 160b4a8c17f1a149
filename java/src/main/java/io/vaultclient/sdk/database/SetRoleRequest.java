package io.vaultclient.sdk.database;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Definition of a dynamic role, written to {@code <mount>/roles/<name>}. {@code db_name} and at least one creation
 * statement are required.
 */
public final class SetRoleRequest implements ResourceRequest<SetRoleRequest> {

    private final String dbName;
    private final String defaultTtl;
    private final String maxTtl;
    private final List<String> creationStatements;
    private final List<String> revocationStatements;
    private final List<String> rollbackStatements;
    private final List<String> renewStatements;

    private SetRoleRequest(Builder builder) {
        this.dbName = builder.dbName;
        this.defaultTtl = builder.defaultTtl;
        this.maxTtl = builder.maxTtl;
        this.creationStatements = copy(builder.creationStatements);
        this.revocationStatements = copy(builder.revocationStatements);
        this.rollbackStatements = copy(builder.rollbackStatements);
        this.renewStatements = copy(builder.renewStatements);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public SetRoleRequest withDefaults() {
        return this;
    }

    @JsonProperty("db_name")
    public String getDbName() {
        return dbName;
    }

    @JsonProperty("default_ttl")
    public String getDefaultTtl() {
        return defaultTtl;
    }

    @JsonProperty("max_ttl")
    public String getMaxTtl() {
        return maxTtl;
    }

    @JsonProperty("creation_statements")
    public List<String> getCreationStatements() {
        return creationStatements;
    }

    @JsonProperty("revocation_statements")
    public List<String> getRevocationStatements() {
        return revocationStatements;
    }

    @JsonProperty("rollback_statements")
    public List<String> getRollbackStatements() {
        return rollbackStatements;
    }

    @JsonProperty("renew_statements")
    public List<String> getRenewStatements() {
        return renewStatements;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? null : List.copyOf(values);
    }

    public static final class Builder {
        private String dbName;
        private String defaultTtl;
        private String maxTtl;
        private List<String> creationStatements;
        private List<String> revocationStatements;
        private List<String> rollbackStatements;
        private List<String> renewStatements;

        private Builder() {
        }

        /**
         * @param dbName name of the connection this role issues credentials against.
         */
        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder defaultTtl(String defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder maxTtl(String maxTtl) {
            this.maxTtl = maxTtl;
            return this;
        }

        public Builder creationStatements(List<String> creationStatements) {
            this.creationStatements = creationStatements;
            return this;
        }

        public Builder revocationStatements(List<String> revocationStatements) {
            this.revocationStatements = revocationStatements;
            return this;
        }

        public Builder rollbackStatements(List<String> rollbackStatements) {
            this.rollbackStatements = rollbackStatements;
            return this;
        }

        public Builder renewStatements(List<String> renewStatements) {
            this.renewStatements = renewStatements;
            return this;
        }

        public SetRoleRequest build() {
            return new SetRoleRequest(this);
        }
    }
}
