package org.javai.gof.patterns.creational;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.Objects;

/**
 * Database connection settings assembled step by step, with a classic setter-style builder
 * and a fluent one that composes the connection string from parts.
 */
public class BuilderDemo extends AbstractPatternDemo {

    public BuilderDemo(DemoContext context) {
        super(context, "Builder",
                "Constructs complex objects step by step. "
                        + "Useful when creating objects with many optional parameters "
                        + "or when the construction process should allow different representations.");
    }

    @Override
    public void demonstrate() {
        out.println("Database Configuration Builder Example");
        out.println();

        out.println("Development database configuration:");
        out.println(new DatabaseConfiguration.Builder()
                .connectionString("Server=localhost;Database=DevDB;")
                .timeout(30)
                .enableLogging()
                .poolSize(10)
                .build());
        out.println();

        out.println("Production database configuration:");
        out.println(new DatabaseConfiguration.Builder()
                .connectionString("Server=prod-server;Database=ProdDB;Encrypt=true;")
                .timeout(60)
                .enableConnectionPooling()
                .poolSize(100)
                .enableRetries(3)
                .commandTimeout(120)
                .build());
        out.println();

        out.println("Fluent builder with method chaining:");
        out.println(DatabaseConfiguration.builder()
                .forServer("fluent-server")
                .withDatabase("FluentDB")
                .withEncryption()
                .timeout(75)
                .withConnectionPooling(25)
                .enableRetries(2)
                .enableLogging()
                .build());
        out.println();

        out.println("Validation happens when the object is built:");
        try {
            DatabaseConfiguration.builder().timeout(10).build();
        } catch (IllegalStateException e) {
            out.println("  Rejected: " + e.getMessage());
        }
    }

    /**
     * Immutable result of the builder.
     */
    record DatabaseConfiguration(
            String connectionString,
            int timeoutSeconds,
            boolean loggingEnabled,
            boolean poolingEnabled,
            int poolSize,
            int maxRetries,
            int commandTimeoutSeconds
    ) {

        static Builder builder() {
            return new Builder();
        }

        boolean retriesEnabled() {
            return maxRetries > 0;
        }

        @Override
        public String toString() {
            return String.join(System.lineSeparator(),
                    "  Connection: " + connectionString,
                    "  Timeout: " + timeoutSeconds + "s",
                    "  Logging: " + (loggingEnabled ? "Enabled" : "Disabled"),
                    "  Connection Pooling: " + (poolingEnabled ? "Enabled (Size: " + poolSize + ")" : "Disabled"),
                    "  Retry Logic: " + (retriesEnabled() ? "Enabled (Max: " + maxRetries + ")" : "Disabled"),
                    "  Command Timeout: " + commandTimeoutSeconds + "s");
        }

        static final class Builder {
            private String connectionString;
            private String server;
            private String database;
            private boolean encrypt;
            private int timeoutSeconds = 30;
            private boolean loggingEnabled;
            private boolean poolingEnabled;
            private int poolSize = 10;
            private int maxRetries;
            private int commandTimeoutSeconds = 30;

            Builder connectionString(String connectionString) {
                this.connectionString = Objects.requireNonNull(connectionString);
                return this;
            }

            Builder forServer(String server) {
                this.server = server;
                return this;
            }

            Builder withDatabase(String database) {
                this.database = database;
                return this;
            }

            Builder withEncryption() {
                this.encrypt = true;
                return this;
            }

            Builder timeout(int seconds) {
                this.timeoutSeconds = seconds;
                return this;
            }

            Builder enableLogging() {
                this.loggingEnabled = true;
                return this;
            }

            Builder enableConnectionPooling() {
                this.poolingEnabled = true;
                return this;
            }

            Builder withConnectionPooling(int poolSize) {
                return enableConnectionPooling().poolSize(poolSize);
            }

            Builder poolSize(int poolSize) {
                this.poolSize = poolSize;
                return this;
            }

            Builder enableRetries(int maxRetries) {
                this.maxRetries = maxRetries;
                return this;
            }

            Builder commandTimeout(int seconds) {
                this.commandTimeoutSeconds = seconds;
                return this;
            }

            DatabaseConfiguration build() {
                String connection = connectionString;
                if (connection == null && server != null && database != null) {
                    connection = "Server=" + server + ";Database=" + database + ";" + (encrypt ? "Encrypt=true;" : "");
                }
                if (connection == null) {
                    throw new IllegalStateException("a connection string, or a server and database, is required");
                }
                if (timeoutSeconds <= 0 || poolSize <= 0 || maxRetries < 0) {
                    throw new IllegalStateException("timeouts and pool size must be positive");
                }
                return new DatabaseConfiguration(connection, timeoutSeconds, loggingEnabled, poolingEnabled,
                        poolSize, maxRetries, commandTimeoutSeconds);
            }
        }
    }
}
