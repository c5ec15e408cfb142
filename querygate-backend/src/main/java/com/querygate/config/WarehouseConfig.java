package com.querygate.config;

import org.springframework.core.env.Environment;

import java.util.Locale;

/**
 * Warehouse connection settings.
 *
 * <p>{@code jdbcPassword} is never logged.
 *
 * @param type engine adapter, {@code bigquery} or {@code jdbc}
 * @param project default billing project for BigQuery
 * @param location BigQuery job location, may be null
 * @param jdbcUrl JDBC URL of the warehouse
 * @param jdbcUsername JDBC user
 * @param jdbcPassword JDBC password
 * @param jdbcPoolSize maximum pool size
 * @param explainPrefix statement prefix used to dry-run a query over JDBC
 */
public record WarehouseConfig(
        String type,
        String project,
        String location,
        String jdbcUrl,
        String jdbcUsername,
        String jdbcPassword,
        int jdbcPoolSize,
        String explainPrefix
) {
    public static final String TYPE_BIGQUERY = "bigquery";
    public static final String TYPE_JDBC = "jdbc";

    static final int DEFAULT_POOL_SIZE = 5;
    static final String DEFAULT_EXPLAIN_PREFIX = "EXPLAIN";

    public WarehouseConfig {
        if (!TYPE_BIGQUERY.equals(type) && !TYPE_JDBC.equals(type)) {
            throw new IllegalArgumentException("Unsupported warehouse type: " + type + " (expected bigquery or jdbc)");
        }
        if (jdbcPoolSize <= 0) {
            throw new IllegalArgumentException("jdbcPoolSize must be positive");
        }
    }

    static WarehouseConfig fromEnvironment(Environment environment) {
        return new WarehouseConfig(
                EnvironmentValues.getString(environment, "querygate.warehouse.type", "QUERYGATE_WAREHOUSE_TYPE", TYPE_BIGQUERY)
                        .toLowerCase(Locale.ROOT),
                EnvironmentValues.getTrimmed(environment, "querygate.warehouse.project", "GCP_PROJECT_ID"),
                EnvironmentValues.getTrimmed(environment, "querygate.warehouse.location", "BIGQUERY_LOCATION"),
                EnvironmentValues.getTrimmed(environment, "querygate.warehouse.jdbc.url", "QUERYGATE_JDBC_URL"),
                EnvironmentValues.getTrimmed(environment, "querygate.warehouse.jdbc.username", "QUERYGATE_JDBC_USERNAME"),
                EnvironmentValues.getTrimmed(environment, "querygate.warehouse.jdbc.password", "QUERYGATE_JDBC_PASSWORD"),
                EnvironmentValues.getInt(environment, "querygate.warehouse.jdbc.pool-size", "QUERYGATE_JDBC_POOL_SIZE", DEFAULT_POOL_SIZE),
                EnvironmentValues.getString(environment, "querygate.warehouse.jdbc.explain-prefix",
                        "QUERYGATE_JDBC_EXPLAIN_PREFIX", DEFAULT_EXPLAIN_PREFIX)
        );
    }

    public boolean isJdbc() {
        return TYPE_JDBC.equals(type);
    }
}
