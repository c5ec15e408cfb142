package com.querygate.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class WarehouseConfigTest {

    @Test
    void fromEnvironment_shouldDefaultToBigQuery() {
        WarehouseConfig config = WarehouseConfig.fromEnvironment(new MockEnvironment()
                .withProperty("GCP_PROJECT_ID", "analytics-prod"));

        Assertions.assertFalse(config.isJdbc());
        Assertions.assertEquals("analytics-prod", config.project());
        Assertions.assertEquals("EXPLAIN", config.explainPrefix());
        Assertions.assertEquals(5, config.jdbcPoolSize());
    }

    @Test
    void fromEnvironment_shouldReadJdbcSettings() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("querygate.warehouse.type", "JDBC")
                .withProperty("querygate.warehouse.jdbc.url", "jdbc:postgresql://localhost:5432/dw")
                .withProperty("querygate.warehouse.jdbc.pool-size", "2");

        WarehouseConfig config = WarehouseConfig.fromEnvironment(environment);

        Assertions.assertTrue(config.isJdbc());
        Assertions.assertEquals("jdbc:postgresql://localhost:5432/dw", config.jdbcUrl());
        Assertions.assertEquals(2, config.jdbcPoolSize());
    }

    @Test
    void fromEnvironment_shouldRejectUnknownType() {
        MockEnvironment environment = new MockEnvironment().withProperty("querygate.warehouse.type", "snowflake");

        Assertions.assertThrows(IllegalArgumentException.class, () -> WarehouseConfig.fromEnvironment(environment));
    }
}
