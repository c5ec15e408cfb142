package com.querygate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import com.querygate.cost.CostModel;
import com.querygate.repair.LlmRepairClient;
import com.querygate.repair.NoOpRepairClient;
import com.querygate.repair.RepairClient;
import com.querygate.repair.RepairConfig;
import com.querygate.warehouse.BigQueryErrorClassifier;
import com.querygate.warehouse.BigQueryWarehouseClient;
import com.querygate.warehouse.JdbcWarehouseClient;
import com.querygate.warehouse.SqlStateErrorClassifier;
import com.querygate.warehouse.WarehouseClient;
import com.querygate.warehouse.WarehouseGateway;
import com.querygate.warehouse.WarehouseSqlExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the execution core from {@code querygate.*} settings.
 */
@Slf4j
@Configuration
public class QueryGateConfiguration {

    @Bean
    public PricingConfig pricingConfig(Environment environment) {
        return PricingConfig.fromEnvironment(environment);
    }

    @Bean
    public BackoffConfig backoffConfig(Environment environment) {
        return BackoffConfig.fromEnvironment(environment);
    }

    @Bean
    public ExecutionConfig executionConfig(Environment environment) {
        return ExecutionConfig.fromEnvironment(environment);
    }

    @Bean
    public WarehouseConfig warehouseConfig(Environment environment) {
        return WarehouseConfig.fromEnvironment(environment);
    }

    @Bean
    public CostModel costModel(PricingConfig pricingConfig) {
        return new CostModel(pricingConfig);
    }

    /**
     * Engine adapter selected by {@code querygate.warehouse.type}.
     *
     * <p>For JDBC the adapter owns a HikariCP pool, closed together with the context through
     * {@link JdbcWarehouseClient#close()}.
     */
    @Bean
    public WarehouseClient warehouseClient(WarehouseConfig warehouseConfig) {
        if (warehouseConfig.isJdbc()) {
            log.info("Warehouse engine: jdbc (url={}, pool_size={}, explain_prefix={})",
                    warehouseConfig.jdbcUrl(), warehouseConfig.jdbcPoolSize(), warehouseConfig.explainPrefix());
            return new JdbcWarehouseClient(
                    new HikariDataSource(buildHikariConfig(warehouseConfig)),
                    warehouseConfig.explainPrefix(),
                    new SqlStateErrorClassifier()
            );
        }

        BigQueryOptions.Builder options = BigQueryOptions.newBuilder();
        if (warehouseConfig.project() != null && !warehouseConfig.project().isBlank()) {
            options.setProjectId(warehouseConfig.project());
        }
        if (warehouseConfig.location() != null && !warehouseConfig.location().isBlank()) {
            options.setLocation(warehouseConfig.location());
        }
        BigQuery bigQuery = options.build().getService();
        log.info("Warehouse engine: bigquery (project={}, location={})", bigQuery.getOptions().getProjectId(), warehouseConfig.location());
        return new BigQueryWarehouseClient(bigQuery, warehouseConfig.project(), warehouseConfig.location(), new BigQueryErrorClassifier());
    }

    @Bean
    public WarehouseGateway warehouseGateway(WarehouseClient warehouseClient, BackoffConfig backoffConfig, ExecutionConfig executionConfig) {
        return new WarehouseGateway(warehouseClient, backoffConfig, executionConfig.dryRunTimeout());
    }

    /**
     * Repair client, or a no-op when the gateway is not fully configured. Secrets are not logged.
     */
    @Bean
    public RepairClient repairClient(ObjectMapper objectMapper, Environment environment) {
        RepairConfig config = RepairConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("Query repair is ENABLED (gateway_base_url={}, model={}, timeout_ms={})",
                    config.baseUrl(), config.model(), config.timeoutMs());
            return new LlmRepairClient(objectMapper, config);
        }

        log.warn("Query repair is DISABLED (gateway_base_url={}, api_key_configured={}, provider_configured={}, model_configured={})",
                config.baseUrl(),
                config.apiKey() != null && !config.apiKey().isBlank(),
                config.provider() != null && !config.provider().isBlank(),
                config.model() != null && !config.model().isBlank());
        return new NoOpRepairClient();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(ExecutionConfig executionConfig) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "querygate-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(executionConfig.workerThreads(), threadFactory);
    }

    private HikariConfig buildHikariConfig(WarehouseConfig warehouseConfig) {
        if (warehouseConfig.jdbcUrl() == null || warehouseConfig.jdbcUrl().isBlank()) {
            throw new IllegalArgumentException("querygate.warehouse.jdbc.url is required when querygate.warehouse.type=jdbc");
        }
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(WarehouseSqlExceptionOverride.class.getName());
        config.setJdbcUrl(warehouseConfig.jdbcUrl());
        config.setUsername(warehouseConfig.jdbcUsername());
        config.setPassword(warehouseConfig.jdbcPassword());
        config.setReadOnly(true);
        config.setMaximumPoolSize(warehouseConfig.jdbcPoolSize());
        config.setMinimumIdle(0);
        config.setPoolName("querygate-warehouse");
        config.addDataSourceProperty("ApplicationName", "querygate");
        return config;
    }
}
