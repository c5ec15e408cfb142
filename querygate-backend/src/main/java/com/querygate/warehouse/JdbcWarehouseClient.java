package com.querygate.warehouse;

import com.querygate.api.QueryHistoryEntry;
import com.querygate.model.DryRunResult;
import com.querygate.model.QueryExecutionResult;
import com.querygate.util.JdbcJsonSafe;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapter for warehouses reachable over JDBC.
 *
 * <p>The dry run executes the query behind an {@code EXPLAIN}-style prefix, which makes the engine
 * parse and plan it without reading data. JDBC exposes no byte estimate, so dry runs report 0
 * bytes. Connections are always switched to read-only before use.
 *
 * <p>Closing the client closes the pool when the data source is closeable.
 */
public class JdbcWarehouseClient implements WarehouseClient, AutoCloseable {

    private static final int MAX_FETCH_SIZE = 500;

    private final DataSource dataSource;
    private final String explainPrefix;
    private final WarehouseErrorClassifier classifier;

    public JdbcWarehouseClient(DataSource dataSource, String explainPrefix, WarehouseErrorClassifier classifier) {
        this.dataSource = dataSource;
        this.explainPrefix = explainPrefix;
        this.classifier = classifier;
    }

    @Override
    public DryRunResult dryRun(String project, String sql, Duration timeout) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setReadOnly(true);
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(toQueryTimeoutSeconds(timeout));
                stmt.execute(explainPrefix.trim() + " " + stripTrailingSeparator(sql));
                return DryRunResult.success(0L);
            }
        } catch (SQLException e) {
            return DryRunResult.failure(classifier.classify(e));
        }
    }

    @Override
    public QueryExecutionResult execute(String project, String sql, Duration timeout, int maxResults) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setReadOnly(true);
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(toQueryTimeoutSeconds(timeout));
                stmt.setMaxRows(maxResults);
                stmt.setFetchSize(Math.min(maxResults, MAX_FETCH_SIZE));

                try (ResultSet rs = stmt.executeQuery(stripTrailingSeparator(sql))) {
                    return readResultSet(rs, maxResults);
                }
            }
        } catch (SQLException e) {
            return QueryExecutionResult.failure(classifier.classify(e));
        }
    }

    @Override
    public List<QueryHistoryEntry> recentJobs(int limit) {
        return List.of();
    }

    @Override
    public void close() throws Exception {
        if (dataSource instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    private QueryExecutionResult readResultSet(ResultSet rs, int maxResults) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<String> labels = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            labels.add(metaData.getColumnLabel(i));
        }
        List<String> columns = uniqueColumnNames(labels);

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rows.size() < maxResults && rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), JdbcJsonSafe.readJsonSafeValue(rs, i));
            }
            rows.add(row);
        }
        return QueryExecutionResult.success(rows, columns, 0L, null);
    }

    /**
     * Joins such as {@code SELECT a.id, b.id} return repeated labels. Later duplicates get a
     * {@code _2}, {@code _3}, ... suffix so every column keeps its own key in the row map.
     */
    static List<String> uniqueColumnNames(List<String> labels) {
        Set<String> taken = new HashSet<>(labels);
        Set<String> used = new HashSet<>();
        List<String> out = new ArrayList<>(labels.size());
        for (String label : labels) {
            String name = label;
            if (!used.add(name)) {
                int suffix = 2;
                do {
                    name = label + "_" + suffix++;
                } while (taken.contains(name) || !used.add(name));
            }
            out.add(name);
        }
        return out;
    }

    private int toQueryTimeoutSeconds(Duration timeout) {
        long seconds = Math.max(1L, (timeout.toMillis() + 999) / 1000);
        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }

    static String stripTrailingSeparator(String sql) {
        String trimmed = sql.trim();
        if (trimmed.endsWith(";")) {
            return trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
