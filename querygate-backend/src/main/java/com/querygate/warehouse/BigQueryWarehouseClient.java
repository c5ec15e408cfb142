package com.querygate.warehouse;

import com.google.api.gax.paging.Page;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobConfiguration;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.JobStatus;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.TableResult;
import com.querygate.api.QueryHistoryEntry;
import com.querygate.model.ClassifiedError;
import com.querygate.model.DryRunResult;
import com.querygate.model.QueryExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BigQuery adapter. Dry runs bypass the query cache so the estimate reflects this query; real runs
 * use standard SQL and return at most {@code maxResults} rows from the first result page.
 */
@Slf4j
public class BigQueryWarehouseClient implements WarehouseClient {

    private final BigQuery bigQuery;
    private final String defaultProject;
    private final String location;
    private final WarehouseErrorClassifier classifier;

    public BigQueryWarehouseClient(BigQuery bigQuery, String defaultProject, String location, WarehouseErrorClassifier classifier) {
        this.bigQuery = bigQuery;
        this.defaultProject = defaultProject;
        this.location = location;
        this.classifier = classifier;
    }

    @Override
    public DryRunResult dryRun(String project, String sql, Duration timeout) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(sql)
                .setDryRun(true)
                .setUseQueryCache(false)
                .setUseLegacySql(false)
                .setJobTimeoutMs(timeout.toMillis())
                .build();
        try {
            Job job = bigQuery.create(JobInfo.of(newJobId(project), config));
            JobStatistics.QueryStatistics statistics = job.getStatistics();
            Long bytes = statistics != null ? statistics.getTotalBytesProcessed() : null;
            return DryRunResult.success(bytes != null ? bytes : 0L);
        } catch (RuntimeException e) {
            return DryRunResult.failure(classifier.classify(e));
        }
    }

    @Override
    public QueryExecutionResult execute(String project, String sql, Duration timeout, int maxResults) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(sql)
                .setUseQueryCache(true)
                .setUseLegacySql(false)
                .setJobTimeoutMs(timeout.toMillis())
                .build();

        JobId jobId = newJobId(project);
        try {
            Job job = bigQuery.create(JobInfo.of(jobId, config));
            TableResult result = job.getQueryResults(
                    BigQuery.QueryResultsOption.pageSize(maxResults),
                    BigQuery.QueryResultsOption.maxWaitTime(timeout.toMillis())
            );

            List<String> columns = new ArrayList<>();
            FieldList fields = null;
            Schema schema = result.getSchema();
            if (schema != null) {
                fields = schema.getFields();
                for (Field field : fields) {
                    columns.add(field.getName());
                }
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            for (FieldValueList values : result.getValues()) {
                if (rows.size() >= maxResults) {
                    break;
                }
                rows.add(toRow(values, fields));
            }

            Job finished = job.reload();
            JobStatistics.QueryStatistics statistics = (finished != null ? finished : job).getStatistics();
            Long bytes = statistics != null ? statistics.getTotalBytesProcessed() : null;

            return QueryExecutionResult.success(rows, columns, bytes != null ? bytes : 0L, jobId.getJob());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelQuietly(jobId);
            return QueryExecutionResult.failure(classifier.classify(e));
        } catch (RuntimeException e) {
            return QueryExecutionResult.failure(classifier.classify(e));
        }
    }

    @Override
    public List<QueryHistoryEntry> recentJobs(int limit) {
        List<QueryHistoryEntry> history = new ArrayList<>();
        Page<Job> page = bigQuery.listJobs(BigQuery.JobListOption.pageSize(limit));
        if (page == null) {
            return history;
        }
        for (Job job : page.getValues()) {
            if (history.size() >= limit) {
                break;
            }
            JobConfiguration configuration = job.getConfiguration();
            if (!(configuration instanceof QueryJobConfiguration queryConfiguration)) {
                continue;
            }
            history.add(toHistoryEntry(job, queryConfiguration));
        }
        return history;
    }

    private QueryHistoryEntry toHistoryEntry(Job job, QueryJobConfiguration configuration) {
        JobStatistics statistics = job.getStatistics();
        OffsetDateTime createdAt = null;
        Long bytes = null;
        if (statistics != null) {
            if (statistics.getCreationTime() != null) {
                createdAt = Instant.ofEpochMilli(statistics.getCreationTime()).atOffset(ZoneOffset.UTC);
            }
            if (statistics instanceof JobStatistics.QueryStatistics queryStatistics) {
                bytes = queryStatistics.getTotalBytesProcessed();
            }
        }

        JobStatus status = job.getStatus();
        String state = status != null && status.getState() != null ? status.getState().name() : null;
        BigQueryError error = status != null ? status.getError() : null;

        return QueryHistoryEntry.builder()
                .jobId(job.getJobId() != null ? job.getJobId().getJob() : null)
                .query(configuration.getQuery())
                .createdAt(createdAt)
                .state(state)
                .bytesProcessed(bytes)
                .error(error != null ? error.getMessage() : null)
                .build();
    }

    private JobId newJobId(String project) {
        JobId.Builder builder = JobId.newBuilder().setRandomJob();
        String resolvedProject = project != null && !project.isBlank() ? project : defaultProject;
        if (resolvedProject != null && !resolvedProject.isBlank()) {
            builder.setProject(resolvedProject);
        }
        if (location != null && !location.isBlank()) {
            builder.setLocation(location);
        }
        return builder.build();
    }

    private void cancelQuietly(JobId jobId) {
        try {
            bigQuery.cancel(jobId);
        } catch (RuntimeException e) {
            ClassifiedError classified = classifier.classify(e);
            log.warn("Failed to cancel interrupted job (job_id={}, kind={}): {}", jobId.getJob(), classified.getKind(), classified.getMessage());
        }
    }

    private Map<String, Object> toRow(FieldValueList values, FieldList fields) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (fields == null) {
            for (int i = 0; i < values.size(); i++) {
                row.put("f" + i, toJsonSafe(values.get(i), null));
            }
            return row;
        }
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            row.put(field.getName(), toJsonSafe(values.get(i), field));
        }
        return row;
    }

    private Object toJsonSafe(FieldValue value, Field field) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() == FieldValue.Attribute.REPEATED) {
            List<Object> out = new ArrayList<>();
            for (FieldValue element : value.getRepeatedValue()) {
                out.add(toJsonSafe(element, field));
            }
            return out;
        }
        if (value.getAttribute() == FieldValue.Attribute.RECORD) {
            FieldValueList record = value.getRecordValue();
            FieldList subFields = field != null ? field.getSubFields() : null;
            return toRow(record, subFields);
        }
        if (value.getAttribute() != FieldValue.Attribute.PRIMITIVE || field == null) {
            return String.valueOf(value.getValue());
        }

        LegacySQLTypeName type = field.getType();
        if (LegacySQLTypeName.INTEGER.equals(type)) {
            return value.getLongValue();
        }
        if (LegacySQLTypeName.FLOAT.equals(type)) {
            return value.getDoubleValue();
        }
        if (LegacySQLTypeName.NUMERIC.equals(type) || LegacySQLTypeName.BIGNUMERIC.equals(type)) {
            return value.getNumericValue();
        }
        if (LegacySQLTypeName.BOOLEAN.equals(type)) {
            return value.getBooleanValue();
        }
        if (LegacySQLTypeName.TIMESTAMP.equals(type)) {
            return Instant.EPOCH.plus(value.getTimestampValue(), ChronoUnit.MICROS).toString();
        }
        return value.getStringValue();
    }
}
