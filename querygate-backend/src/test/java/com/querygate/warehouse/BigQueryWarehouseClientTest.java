package com.querygate.warehouse;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.querygate.model.ClassifiedError;
import com.querygate.model.DryRunResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BigQueryWarehouseClientTest {

    @Mock
    private BigQuery bigQuery;
    @Mock
    private Job job;
    @Mock
    private JobStatistics.QueryStatistics statistics;

    private BigQueryWarehouseClient client;

    @BeforeEach
    void setUp() {
        client = new BigQueryWarehouseClient(bigQuery, "analytics-prod", "US", new BigQueryErrorClassifier());
    }

    @Test
    void dryRun_shouldRequestUncachedDryRunAndReturnBytes() {
        when(bigQuery.create(any(JobInfo.class))).thenReturn(job);
        doReturn(statistics).when(job).getStatistics();
        when(statistics.getTotalBytesProcessed()).thenReturn(2048L);

        DryRunResult result = client.dryRun(null, "SELECT * FROM orders LIMIT 10", Duration.ofSeconds(30));

        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals(2048L, result.getBytesProcessed());

        ArgumentCaptor<JobInfo> captor = ArgumentCaptor.forClass(JobInfo.class);
        verify(bigQuery).create(captor.capture());
        QueryJobConfiguration configuration = captor.getValue().getConfiguration();
        Assertions.assertTrue(configuration.dryRun());
        Assertions.assertFalse(configuration.useQueryCache());
        Assertions.assertFalse(configuration.useLegacySql());
        Assertions.assertEquals("analytics-prod", captor.getValue().getJobId().getProject());
        Assertions.assertEquals("US", captor.getValue().getJobId().getLocation());
    }

    @Test
    void dryRun_shouldPreferRequestProject() {
        when(bigQuery.create(any(JobInfo.class))).thenReturn(job);
        doReturn(statistics).when(job).getStatistics();
        when(statistics.getTotalBytesProcessed()).thenReturn(null);

        DryRunResult result = client.dryRun("sandbox", "SELECT 1", Duration.ofSeconds(30));

        Assertions.assertEquals(0L, result.getBytesProcessed());
        ArgumentCaptor<JobInfo> captor = ArgumentCaptor.forClass(JobInfo.class);
        verify(bigQuery).create(captor.capture());
        Assertions.assertEquals("sandbox", captor.getValue().getJobId().getProject());
    }

    @Test
    void dryRun_shouldClassifyInvalidQuery() {
        when(bigQuery.create(any(JobInfo.class))).thenThrow(new BigQueryException(400, "Syntax error: Expected end of input",
                new BigQueryError("invalidQuery", "query", "Syntax error: Expected end of input")));

        DryRunResult result = client.dryRun(null, "SELECT FROM", Duration.ofSeconds(30));

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(ClassifiedError.Kind.LOGIC, result.getError().getKind());
    }
}
