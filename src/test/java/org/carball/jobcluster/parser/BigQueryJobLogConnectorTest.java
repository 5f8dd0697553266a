package org.carball.jobcluster.parser;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableResult;
import org.carball.jobcluster.config.ClusterSettings;
import org.carball.jobcluster.model.job.QueryJob;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BigQueryJobLogConnectorTest {

    @Test
    void shouldMapRowToJob() throws Exception {
        // Given
        Map<String, String> values = fullRow();

        // When
        QueryJob job = BigQueryJobLogConnector.toJob(row(values));

        // Then
        assertThat(job.creationTime()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(job.projectId()).isEqualTo("analytics-prod");
        assertThat(job.projectNumber()).isEqualTo(123456789L);
        assertThat(job.userEmail()).isEqualTo("alice@example.com");
        assertThat(job.jobId()).isEqualTo("bquxjob_1");
        assertThat(job.startTime()).isEqualTo(Instant.parse("2023-11-14T22:13:21.500Z"));
        assertThat(job.query()).isEqualTo("SELECT * FROM sales");
        assertThat(job.destinationTable()).isEqualTo("analytics-prod:tmp.daily");
        assertThat(job.totalBytesProcessed()).isEqualTo(1048576L);
        assertThat(job.totalSlotMs()).isEqualTo(5300L);
    }

    @Test
    void shouldMapNullColumnsToNull() throws Exception {
        Map<String, String> values = fullRow();
        values.put("StatementType", null);
        values.put("ReservationId", null);
        values.put("TotalBytesProcessed", null);
        values.put("TotalSlotMs", null);

        QueryJob job = BigQueryJobLogConnector.toJob(row(values));

        assertThat(job.statementType()).isNull();
        assertThat(job.reservationId()).isNull();
        assertThat(job.totalBytesProcessed()).isNull();
        assertThat(job.totalSlotMs()).isNull();
        assertThat(job.bytesProcessedOrZero()).isZero();
    }

    @Test
    void shouldRejectRowWithoutQuery() {
        Map<String, String> values = fullRow();
        values.put("Query", null);

        assertThatThrownBy(() -> BigQueryJobLogConnector.toJob(row(values)))
                .isInstanceOf(JobLogSourceException.class)
                .hasMessageContaining("bquxjob_1");
    }

    @Test
    void shouldRejectRowWithoutJobId() {
        Map<String, String> values = fullRow();
        values.put("JobId", null);

        assertThatThrownBy(() -> BigQueryJobLogConnector.toJob(row(values)))
                .isInstanceOf(JobLogSourceException.class)
                .hasMessageContaining("missing JobId or Query");
    }

    @Test
    void shouldFetchEveryRowInOrder() throws Exception {
        // Given
        Map<String, String> second = fullRow();
        second.put("JobId", "bquxjob_2");
        second.put("Query", "SELECT * FROM users");
        TableResult result = mock(TableResult.class);
        when(result.iterateAll()).thenReturn(List.of(row(fullRow()), row(second)));
        BigQuery bigQuery = mock(BigQuery.class);
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);

        // When
        List<QueryJob> jobs = new BigQueryJobLogConnector(bigQuery, settings()).getAllJobs();

        // Then
        assertThat(jobs).extracting(QueryJob::jobId).containsExactly("bquxjob_1", "bquxjob_2");
        assertThat(jobs).extracting(QueryJob::query).containsExactly("SELECT * FROM sales", "SELECT * FROM users");
    }

    @Test
    void shouldRaiseSourceErrorWhenQueryFails() throws Exception {
        // Given a client whose query always fails
        BigQuery failing = mock(BigQuery.class);
        when(failing.query(any(QueryJobConfiguration.class)))
                .thenThrow(new BigQueryException(403, "Access Denied: INFORMATION_SCHEMA.JOBS_BY_PROJECT"));

        // When / Then
        assertThatThrownBy(() -> new BigQueryJobLogConnector(failing, settings()).getAllJobs())
                .isInstanceOf(JobLogSourceException.class)
                .hasMessageContaining("Access Denied")
                .hasCauseInstanceOf(BigQueryException.class);
    }

    @Test
    void shouldRaiseSourceErrorForRowWithoutQuery() throws Exception {
        Map<String, String> broken = fullRow();
        broken.put("Query", null);
        TableResult result = mock(TableResult.class);
        when(result.iterateAll()).thenReturn(List.of(row(fullRow()), row(broken)));
        BigQuery bigQuery = mock(BigQuery.class);
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);

        assertThatThrownBy(() -> new BigQueryJobLogConnector(bigQuery, settings()).getAllJobs())
                .isInstanceOf(JobLogSourceException.class)
                .hasMessageContaining("missing JobId or Query");
    }

    private static ClusterSettings settings() {
        return ClusterSettings.builder()
                .projectId("analytics-prod")
                .creationTime(LocalDate.of(2024, 1, 31))
                .build();
    }

    private static Map<String, String> fullRow() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("CreationTime", "1700000000.0");
        values.put("ProjectId", "analytics-prod");
        values.put("ProjectNumber", "123456789");
        values.put("UserEmail", "alice@example.com");
        values.put("JobId", "bquxjob_1");
        values.put("JobType", "QUERY");
        values.put("StatementType", "SELECT");
        values.put("Priority", "INTERACTIVE");
        values.put("StartTime", "1700000001.5");
        values.put("EndTime", "1700000009.0");
        values.put("Query", "SELECT * FROM sales");
        values.put("DestinationTable", "analytics-prod:tmp.daily");
        values.put("State", "DONE");
        values.put("ReservationId", "analytics-prod:US.default");
        values.put("TotalBytesProcessed", "1048576");
        values.put("TotalSlotMs", "5300");
        return values;
    }

    private static FieldValueList row(Map<String, String> values) {
        List<Field> fields = new ArrayList<>();
        List<FieldValue> row = new ArrayList<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            fields.add(Field.of(entry.getKey(), LegacySQLTypeName.STRING));
            row.add(FieldValue.of(FieldValue.Attribute.PRIMITIVE, entry.getValue()));
        }
        return FieldValueList.of(row, FieldList.of(fields));
    }
}
