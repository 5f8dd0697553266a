package org.carball.jobcluster.parser;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableResult;
import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.config.ClusterSettings;
import org.carball.jobcluster.model.job.QueryJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads the query job log of a project from BigQuery INFORMATION_SCHEMA.
 */
@Slf4j
public class BigQueryJobLogConnector implements JobLogSource {

    private final BigQuery bigQuery;
    private final ClusterSettings settings;

    public BigQueryJobLogConnector(ClusterSettings settings) {
        this(BigQueryOptions.newBuilder()
                .setProjectId(settings.getProjectId())
                .build()
                .getService(), settings);
    }

    public BigQueryJobLogConnector(BigQuery bigQuery, ClusterSettings settings) {
        this.bigQuery = bigQuery;
        this.settings = settings;
    }

    /**
     * Runs the job log query and maps every row. Fails as a whole: no partial list is returned.
     */
    @Override
    public List<QueryJob> getAllJobs() throws JobLogSourceException {
        String sql = JobLogQueryBuilder.build(
                settings.getProjectId(),
                settings.getRegion(),
                settings.getScope(),
                settings.getCreationTime().toString());

        log.info("Querying job log of project {} in region {} since {}",
                settings.getProjectId(), settings.getRegion(), settings.getCreationTime());
        log.debug("Job log query: {}", sql);

        try {
            QueryJobConfiguration cfg = QueryJobConfiguration.newBuilder(sql)
                    .setUseLegacySql(false)
                    .build();
            TableResult result = bigQuery.query(cfg);

            List<QueryJob> jobs = new ArrayList<>();
            for (FieldValueList row : result.iterateAll()) {
                jobs.add(toJob(row));
            }

            log.info("Fetched {} jobs from BigQuery", jobs.size());
            return jobs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobLogSourceException("Interrupted while waiting for the job log query", e);
        } catch (BigQueryException e) {
            log.error("Job log query failed for project {}", settings.getProjectId(), e);
            throw new JobLogSourceException("BigQuery job log query failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Could not read job log rows for project {}", settings.getProjectId(), e);
            throw new JobLogSourceException("Malformed job log row: " + e.getMessage(), e);
        }
    }

    /**
     * Maps one result row, addressed by the column aliases of the job log query.
     * Rows without a job id or query text are rejected.
     */
    static QueryJob toJob(FieldValueList row) throws JobLogSourceException {
        QueryJob job = QueryJob.builder()
                .creationTime(timestamp(row.get("CreationTime")))
                .projectId(string(row.get("ProjectId")))
                .projectNumber(row.get("ProjectNumber").isNull() ? 0L : row.get("ProjectNumber").getLongValue())
                .userEmail(string(row.get("UserEmail")))
                .jobId(string(row.get("JobId")))
                .jobType(string(row.get("JobType")))
                .statementType(string(row.get("StatementType")))
                .priority(string(row.get("Priority")))
                .startTime(timestamp(row.get("StartTime")))
                .endTime(timestamp(row.get("EndTime")))
                .query(string(row.get("Query")))
                .destinationTable(string(row.get("DestinationTable")))
                .state(string(row.get("State")))
                .reservationId(string(row.get("ReservationId")))
                .totalBytesProcessed(nullableLong(row.get("TotalBytesProcessed")))
                .totalSlotMs(nullableLong(row.get("TotalSlotMs")))
                .build();

        if (job.jobId() == null || job.query() == null) {
            throw new JobLogSourceException("Job log row is missing JobId or Query: " + job.jobId());
        }
        return job;
    }

    private static String string(FieldValue value) {
        return value.isNull() ? null : value.getStringValue();
    }

    private static Long nullableLong(FieldValue value) {
        return value.isNull() ? null : value.getLongValue();
    }

    private static Instant timestamp(FieldValue value) {
        if (value.isNull()) {
            return null;
        }
        long micros = value.getTimestampValue();
        return Instant.ofEpochSecond(
                TimeUnit.MICROSECONDS.toSeconds(micros),
                TimeUnit.MICROSECONDS.toNanos(micros % TimeUnit.SECONDS.toMicros(1)));
    }
}
