package org.carball.jobcluster.parser;

import org.carball.jobcluster.config.InformationSchemaScope;

/**
 * Builds the INFORMATION_SCHEMA query that lists finished query jobs whose
 * destination table has not been read by any job since the creation time.
 */
public final class JobLogQueryBuilder {

    public static final int MAX_JOBS = 10000;

    private static final String JOB_LOG_QUERY = """
        WITH
          filtered_jobs AS (
          SELECT
            *
          FROM
            %1$s
          WHERE
            TRUE
            AND job_type = "QUERY"
            AND state = "DONE"
            AND destination_table.project_id IS NOT NULL
            AND NOT STARTS_WITH(destination_table.dataset_id, "_")
            AND creation_time > "%2$s"
          ORDER BY
            total_bytes_processed DESC ),
          referenced_tables AS (
          SELECT
            referenced_tables.project_id,
            referenced_tables.dataset_id,
            referenced_tables.table_id,
          FROM
            %3$s,
            UNNEST(referenced_tables) AS referenced_tables
          WHERE
            creation_time > "%2$s"
          GROUP BY
            referenced_tables.project_id,
            referenced_tables.dataset_id,
            referenced_tables.table_id )
        SELECT
          creation_time AS CreationTime,
          project_id AS ProjectId,
          project_number AS ProjectNumber,
          user_email AS UserEmail,
          job_id AS JobId,
          job_type AS JobType,
          statement_type AS StatementType,
          priority AS Priority,
          start_time AS StartTime,
          end_time AS EndTime,
          query AS Query,
          destination_table.project_id || ":" || destination_table.dataset_id || "." || destination_table.table_id AS DestinationTable,
          state AS State,
          reservation_id AS ReservationId,
          total_bytes_processed AS TotalBytesProcessed,
          total_slot_ms AS TotalSlotMs,
        FROM
          filtered_jobs
        WHERE
          destination_table.project_id || ":" || destination_table.dataset_id || "." || destination_table.table_id NOT IN (
            SELECT
              project_id || ":" || dataset_id || "." || table_id
            FROM
              referenced_tables
          )
        LIMIT %4$d
        """;

    private JobLogQueryBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the job log query.
     *
     * @param projectId    project whose jobs are listed
     * @param region       BigQuery region, e.g. {@code us} or {@code asia-northeast1}
     * @param scope        view used to collect referenced tables
     * @param creationTime lower bound for job creation time, e.g. {@code 2024-01-31}
     */
    public static String build(String projectId, String region, InformationSchemaScope scope, String creationTime) {
        // The query column is only present in the project-level view
        String jobsView = "`" + projectId + "`.`region-" + region + "`.INFORMATION_SCHEMA.JOBS_BY_PROJECT";

        return String.format(JOB_LOG_QUERY, jobsView, creationTime, referencedTablesView(projectId, region, scope), MAX_JOBS);
    }

    static String referencedTablesView(String projectId, String region, InformationSchemaScope scope) {
        switch (scope) {
            case PROJECT:
                return "`" + projectId + "`.`region-" + region + "`.INFORMATION_SCHEMA.JOBS_BY_PROJECT";
            case ORGANIZATION:
                return "`region-" + region + "`.INFORMATION_SCHEMA.JOBS_BY_ORGANIZATION";
            default:
                throw new IllegalArgumentException("Unsupported scope: " + scope);
        }
    }
}
