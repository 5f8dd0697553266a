package org.carball.jobcluster.model.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * Represents one executed BigQuery query job taken from the INFORMATION_SCHEMA job log.
 * Optional columns are {@code null} when absent.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record QueryJob(
        @JsonProperty("creation_time") Instant creationTime,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("project_number") long projectNumber,
        @JsonProperty("user_email") String userEmail,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("statement_type") String statementType,
        @JsonProperty("priority") String priority,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("query") String query,
        @JsonProperty("destination_table") String destinationTable,
        @JsonProperty("state") String state,
        @JsonProperty("reservation_id") String reservationId,
        @JsonProperty("total_bytes_processed") Long totalBytesProcessed,
        @JsonProperty("total_slot_ms") Long totalSlotMs
) {

    /**
     * Bytes processed by the job, counting an absent value as zero.
     */
    public long bytesProcessedOrZero() {
        return totalBytesProcessed == null ? 0L : totalBytesProcessed;
    }
}
