package org.carball.jobcluster.model.cluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;
import org.carball.jobcluster.model.job.QueryJob;

import java.util.List;

/**
 * Aggregate statistics for one cluster of similar query jobs.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"jobs", "count", "total_bytes_processed", "query", "user_email", "destination_table"})
public class JobClusterStats {

    @JsonProperty("jobs")
    private List<QueryJob> jobs;

    @JsonProperty("count")
    private int count;

    @JsonProperty("total_bytes_processed")
    private long totalBytesProcessed;

    @JsonProperty("query")
    private String query;

    @JsonProperty("user_email")
    private String userEmail;

    @JsonProperty("destination_table")
    private String destinationTable;
}
