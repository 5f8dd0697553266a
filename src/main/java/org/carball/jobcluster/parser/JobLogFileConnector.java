package org.carball.jobcluster.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.model.job.QueryJob;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads query jobs from an exported JSON file instead of querying BigQuery.
 */
@Slf4j
public class JobLogFileConnector implements JobLogSource {

    private static final String[] REQUIRED_METADATA_FIELDS = {"project_id", "export_timestamp", "total_jobs"};

    private final ObjectMapper objectMapper;
    private final JsonNode exportData;

    public JobLogFileConnector(Path path) throws JobLogSourceException {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        if (!Files.exists(path)) {
            throw new JobLogSourceException("Job export file not found: " + path);
        }

        try {
            exportData = objectMapper.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new JobLogSourceException("Invalid JSON in job export file " + path + ": " + e.getMessage(), e);
        }

        validateExportFormat();
        log.debug("Loaded job export file {}", path);
    }

    /**
     * Extracts all jobs in file order.
     */
    @Override
    public List<QueryJob> getAllJobs() throws JobLogSourceException {
        List<QueryJob> results = new ArrayList<>();
        JsonNode jobs = exportData.get("jobs");

        for (int i = 0; i < jobs.size(); i++) {
            JsonNode jobNode = jobs.get(i);
            try {
                QueryJob job = objectMapper.treeToValue(jobNode, QueryJob.class);
                if (job.jobId() == null || job.query() == null) {
                    throw new JobLogSourceException("Job #" + i + " is missing job_id or query");
                }
                results.add(job);
            } catch (JsonProcessingException e) {
                throw new JobLogSourceException("Malformed job #" + i + ": " + e.getOriginalMessage(), e);
            }
        }

        return results;
    }

    /**
     * Gets export metadata including project, region and export timestamp.
     */
    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        JsonNode region = metadata.get("region");

        return new ExportMetadata(
                metadata.get("project_id").asText(),
                region == null || region.isNull() ? null : region.asText(),
                metadata.get("export_timestamp").asText(),
                metadata.get("total_jobs").asInt()
        );
    }

    private void validateExportFormat() throws JobLogSourceException {
        if (exportData == null || !exportData.isObject()) {
            throw new JobLogSourceException("Invalid JSON format in job export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new JobLogSourceException("Missing export_metadata section in job export file");
        }

        JsonNode jobs = exportData.get("jobs");
        if (jobs == null || !jobs.isArray()) {
            throw new JobLogSourceException("Missing or invalid jobs section in job export file");
        }

        for (String field : REQUIRED_METADATA_FIELDS) {
            if (!metadata.has(field)) {
                throw new JobLogSourceException("Missing required metadata field: " + field);
            }
        }

        int declared = metadata.get("total_jobs").asInt();
        if (declared != jobs.size()) {
            log.warn("Export metadata declares {} jobs but the file contains {}", declared, jobs.size());
        }
    }

    /**
     * Metadata about the job export.
     */
    public record ExportMetadata(String projectId, String region, String exportTimestamp, int totalJobs) {

        @Override
        public String toString() {
            return String.format("ExportMetadata{project='%s', region='%s', timestamp='%s', jobs=%d}",
                    projectId, region, exportTimestamp, totalJobs);
        }
    }
}
