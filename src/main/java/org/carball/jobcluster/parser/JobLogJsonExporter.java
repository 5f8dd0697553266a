package org.carball.jobcluster.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.model.job.QueryJob;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports fetched query jobs to the JSON format read by {@link JobLogFileConnector}.
 */
@Slf4j
public class JobLogJsonExporter {

    private final ObjectMapper objectMapper;

    public JobLogJsonExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Exports jobs to a JSON file, preserving their order.
     */
    public void exportToJson(List<QueryJob> jobs, Path outputPath, String projectId, String region) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_id", projectId);
        metadata.put("region", region);
        metadata.put("export_timestamp", Instant.now().toString());
        metadata.put("total_jobs", jobs.size());

        Map<String, Object> exportData = new LinkedHashMap<>();
        exportData.put("export_metadata", metadata);
        exportData.put("jobs", jobs);

        objectMapper.writeValue(outputPath.toFile(), exportData);
        log.info("Exported {} jobs to {}", jobs.size(), outputPath);
    }
}
