package org.carball.jobcluster.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.jobcluster.model.job.QueryJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobLogJsonExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteMetadataAndJobs() throws Exception {
        // Given
        List<QueryJob> jobs = List.of(
                QueryJob.builder()
                        .jobId("j1")
                        .query("SELECT 1")
                        .creationTime(Instant.parse("2024-02-01T10:00:00Z"))
                        .totalBytesProcessed(10L)
                        .build(),
                QueryJob.builder()
                        .jobId("j2")
                        .query("SELECT 2")
                        .build());
        Path output = tempDir.resolve("export.json");

        // When
        new JobLogJsonExporter().exportToJson(jobs, output, "analytics-prod", "us");

        // Then
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        JsonNode metadata = root.get("export_metadata");
        assertThat(metadata.get("project_id").asText()).isEqualTo("analytics-prod");
        assertThat(metadata.get("region").asText()).isEqualTo("us");
        assertThat(metadata.get("total_jobs").asInt()).isEqualTo(2);
        assertThat(metadata.has("export_timestamp")).isTrue();

        JsonNode first = root.get("jobs").get(0);
        assertThat(first.get("job_id").asText()).isEqualTo("j1");
        assertThat(first.get("creation_time").asText()).isEqualTo("2024-02-01T10:00:00Z");
        assertThat(first.get("total_bytes_processed").asLong()).isEqualTo(10L);
        assertThat(first.has("reservation_id")).isTrue();
        assertThat(first.get("reservation_id").isNull()).isTrue();
    }

    @Test
    void shouldProduceFileReadableByFileConnector() throws Exception {
        List<QueryJob> jobs = List.of(
                QueryJob.builder().jobId("j1").query("SELECT 1").userEmail("a@example.com").build(),
                QueryJob.builder().jobId("j2").query("SELECT 1").userEmail("b@example.com").build());
        Path output = tempDir.resolve("export.json");

        new JobLogJsonExporter().exportToJson(jobs, output, "p", "eu");

        JobLogFileConnector connector = new JobLogFileConnector(output);
        assertThat(connector.getAllJobs()).isEqualTo(jobs);
        assertThat(connector.getExportMetadata().region()).isEqualTo("eu");
    }
}
