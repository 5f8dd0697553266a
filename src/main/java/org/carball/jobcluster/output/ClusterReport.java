package org.carball.jobcluster.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.config.ClusterSettings;
import org.carball.jobcluster.model.cluster.JobClusterStats;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
public class ClusterReport {

    private static final int QUERY_PREVIEW_LENGTH = 150;

    private final List<JobClusterStats> clusters;
    private final ClusterSettings settings;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ClusterReport(List<JobClusterStats> clusters, ClusterSettings settings) {
        this.clusters = clusters;
        this.settings = settings;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes the clusters as a JSON array. Absent optional job fields are written as null.
     */
    public String toJson() {
        try {
            return objectMapper.writeValueAsString(clusters);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# BigQuery Job Cluster Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (settings != null) {
            md.append("**Project:** ").append(settings.getProjectId()).append("  \n");
            md.append("**Jobs Since:** ").append(settings.getCreationTime()).append("  \n");
            md.append("**Distance Threshold:** ").append(settings.getMinDistanceThreshold()).append("  \n");
        }
        md.append("\n");

        // Overview
        long totalJobs = clusters.stream().mapToLong(JobClusterStats::getCount).sum();
        long repeated = clusters.stream().filter(c -> c.getCount() > 1).count();
        long totalBytes = clusters.stream().mapToLong(JobClusterStats::getTotalBytesProcessed).sum();

        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Jobs Analyzed | ").append(totalJobs).append(" |\n");
        md.append("| Clusters | ").append(clusters.size()).append(" |\n");
        md.append("| Repeated Clusters | ").append(repeated).append(" |\n");
        md.append("| Total Bytes Processed | ").append(formatBytes(totalBytes)).append(" |\n\n");

        // Clusters
        md.append("## Clusters by Bytes Processed\n\n");

        if (clusters.isEmpty()) {
            md.append("**No jobs matched the job log query.**\n\n");
        } else {
            md.append("| # | Jobs | Bytes Processed | User | Destination Table | Query |\n");
            md.append("|---|------|-----------------|------|-------------------|-------|\n");

            List<JobClusterStats> byBytes = clusters.stream()
                    .sorted(Comparator.comparingLong(JobClusterStats::getTotalBytesProcessed).reversed())
                    .collect(Collectors.toList());
            int rank = 1;
            for (JobClusterStats cluster : byBytes) {
                md.append("| ").append(rank++)
                        .append(" | ").append(cluster.getCount())
                        .append(" | ").append(formatBytes(cluster.getTotalBytesProcessed()))
                        .append(" | ").append(nullToDash(cluster.getUserEmail()))
                        .append(" | ").append(nullToDash(cluster.getDestinationTable()))
                        .append(" | `").append(queryPreview(cluster.getQuery())).append("` |\n");
            }
            md.append("\n");
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by BigQuery Job Cluster Analyzer*\n");

        return md.toString();
    }

    static String queryPreview(String query) {
        if (query == null) {
            return "";
        }
        String preview = query.length() > QUERY_PREVIEW_LENGTH
                ? query.substring(0, QUERY_PREVIEW_LENGTH) + "..."
                : query;
        return preview.replaceAll("\\s+", " ").replace("|", "\\|").replace("`", "'").trim();
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        String[] units = {"KiB", "MiB", "GiB", "TiB", "PiB", "EiB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, units[unit]);
    }

    private static String nullToDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
