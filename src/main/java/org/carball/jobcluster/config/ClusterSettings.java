package org.carball.jobcluster.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;

/**
 * Settings for one clustering run: where the job log comes from and how close two
 * queries must be to fall into the same cluster.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
@JsonDeserialize(builder = ClusterSettings.ClusterSettingsBuilder.class)
public class ClusterSettings {

    public static final int DEFAULT_LOOKBACK_DAYS = 7;

    @JsonProperty("project")
    private String projectId;

    @Builder.Default
    @JsonProperty("region")
    private String region = "us";

    @Builder.Default
    @JsonProperty("type")
    private InformationSchemaScope scope = InformationSchemaScope.PROJECT;

    @Builder.Default
    @JsonProperty("creation_time")
    private LocalDate creationTime = LocalDate.now().minusDays(DEFAULT_LOOKBACK_DAYS);

    @Builder.Default
    @JsonProperty("min_distance_threshold")
    private int minDistanceThreshold = 0;

    public static ClusterSettings defaults() {
        return ClusterSettings.builder().build();
    }

    /**
     * Logs warnings for values that make the run degenerate. Nothing is rejected here.
     */
    public void validate() {
        if (minDistanceThreshold < 0) {
            log.warn("Minimum distance threshold ({}) is negative; only identical queries will be clustered",
                    minDistanceThreshold);
        }

        if (creationTime != null && creationTime.isAfter(LocalDate.now())) {
            log.warn("Creation time {} is in the future; no jobs will match", creationTime);
        }

        log.debug("Using settings - Project: {}, Region: {}, Scope: {}, Threshold: {}",
                projectId, region, scope, minDistanceThreshold);
    }

    public String getConfigurationSummary() {
        return String.format("Project: %s | Region: %s | Scope: %s | Since: %s | Threshold: %d",
                projectId, region, scope, creationTime, minDistanceThreshold);
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClusterSettingsBuilder {
    }
}
