package org.carball.jobcluster.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultSettings() throws Exception {
        // When
        ClusterSettings settings = new ConfigurationLoader(Map.of()).loadSettings(new String[0]);

        // Then
        assertThat(settings.getProjectId()).isNull();
        assertThat(settings.getRegion()).isEqualTo("us");
        assertThat(settings.getScope()).isEqualTo(InformationSchemaScope.PROJECT);
        assertThat(settings.getMinDistanceThreshold()).isZero();
        assertThat(settings.getCreationTime()).isEqualTo(LocalDate.now().minusDays(7));
    }

    @Test
    void shouldParseCLIArguments() throws Exception {
        // Given
        String[] args = {
                "--project", "analytics-prod",
                "--region", "asia-northeast1",
                "--type", "organization",
                "--creation-time", "2024-01-31",
                "--min-distance-threshold", "12"
        };

        // When
        ClusterSettings settings = new ConfigurationLoader(Map.of()).loadSettings(args);

        // Then
        assertThat(settings.getProjectId()).isEqualTo("analytics-prod");
        assertThat(settings.getRegion()).isEqualTo("asia-northeast1");
        assertThat(settings.getScope()).isEqualTo(InformationSchemaScope.ORGANIZATION);
        assertThat(settings.getCreationTime()).isEqualTo(LocalDate.of(2024, 1, 31));
        assertThat(settings.getMinDistanceThreshold()).isEqualTo(12);
    }

    @Test
    void shouldAcceptShortOptions() throws Exception {
        ClusterSettings settings = new ConfigurationLoader(Map.of())
                .loadSettings(new String[]{"-p", "proj", "-r", "eu", "-t", "PROJECT"});

        assertThat(settings.getProjectId()).isEqualTo("proj");
        assertThat(settings.getRegion()).isEqualTo("eu");
    }

    @Test
    void shouldApplyEnvironmentVariables() throws Exception {
        Map<String, String> env = Map.of(
                "JOBCLUSTER_PROJECT", "env-project",
                "JOBCLUSTER_REGION", "eu",
                "JOBCLUSTER_TYPE", "ORGANIZATION",
                "JOBCLUSTER_CREATION_TIME", "2024-03-01",
                "JOBCLUSTER_MIN_DISTANCE_THRESHOLD", "5");

        ClusterSettings settings = new ConfigurationLoader(env).loadSettings(new String[0]);

        assertThat(settings.getProjectId()).isEqualTo("env-project");
        assertThat(settings.getRegion()).isEqualTo("eu");
        assertThat(settings.getScope()).isEqualTo(InformationSchemaScope.ORGANIZATION);
        assertThat(settings.getCreationTime()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(settings.getMinDistanceThreshold()).isEqualTo(5);
    }

    @Test
    void shouldPreferCLIOverEnvironmentOverSettingsFile() throws Exception {
        // Given
        Path settingsFile = tempDir.resolve("settings.yml");
        Files.writeString(settingsFile, """
                project: file-project
                region: asia-northeast1
                creation_time: 2024-01-01
                min_distance_threshold: 3
                """);
        Map<String, String> env = Map.of(
                "JOBCLUSTER_REGION", "eu",
                "JOBCLUSTER_MIN_DISTANCE_THRESHOLD", "7");
        String[] args = {"--settings", settingsFile.toString(), "--min-distance-threshold", "9"};

        // When
        ClusterSettings settings = new ConfigurationLoader(env).loadSettings(args);

        // Then - CLI > env vars > settings file > defaults
        assertThat(settings.getMinDistanceThreshold()).isEqualTo(9);
        assertThat(settings.getRegion()).isEqualTo("eu");
        assertThat(settings.getProjectId()).isEqualTo("file-project");
        assertThat(settings.getCreationTime()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(settings.getScope()).isEqualTo(InformationSchemaScope.PROJECT);
    }

    @Test
    void shouldReadScopeFromSettingsFileCaseInsensitively() throws Exception {
        Path settingsFile = tempDir.resolve("org.yml");
        Files.writeString(settingsFile, "type: organization\n");

        ClusterSettings settings = new ConfigurationLoader(Map.of()).loadSettingsFile(settingsFile);

        assertThat(settings.getScope()).isEqualTo(InformationSchemaScope.ORGANIZATION);
        assertThat(settings.getRegion()).isEqualTo("us");
    }

    @Test
    void shouldRejectMissingSettingsFile() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of())
                .loadSettings(new String[]{"--settings", tempDir.resolve("none.yml").toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Settings file not found");
    }

    @Test
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of())
                .loadSettings(new String[]{"--min-distance-threshold", "ten"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid numeric value for --min-distance-threshold: ten");
    }

    @Test
    void shouldRejectInvalidDate() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of("JOBCLUSTER_CREATION_TIME", "last week"))
                .loadSettings(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JOBCLUSTER_CREATION_TIME");
    }

    @Test
    void shouldRejectUnknownScope() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of())
                .loadSettings(new String[]{"--type", "FOLDER"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown scope type: FOLDER");
    }

    @Test
    void shouldRejectOptionWithoutValue() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of())
                .loadSettings(new String[]{"--project"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Value not specified for --project");
    }

    @Test
    void shouldAcceptNegativeThreshold() throws Exception {
        ClusterSettings settings = new ConfigurationLoader(Map.of())
                .loadSettings(new String[]{"--min-distance-threshold", "-1"});

        assertThat(settings.getMinDistanceThreshold()).isEqualTo(-1);
    }
}
