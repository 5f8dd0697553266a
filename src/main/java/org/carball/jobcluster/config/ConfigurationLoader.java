package org.carball.jobcluster.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;

@Slf4j
public class ConfigurationLoader {

    /**
     * Options read here; each takes one value.
     */
    public static final Set<String> SETTINGS_OPTIONS = Set.of(
            "--project", "-p",
            "--region", "-r",
            "--type", "-t",
            "--creation-time",
            "--min-distance-threshold",
            "--settings"
    );

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > settings file > defaults
     */
    public ClusterSettings loadSettings(String[] args) throws IOException {
        log.debug("Loading settings");

        // Start with defaults or the settings file
        String settingsPath = findOptionValue(args, "--settings");
        ClusterSettings base = settingsPath != null ? loadSettingsFile(Paths.get(settingsPath)) : ClusterSettings.defaults();
        ClusterSettings.ClusterSettingsBuilder builder = base.toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        ClusterSettings settings = builder.build();
        settings.validate();

        log.info("Settings loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    /**
     * Reads settings from a YAML file. Keys missing from the file keep their defaults.
     */
    public ClusterSettings loadSettingsFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Settings file not found: " + path);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new JavaTimeModule());

        ClusterSettings settings = mapper.readValue(path.toFile(), ClusterSettings.class);
        log.info("Loaded settings from: {}", path);
        return settings;
    }

    private void applyEnvironmentVariables(ClusterSettings.ClusterSettingsBuilder builder) {
        if (environment.containsKey("JOBCLUSTER_PROJECT")) {
            builder.projectId(environment.get("JOBCLUSTER_PROJECT"));
        }
        if (environment.containsKey("JOBCLUSTER_REGION")) {
            builder.region(environment.get("JOBCLUSTER_REGION"));
        }
        if (environment.containsKey("JOBCLUSTER_TYPE")) {
            builder.scope(InformationSchemaScope.fromName(environment.get("JOBCLUSTER_TYPE")));
        }
        if (environment.containsKey("JOBCLUSTER_CREATION_TIME")) {
            builder.creationTime(parseDate("JOBCLUSTER_CREATION_TIME", environment.get("JOBCLUSTER_CREATION_TIME")));
        }
        if (environment.containsKey("JOBCLUSTER_MIN_DISTANCE_THRESHOLD")) {
            builder.minDistanceThreshold(parseInt("JOBCLUSTER_MIN_DISTANCE_THRESHOLD",
                    environment.get("JOBCLUSTER_MIN_DISTANCE_THRESHOLD")));
        }
    }

    private void applyCLIArguments(ClusterSettings.ClusterSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!SETTINGS_OPTIONS.contains(arg)) {
                continue;
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Value not specified for " + arg);
            }
            String value = args[++i];

            switch (arg) {
                case "--project":
                case "-p":
                    builder.projectId(value);
                    break;
                case "--region":
                case "-r":
                    builder.region(value);
                    break;
                case "--type":
                case "-t":
                    builder.scope(InformationSchemaScope.fromName(value));
                    break;
                case "--creation-time":
                    builder.creationTime(parseDate(arg, value));
                    break;
                case "--min-distance-threshold":
                    builder.minDistanceThreshold(parseInt(arg, value));
                    break;
                default:
                    // --settings is applied before everything else
                    break;
            }
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + value, e);
        }
    }

    private static LocalDate parseDate(String name, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date for " + name + " (expected yyyy-MM-dd): " + value, e);
        }
    }

    private static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings:

            CLI Arguments:
              --project, -p <id>               GCP project that owns the job log
              --region, -r <region>            BigQuery region (default: us)
              --type, -t <scope>               PROJECT or ORGANIZATION (default: PROJECT)
              --creation-time <yyyy-MM-dd>     Select jobs created after this date (default: 7 days ago)
              --min-distance-threshold <num>   Maximum query edit distance for two queries to be clustered (default: 0)
              --settings <file>                YAML file with any of the settings above

            Environment Variables:
              JOBCLUSTER_PROJECT                 Same as --project
              JOBCLUSTER_REGION                  Same as --region
              JOBCLUSTER_TYPE                    Same as --type
              JOBCLUSTER_CREATION_TIME           Same as --creation-time
              JOBCLUSTER_MIN_DISTANCE_THRESHOLD  Same as --min-distance-threshold

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
