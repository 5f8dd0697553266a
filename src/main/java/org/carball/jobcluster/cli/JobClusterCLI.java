package org.carball.jobcluster.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.analyzer.JobClusterAnalyzer;
import org.carball.jobcluster.config.ClusterSettings;
import org.carball.jobcluster.config.ConfigurationLoader;
import org.carball.jobcluster.config.JobClusterConfig;
import org.carball.jobcluster.config.OutputFormat;
import org.carball.jobcluster.config.SortOrder;
import org.carball.jobcluster.model.cluster.JobClusterStats;
import org.carball.jobcluster.model.job.QueryJob;
import org.carball.jobcluster.output.ClusterReport;
import org.carball.jobcluster.parser.BigQueryJobLogConnector;
import org.carball.jobcluster.parser.JobLogFileConnector;
import org.carball.jobcluster.parser.JobLogJsonExporter;
import org.carball.jobcluster.parser.JobLogSource;
import org.carball.jobcluster.parser.JobLogSourceException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class JobClusterCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║           BigQuery Job Cluster Analyzer v%s                ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the analyzer. Results go to {@code out} (unless an output file is given),
     * progress and errors to {@code err}.
     *
     * @return process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, new ConfigurationLoader());
    }

    static int run(String[] args, PrintStream out, PrintStream err, ConfigurationLoader loader) {
        err.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage(err);
            return 0;
        }

        try {
            JobClusterConfig config = parseArgs(args, loader);
            ClusterSettings settings = config.getSettings();

            err.println("\n🔍 Starting analysis...");
            if (config.getJobsFile() != null) {
                err.println("   Jobs file: " + config.getJobsFile());
            } else {
                err.println("   Project: " + settings.getProjectId() + " (region-" + settings.getRegion() + ")");
                err.println("   Jobs since: " + settings.getCreationTime());
            }
            err.println("   Distance threshold: " + settings.getMinDistanceThreshold());
            err.println("   Output: " + (config.getOutputFile() != null ? config.getOutputFile() : "stdout"));
            err.println();

            // Step 1: Fetch the job log; any failure aborts before clustering
            err.print("📥 Fetching query jobs... ");
            List<QueryJob> jobs = createSource(config).getAllJobs();
            err.println("✓");
            if (config.isVerbose()) {
                err.println("     - Loaded " + jobs.size() + " jobs");
            }

            // Step 2: Keep a copy of the fetched jobs if requested
            if (config.getExportFile() != null) {
                err.print("💾 Exporting jobs... ");
                new JobLogJsonExporter().exportToJson(jobs, config.getExportFile(),
                        settings.getProjectId(), settings.getRegion());
                err.println("✓");
            }

            // Step 3: Cluster and aggregate
            err.print("🧮 Clustering similar queries... ");
            JobClusterAnalyzer analyzer = new JobClusterAnalyzer(settings.getMinDistanceThreshold(), config.getSortOrder());
            List<JobClusterStats> clusters = analyzer.analyze(jobs);
            err.println("✓");

            // Step 4: Output results
            err.print("📝 Writing results... ");
            outputResults(clusters, config, out);
            err.println("✓");

            printSummary(jobs, clusters, err);

            err.println("\n✅ Analysis complete!");
            return 0;

        } catch (JobLogSourceException e) {
            err.println("\n❌ Source error: " + e.getMessage());
            log.debug("Source error details", e);
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream err) {
        err.println("\nUsage: java -jar job-cluster-analyzer.jar --project <id> [options]");
        err.println("       java -jar job-cluster-analyzer.jar --jobs-file <file> [options]");
        err.println();
        err.println("Options:");
        err.println("  --jobs-file         Read jobs from a JSON export file instead of BigQuery");
        err.println("  --export-jobs       Also write the fetched jobs to a JSON export file");
        err.println("  --output, -o        Output file (default: JSON to stdout)");
        err.println("  --format, -f        Output format: json|markdown|both (default: json)");
        err.println("  --sort-by           Cluster order: none|bytes|count (default: none)");
        err.println("  --verbose, -v       Enable verbose output");
        err.println("  --help, -h          Show this help message");
        err.println();
        err.println(ConfigurationLoader.getSettingsHelp());
        err.println("Examples:");
        err.println("  # Jobs of the last week, exact duplicates only");
        err.println("  java -jar job-cluster-analyzer.jar --project my-project");
        err.println();
        err.println("  # Cluster queries up to 10 edits apart, largest clusters first");
        err.println("  java -jar job-cluster-analyzer.jar -p my-project --min-distance-threshold 10 --sort-by bytes");
        err.println();
        err.println("  # Re-run offline on a saved export");
        err.println("  java -jar job-cluster-analyzer.jar --jobs-file jobs.json -f markdown -o report.md");
    }

    static JobClusterConfig parseArgs(String[] args, ConfigurationLoader loader) throws IOException {
        JobClusterConfig config = new JobClusterConfig();
        config.setSettings(loader.loadSettings(args));

        // Set defaults
        config.setOutputFormat(OutputFormat.JSON);
        config.setSortOrder(SortOrder.NONE);
        config.setVerbose(false);

        for (int i = 0; i < args.length; i++) {
            if (ConfigurationLoader.SETTINGS_OPTIONS.contains(args[i])) {
                // Value already consumed by the configuration loader
                i++;
                continue;
            }

            switch (args[i]) {
                case "--jobs-file":
                    config.setJobsFile(Paths.get(requireValue(args, i++, "Jobs file not specified")));
                    break;

                case "--export-jobs":
                    config.setExportFile(Paths.get(requireValue(args, i++, "Export file not specified")));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--sort-by":
                    String sort = requireValue(args, i++, "Sort order not specified");
                    try {
                        config.setSortOrder(SortOrder.valueOf(sort.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid sort order. Use: none, bytes, or count");
                    }
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        validateConfig(config);

        return config;
    }

    private static String requireValue(String[] args, int optionIndex, String message) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[optionIndex + 1];
    }

    private static void validateConfig(JobClusterConfig config) {
        ClusterSettings settings = config.getSettings();

        if (config.getJobsFile() == null &&
                (settings.getProjectId() == null || settings.getProjectId().isBlank())) {
            throw new IllegalArgumentException(
                    "GCP project required. Use --project, set JOBCLUSTER_PROJECT, or read jobs with --jobs-file");
        }

        if (config.getJobsFile() != null && !Files.isRegularFile(config.getJobsFile())) {
            throw new IllegalArgumentException("Jobs file not found: " + config.getJobsFile());
        }

        if (config.getOutputFormat() == OutputFormat.BOTH && config.getOutputFile() == null) {
            throw new IllegalArgumentException("Output format 'both' requires --output");
        }

        if (config.getOutputFile() != null) {
            Path outputDir = Paths.get(config.getOutputFile()).getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
    }

    static JobLogSource createSource(JobClusterConfig config) throws JobLogSourceException {
        if (config.getJobsFile() != null) {
            return new JobLogFileConnector(config.getJobsFile());
        }
        return new BigQueryJobLogConnector(config.getSettings());
    }

    private static void outputResults(List<JobClusterStats> clusters,
                                      JobClusterConfig config,
                                      PrintStream out) throws IOException {

        ClusterReport report = new ClusterReport(clusters, config.getSettings());
        String outputFile = config.getOutputFile();

        if (outputFile == null) {
            out.println(config.getOutputFormat() == OutputFormat.MARKDOWN ? report.toMarkdown() : report.toJson());
            return;
        }

        String baseFileName = removeFileExtension(outputFile);

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".json" : outputFile;
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".md" : outputFile;
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void printSummary(List<QueryJob> jobs, List<JobClusterStats> clusters, PrintStream err) {
        err.println("\n" + "=".repeat(60));
        err.println("📊 CLUSTER SUMMARY");
        err.println("=".repeat(60));

        long repeated = clusters.stream().filter(c -> c.getCount() > 1).count();
        err.println("\nJobs analyzed: " + jobs.size());
        err.println("Clusters: " + clusters.size());
        err.println("Clusters with repeated queries: " + repeated);

        if (clusters.isEmpty()) {
            err.println("\n💡 No jobs matched the job log query.");
        }
    }
}
