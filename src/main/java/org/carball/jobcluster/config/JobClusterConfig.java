package org.carball.jobcluster.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class JobClusterConfig {
    private ClusterSettings settings;
    private Path jobsFile;
    private Path exportFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private SortOrder sortOrder;
    private boolean verbose;
}
