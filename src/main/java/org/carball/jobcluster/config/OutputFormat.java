package org.carball.jobcluster.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
