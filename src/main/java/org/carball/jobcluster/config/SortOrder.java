package org.carball.jobcluster.config;

/**
 * Ordering applied to cluster statistics before they are written.
 */
public enum SortOrder {
    /** Cluster creation order. */
    NONE,
    /** Total bytes processed, largest first. */
    BYTES,
    /** Member count, largest first. */
    COUNT
}
