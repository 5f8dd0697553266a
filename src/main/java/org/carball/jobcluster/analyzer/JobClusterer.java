package org.carball.jobcluster.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.model.cluster.JobCluster;
import org.carball.jobcluster.model.job.QueryJob;
import org.carball.jobcluster.similarity.LevenshteinDistance;
import org.carball.jobcluster.similarity.QueryDistance;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy online clustering of query jobs by edit distance of their query text.
 * <p>
 * Jobs are classified in input order and never reassigned. Each job joins the
 * existing cluster whose founding query is closest to its own, provided that
 * distance does not exceed the threshold; otherwise it founds a new cluster.
 * Clusters are scanned oldest first, and the oldest cluster wins on equal distance.
 */
@Slf4j
public class JobClusterer {

    private final QueryDistance queryDistance;

    public JobClusterer() {
        this(new LevenshteinDistance());
    }

    public JobClusterer(QueryDistance queryDistance) {
        this.queryDistance = queryDistance;
    }

    /**
     * Partitions the jobs into clusters of similar queries.
     *
     * @param jobs      jobs in encounter order
     * @param threshold maximum edit distance for a job to join an existing cluster
     * @return clusters in creation order, empty for empty input
     */
    public List<JobCluster> cluster(List<QueryJob> jobs, int threshold) {
        if (jobs == null || jobs.isEmpty()) {
            return new ArrayList<>();
        }

        // Creation order fixes the scan order; keys are labels only and may repeat
        List<JobCluster> clusters = new ArrayList<>();
        clusters.add(new JobCluster(jobs.get(0)));

        for (QueryJob job : jobs.subList(1, jobs.size())) {
            JobCluster target = findCluster(clusters, job, threshold);
            if (target == null) {
                log.debug("Job {} founds a new cluster", job.jobId());
                clusters.add(new JobCluster(job));
            } else {
                target.add(job);
            }
        }

        log.info("Clustered {} jobs into {} clusters (threshold {})", jobs.size(), clusters.size(), threshold);
        return clusters;
    }

    /**
     * Returns the cluster the job belongs to, or null when it must found a new one.
     */
    private JobCluster findCluster(List<JobCluster> clusters, QueryJob job, int threshold) {
        // Identical text needs no distance computation
        for (JobCluster cluster : clusters) {
            if (cluster.getRepresentativeQuery().equals(job.query())) {
                log.debug("Job {} matches cluster {} exactly", job.jobId(), cluster.getKey());
                return cluster;
            }
        }

        JobCluster nearest = null;
        int minDistance = Integer.MAX_VALUE;
        for (JobCluster cluster : clusters) {
            int distance = queryDistance.distance(job.query(), cluster.getRepresentativeQuery());
            if (distance < minDistance) {
                nearest = cluster;
                minDistance = distance;
            }
        }

        if (minDistance > threshold) {
            return null;
        }

        log.debug("Job {} joins cluster {} at distance {}", job.jobId(), nearest.getKey(), minDistance);
        return nearest;
    }
}
