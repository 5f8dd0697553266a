package org.carball.jobcluster.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.jobcluster.config.SortOrder;
import org.carball.jobcluster.model.cluster.JobCluster;
import org.carball.jobcluster.model.cluster.JobClusterStats;
import org.carball.jobcluster.model.job.QueryJob;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Clusters a job log and summarizes each cluster.
 */
@Slf4j
public class JobClusterAnalyzer {

    private final int minDistanceThreshold;
    private final SortOrder sortOrder;
    private final JobClusterer clusterer;
    private final ClusterAggregator aggregator;

    public JobClusterAnalyzer(int minDistanceThreshold) {
        this(minDistanceThreshold, SortOrder.NONE);
    }

    public JobClusterAnalyzer(int minDistanceThreshold, SortOrder sortOrder) {
        this(minDistanceThreshold, sortOrder, new JobClusterer(), new ClusterAggregator());
    }

    public JobClusterAnalyzer(int minDistanceThreshold, SortOrder sortOrder,
                              JobClusterer clusterer, ClusterAggregator aggregator) {
        this.minDistanceThreshold = minDistanceThreshold;
        this.sortOrder = sortOrder != null ? sortOrder : SortOrder.NONE;
        this.clusterer = clusterer;
        this.aggregator = aggregator;
    }

    public List<JobClusterStats> analyze(List<QueryJob> jobs) {
        log.info("Starting cluster analysis of {} jobs", jobs.size());

        List<JobCluster> clusters = clusterer.cluster(jobs, minDistanceThreshold);
        List<JobClusterStats> stats = aggregator.aggregate(clusters);

        long repeated = stats.stream().filter(s -> s.getCount() > 1).count();
        log.info("Analysis complete. {} clusters, {} with repeated queries", stats.size(), repeated);

        return sort(stats, sortOrder);
    }

    static List<JobClusterStats> sort(List<JobClusterStats> stats, SortOrder sortOrder) {
        switch (sortOrder) {
            case BYTES:
                return stats.stream()
                        .sorted(Comparator.comparingLong(JobClusterStats::getTotalBytesProcessed).reversed())
                        .collect(Collectors.toList());
            case COUNT:
                return stats.stream()
                        .sorted(Comparator.comparingInt(JobClusterStats::getCount).reversed())
                        .collect(Collectors.toList());
            case NONE:
            default:
                return stats;
        }
    }
}
