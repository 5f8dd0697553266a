package org.carball.jobcluster.analyzer;

import org.carball.jobcluster.model.cluster.JobCluster;
import org.carball.jobcluster.model.cluster.JobClusterStats;
import org.carball.jobcluster.model.job.QueryJob;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives per-cluster usage statistics once clustering is complete.
 */
public class ClusterAggregator {

    public List<JobClusterStats> aggregate(List<JobCluster> clusters) {
        return clusters.stream()
                .map(this::aggregate)
                .collect(Collectors.toList());
    }

    public JobClusterStats aggregate(JobCluster cluster) {
        List<QueryJob> members = cluster.getMembers();

        long totalBytesProcessed = members.stream()
                .mapToLong(QueryJob::bytesProcessedOrZero)
                .sum();

        List<String> users = new ArrayList<>(members.size());
        List<String> destinationTables = new ArrayList<>(members.size());
        for (QueryJob job : members) {
            users.add(job.userEmail());
            destinationTables.add(job.destinationTable());
        }

        return JobClusterStats.builder()
                .jobs(members)
                .count(members.size())
                .totalBytesProcessed(totalBytesProcessed)
                .query(cluster.getRepresentativeQuery())
                .userEmail(MajorityVote.of(users))
                .destinationTable(MajorityVote.of(destinationTables))
                .build();
    }
}
