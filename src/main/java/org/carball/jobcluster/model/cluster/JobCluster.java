package org.carball.jobcluster.model.cluster;

import lombok.Getter;
import org.carball.jobcluster.model.job.QueryJob;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of query jobs judged similar to the job that founded it.
 * <p>
 * The representative query is the founder's query text and stays fixed for the
 * lifetime of the cluster; every later job is compared against it, never against
 * other members.
 */
@Getter
public class JobCluster {

    private final String key;
    private final String representativeQuery;
    private final List<QueryJob> members = new ArrayList<>();

    public JobCluster(QueryJob founder) {
        this.key = founder.jobId();
        this.representativeQuery = founder.query();
        this.members.add(founder);
    }

    public void add(QueryJob job) {
        members.add(job);
    }

    public List<QueryJob> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return String.format("JobCluster{key='%s', size=%d}", key, members.size());
    }
}
