package org.carball.jobcluster.parser;

import org.carball.jobcluster.model.job.QueryJob;

import java.util.List;

/**
 * Supplies executed query jobs in the order they should be clustered.
 */
public interface JobLogSource {

    List<QueryJob> getAllJobs() throws JobLogSourceException;
}
