package org.carball.jobcluster.similarity;

/**
 * Distance between two query texts. Implementations must be pure and symmetric,
 * and must return zero for identical inputs.
 */
public interface QueryDistance {

    int distance(String first, String second);
}
