package org.carball.jobcluster.analyzer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the most frequent value of a list.
 */
public final class MajorityVote {

    private MajorityVote() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the value with the strictly highest count. Ties go to the value that
     * appeared first. A null value takes part in the vote like any other value.
     *
     * @return the majority value, or null for an empty list
     */
    public static String of(List<String> values) {
        Map<String, Integer> tally = new LinkedHashMap<>();
        for (String value : values) {
            tally.merge(value, 1, Integer::sum);
        }

        String majority = null;
        int max = 0;
        for (Map.Entry<String, Integer> entry : tally.entrySet()) {
            if (entry.getValue() > max) {
                majority = entry.getKey();
                max = entry.getValue();
            }
        }
        return majority;
    }
}
