package org.carball.jobcluster.similarity;

import java.util.Objects;

/**
 * Levenshtein edit distance over raw query text.
 * Case and whitespace sensitive, compared per UTF-16 code unit, no normalization.
 * Space-optimized dynamic programming implementation.
 */
public class LevenshteinDistance implements QueryDistance {

    /**
     * Compute the minimum number of single-character insertions, deletions and
     * substitutions needed to turn one string into the other.
     *
     * @param first  first query text
     * @param second second query text
     * @return edit distance, zero when the strings are equal
     */
    @Override
    public int distance(String first, String second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        if (first.equals(second)) {
            return 0;
        }
        if (first.isEmpty()) {
            return second.length();
        }
        if (second.isEmpty()) {
            return first.length();
        }

        // Keep the shorter string on the row axis: O(min(m,n)) space
        String shorter = first.length() <= second.length() ? first : second;
        String longer = shorter == first ? second : first;

        int m = shorter.length();
        int n = longer.length();

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            char c = longer.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                if (shorter.charAt(i - 1) == c) {
                    curr[i] = prev[i - 1];
                } else {
                    curr[i] = 1 + Math.min(
                            Math.min(prev[i], curr[i - 1]), // delete or insert
                            prev[i - 1] // replace
                    );
                }
            }

            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }

        return prev[m];
    }
}
