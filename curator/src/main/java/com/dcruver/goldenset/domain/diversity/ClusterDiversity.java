package com.dcruver.goldenset.domain.diversity;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Cluster-size balance of the pool under k-means over TF-IDF vectors.
 */
@Value
@Builder
public class ClusterDiversity {
    int k;
    Map<String, Integer> clusterCounts;
    double gini;
    int minClusterSize;
    boolean diverse;
    String reason;

    /**
     * Gini coefficient of the values, rounded to 4 decimals; 0 for no values or an all-zero list
     */
    public static double gini(Collection<Integer> values) {
        List<Integer> sorted = new ArrayList<>(values);
        sorted.sort(null);
        int n = sorted.size();
        long total = sorted.stream().mapToLong(Integer::longValue).sum();
        if (n == 0 || total == 0) {
            return 0.0;
        }
        double weighted = 0.0;
        for (int i = 1; i <= n; i++) {
            weighted += (double) (n + 1 - i) * sorted.get(i - 1);
        }
        double gini = (n + 1 - 2.0 * weighted / total) / n;
        return Math.round(gini * 10000.0) / 10000.0;
    }
}
