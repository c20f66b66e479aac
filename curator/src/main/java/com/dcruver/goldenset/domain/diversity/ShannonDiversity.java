package com.dcruver.goldenset.domain.diversity;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Entropy of the archetype distribution. Reported, never enforced.
 */
@Value
@Builder
public class ShannonDiversity {
    Map<String, Integer> archetypeCounts;
    double shannonEntropy;
    double normalizedEntropy;
    double threshold;
    boolean diverse;

    /**
     * H = -sum(p ln p) over archetypes, normalized by ln(number of archetypes present)
     */
    public static ShannonDiversity of(List<SpecItem> items, double threshold) {
        Map<String, Integer> counts = new TreeMap<>();
        for (SpecItem item : items) {
            counts.merge(item.getArchetype(), 1, Integer::sum);
        }
        double total = items.size();
        double h = 0.0;
        for (int count : counts.values()) {
            double p = count / total;
            h -= p * Math.log(p);
        }
        double hMax = counts.isEmpty() ? 0.0 : Math.log(counts.size());
        double normalized = hMax > 0 ? h / hMax : 0.0;
        return ShannonDiversity.builder()
            .archetypeCounts(counts)
            .shannonEntropy(round4(h))
            .normalizedEntropy(round4(normalized))
            .threshold(threshold)
            .diverse(normalized >= threshold)
            .build();
    }

    private static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
