package com.dcruver.goldenset.domain.dedup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Near-duplicate components and the similarity edges that formed them.
 */
@Value
@Builder
public class DedupReport {
    List<Component> components;
    List<Edge> edges;

    @JsonIgnore
    public int getDuplicatesRemoved() {
        return components.stream().mapToInt(c -> c.getItems().size() - 1).sum();
    }

    /**
     * Candidate ids of one connected component (sorted) and the one kept
     */
    @Value
    public static class Component {
        List<String> items;
        String kept;
    }

    /**
     * Pair whose estimate crossed the threshold, with its exact Jaccard rounded to 4 decimals
     */
    @Value
    public static class Edge {
        String source;
        String target;
        double jaccard;
    }
}
