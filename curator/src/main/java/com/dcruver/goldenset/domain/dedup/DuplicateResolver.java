package com.dcruver.goldenset.domain.dedup;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.nlp.MinHashSketch;
import com.dcruver.goldenset.nlp.SimilarityEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Collapses near-duplicate items: builds the similarity graph over all pairs,
 * finds connected components, and keeps the smallest candidate id of each.
 */
@Component
@Slf4j
public class DuplicateResolver {

    private final SimilarityEngine similarity;
    private final double threshold;
    private final boolean parallel;

    @Autowired
    public DuplicateResolver(SimilarityEngine similarity, CurationProperties properties) {
        this(similarity, properties.getDedup().getThreshold(), properties.getDedup().isParallel());
    }

    public DuplicateResolver(SimilarityEngine similarity, double threshold, boolean parallel) {
        this.similarity = similarity;
        this.threshold = threshold;
        this.parallel = parallel;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Survivors keep their input order
     */
    public DedupResult resolve(List<SpecItem> items) {
        int n = items.size();
        requireUniqueIds(items);

        List<Set<String>> shingles = items.stream()
            .map(item -> similarity.shingleSet(item.getSpec()))
            .toList();
        List<MinHashSketch> sketches = shingles.stream()
            .map(similarity::sketch)
            .toList();

        // Edges come back in (i, j) order whether or not the scan ran in parallel
        IntStream rows = IntStream.range(0, n);
        if (parallel) {
            rows = rows.parallel();
        }
        List<int[]> pairs = rows
            .mapToObj(i -> IntStream.range(i + 1, n)
                .filter(j -> similarity.estimateJaccard(sketches.get(i), sketches.get(j)) >= threshold)
                .mapToObj(j -> new int[]{i, j})
                .toList())
            .flatMap(List::stream)
            .collect(Collectors.toList());

        List<List<Integer>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new ArrayList<>());
        }
        List<DedupReport.Edge> edges = new ArrayList<>(pairs.size());
        for (int[] pair : pairs) {
            adjacency.get(pair[0]).add(pair[1]);
            adjacency.get(pair[1]).add(pair[0]);
            double exact = SimilarityEngine.exactJaccard(shingles.get(pair[0]), shingles.get(pair[1]));
            edges.add(new DedupReport.Edge(
                items.get(pair[0]).getCandidateId(),
                items.get(pair[1]).getCandidateId(),
                SimilarityEngine.round4(exact)));
            log.debug("Near-duplicate pair {} ~ {} (exact {})",
                items.get(pair[0]).getCandidateId(), items.get(pair[1]).getCandidateId(), exact);
        }

        boolean[] visited = new boolean[n];
        Set<String> keptIds = new HashSet<>();
        List<DedupReport.Component> components = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (visited[start]) {
                continue;
            }
            List<String> members = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int node = queue.poll();
                members.add(items.get(node).getCandidateId());
                for (int next : adjacency.get(node)) {
                    if (!visited[next]) {
                        visited[next] = true;
                        queue.add(next);
                    }
                }
            }
            members.sort(null);
            keptIds.add(members.get(0));
            components.add(new DedupReport.Component(List.copyOf(members), members.get(0)));
        }

        List<SpecItem> survivors = items.stream()
            .filter(item -> keptIds.contains(item.getCandidateId()))
            .toList();

        DedupReport report = DedupReport.builder()
            .components(components)
            .edges(edges)
            .build();

        log.info("Dedup: {} items in, {} survivors, {} components, {} edges (threshold {})",
            n, survivors.size(), components.size(), edges.size(), threshold);

        return new DedupResult(survivors, report);
    }

    private static void requireUniqueIds(List<SpecItem> items) {
        Set<String> seen = new HashSet<>();
        for (SpecItem item : items) {
            if (!seen.add(item.getCandidateId())) {
                throw new IllegalArgumentException("Duplicate candidate id in pool: " + item.getCandidateId());
            }
        }
    }
}
