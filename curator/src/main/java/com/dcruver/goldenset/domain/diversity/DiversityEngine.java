package com.dcruver.goldenset.domain.diversity;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.nlp.KMeansClusterer;
import com.dcruver.goldenset.nlp.SimilarityEngine;
import com.dcruver.goldenset.nlp.TextNormalizer;
import com.dcruver.goldenset.nlp.TfidfVectorizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Measures semantic spread of the pool and nudges it toward balanced clusters.
 *
 * The pool is diverse when no cluster is smaller than the minimum size and the
 * Gini of cluster sizes is within bounds. Otherwise the most central member of
 * the largest cluster is swapped for the least redundant unused item of the
 * same stratum and band, a bounded number of times. Items at or above the
 * dedup threshold against the rest of the pool are never swapped in. Missing the target only
 * produces a warning.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiversityEngine {

    private final TextNormalizer normalizer;
    private final CurationProperties properties;

    public DiversityResult enforce(List<SpecItem> pool, List<SpecItem> superset) {
        CurationProperties.Diversity config = properties.getDiversity();
        List<SpecItem> current = new ArrayList<>(pool);
        List<Swap> swaps = new ArrayList<>();
        Set<String> removed = new HashSet<>();
        String diagnostic = null;

        if (current.isEmpty()) {
            log.warn("Diversity check skipped: pool is empty");
            return new DiversityResult(current, DiversityReport.builder()
                .clusterDiversity(ClusterDiversity.builder()
                    .clusterCounts(Map.of())
                    .diverse(false)
                    .reason("Pool is empty")
                    .build())
                .shannonDiversity(ShannonDiversity.of(current, config.getShannonThreshold()))
                .swaps(swaps)
                .diagnostic("Pool is empty")
                .build());
        }

        Evaluation evaluation = evaluate(current);
        while (!evaluation.diversity().isDiverse() && swaps.size() < config.getMaxSwaps()) {
            int cluster = largestCluster(evaluation.clustering());
            int index = mostCentralMember(evaluation.vectors(), evaluation.clustering(), cluster);
            SpecItem outgoing = current.get(index);

            List<SpecItem> others = new ArrayList<>(current);
            others.remove(index);
            Replacement replacement = bestReplacement(outgoing, others, current, superset, removed);
            if (replacement == null) {
                diagnostic = String.format(
                    "No replacement candidates for %s (stratum %s, band %s); stopped after %d swaps",
                    outgoing.getCandidateId(), outgoing.getStratumKey(), outgoing.getLengthBand(), swaps.size());
                log.warn(diagnostic);
                break;
            }

            SpecItem incoming = replacement.item().toBuilder()
                .slotId(outgoing.getSlotId())
                .rep(outgoing.getRep())
                .seq(outgoing.getSeq())
                .sourceCandidateId(replacement.item().getCandidateId())
                .build();
            current.set(index, incoming);
            removed.add(outgoing.getCandidateId());

            Swap swap = new Swap(swaps.size() + 1, outgoing.getCandidateId(), incoming.getCandidateId(),
                cluster, SimilarityEngine.round4(replacement.score()));
            swaps.add(swap);
            log.info("Diversity swap {}: {} -> {} (cluster {}, max jaccard {})",
                swap.getSwapIdx(), swap.getRemoved(), swap.getAdded(), cluster, swap.getMaxJaccard());

            evaluation = evaluate(current);
        }

        ClusterDiversity clusterDiversity = evaluation.diversity();
        ShannonDiversity shannon = ShannonDiversity.of(current, config.getShannonThreshold());

        if (clusterDiversity.isDiverse()) {
            log.info("Cluster diversity met: k={}, gini={}, min size={} after {} swaps",
                clusterDiversity.getK(), clusterDiversity.getGini(), clusterDiversity.getMinClusterSize(), swaps.size());
        } else {
            log.warn("Cluster diversity target missed after {} swaps: {}", swaps.size(), clusterDiversity.getReason());
        }
        if (!shannon.isDiverse()) {
            log.warn("Archetype entropy {} below threshold {}", shannon.getNormalizedEntropy(), shannon.getThreshold());
        }

        DiversityReport report = DiversityReport.builder()
            .clusterDiversity(clusterDiversity)
            .shannonDiversity(shannon)
            .swaps(swaps)
            .diagnostic(diagnostic)
            .build();
        return new DiversityResult(current, report);
    }

    /**
     * Vectorize, cluster and score the pool as it stands
     */
    public Evaluation evaluate(List<SpecItem> items) {
        CurationProperties.Diversity config = properties.getDiversity();
        List<String> documents = items.stream().map(item -> normalizer.normalize(item.getSpec())).toList();
        double[][] vectors = new TfidfVectorizer(config.getMinDocumentFrequency(), config.getMaxDocumentRatio())
            .fitTransform(documents)
            .vectors();

        int k = clusterCount(items.size());
        KMeansClusterer.Clustering clustering = new KMeansClusterer(
            config.getRestarts(), config.getMaxIterations(), config.getTolerance())
            .cluster(vectors, k, properties.getSeed());

        Map<String, Integer> counts = new TreeMap<>();
        for (int label : clustering.labels()) {
            counts.merge(String.valueOf(label), 1, Integer::sum);
        }
        double gini = ClusterDiversity.gini(counts.values());
        int minSize = counts.values().stream().mapToInt(Integer::intValue).min().orElse(0);

        String reason = null;
        if (minSize < config.getMinClusterSize()) {
            reason = String.format("Min cluster size %d < required %d", minSize, config.getMinClusterSize());
        } else if (gini > config.getMaxGini()) {
            reason = String.format("Gini %.4f > max %.4f", gini, config.getMaxGini());
        }

        ClusterDiversity diversity = ClusterDiversity.builder()
            .k(k)
            .clusterCounts(counts)
            .gini(gini)
            .minClusterSize(minSize)
            .diverse(reason == null)
            .reason(reason)
            .build();
        log.debug("Diversity evaluation over {} items: {}", items.size(), diversity);
        return new Evaluation(vectors, clustering, diversity);
    }

    /**
     * max(minClusters, round(sqrt(n))), never more than n
     */
    int clusterCount(int n) {
        int k = Math.max(properties.getDiversity().getMinClusters(), (int) Math.round(Math.sqrt(n)));
        return Math.min(k, n);
    }

    static int largestCluster(KMeansClusterer.Clustering clustering) {
        int[] sizes = clustering.sizes();
        int best = 0;
        for (int label = 1; label < sizes.length; label++) {
            if (sizes[label] > sizes[best]) {
                best = label;
            }
        }
        return best;
    }

    static int mostCentralMember(double[][] vectors, KMeansClusterer.Clustering clustering, int cluster) {
        double[] centroid = clustering.centroids()[cluster];
        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < vectors.length; i++) {
            if (clustering.labels()[i] != cluster) {
                continue;
            }
            double d = KMeansClusterer.squaredDistance(vectors[i], centroid);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    private Replacement bestReplacement(SpecItem outgoing, List<SpecItem> others, List<SpecItem> current,
                                        List<SpecItem> superset, Set<String> removed) {
        Set<String> inPool = new HashSet<>();
        current.forEach(item -> inPool.add(item.getCandidateId()));

        double threshold = properties.getDedup().getThreshold();
        List<Set<String>> otherShingles = others.stream()
            .map(item -> normalizer.shingleSet(item.getSpec()))
            .toList();

        return superset.stream()
            .filter(item -> item.getStratum().equals(outgoing.getStratum()))
            .filter(item -> item.getLengthBand() == outgoing.getLengthBand())
            .filter(item -> !inPool.contains(item.getCandidateId()))
            .filter(item -> !removed.contains(item.getCandidateId()))
            .map(item -> new Replacement(item,
                SimilarityEngine.maxExactJaccard(normalizer.shingleSet(item.getSpec()), otherShingles)))
            .filter(replacement -> {
                if (replacement.score() >= threshold) {
                    log.debug("Skipping {} as a replacement: near-duplicate of the pool (jaccard {})",
                        replacement.item().getCandidateId(), SimilarityEngine.round4(replacement.score()));
                    return false;
                }
                return true;
            })
            .min(Comparator.comparingDouble(Replacement::score)
                .thenComparing(r -> r.item().getCandidateId()))
            .orElse(null);
    }

    /**
     * Vectors, clustering and verdict for one state of the pool
     */
    public record Evaluation(double[][] vectors, KMeansClusterer.Clustering clustering, ClusterDiversity diversity) {
    }

    private record Replacement(SpecItem item, double score) {
    }
}
