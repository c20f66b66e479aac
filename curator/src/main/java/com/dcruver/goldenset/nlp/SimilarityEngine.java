package com.dcruver.goldenset.nlp;

import com.dcruver.goldenset.config.CurationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * Set similarity over word-trigram shingles.
 * Sketch estimates prune candidate pairs; exact Jaccard is what gets persisted.
 */
@Component
public class SimilarityEngine {

    private final TextNormalizer normalizer;
    private final MinHasher minHasher;

    @Autowired
    public SimilarityEngine(TextNormalizer normalizer, CurationProperties properties) {
        this(normalizer, new MinHasher(properties.getDedup().getNumPerm(), properties.getSeed()));
    }

    public SimilarityEngine(TextNormalizer normalizer, MinHasher minHasher) {
        this.normalizer = normalizer;
        this.minHasher = minHasher;
    }

    public Set<String> shingleSet(String text) {
        return normalizer.shingleSet(text);
    }

    public MinHashSketch sketch(Set<String> shingles) {
        return minHasher.sketch(shingles);
    }

    public double estimateJaccard(MinHashSketch a, MinHashSketch b) {
        return a.estimateJaccard(b);
    }

    /**
     * |A ∩ B| / |A ∪ B|; two empty sets are identical, one empty set shares nothing
     */
    public static double exactJaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String s : smaller) {
            if (larger.contains(s)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    /**
     * Highest exact similarity of {@code shingles} against any of {@code others}; 0 when there are none
     */
    public static double maxExactJaccard(Set<String> shingles, Collection<Set<String>> others) {
        double max = 0.0;
        for (Set<String> other : others) {
            max = Math.max(max, exactJaccard(shingles, other));
        }
        return max;
    }

    public static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
