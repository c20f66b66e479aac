package com.dcruver.goldenset.nlp;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF over unigrams and bigrams with document-frequency pruning,
 * smoothed IDF and L2-normalized rows.
 *
 * Terms are tokens of at least two word characters; the vocabulary is
 * ordered alphabetically so column indices are stable across runs.
 */
@Slf4j
public class TfidfVectorizer {

    private static final Pattern TERM = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final int minDocumentFrequency;
    private final double maxDocumentRatio;

    public TfidfVectorizer(int minDocumentFrequency, double maxDocumentRatio) {
        this.minDocumentFrequency = minDocumentFrequency;
        this.maxDocumentRatio = maxDocumentRatio;
    }

    /**
     * Fit on {@code documents} and return their vectors, one row per document
     */
    public Result fitTransform(List<String> documents) {
        int n = documents.size();
        List<Map<String, Integer>> termCounts = new ArrayList<>(n);
        Map<String, Integer> documentFrequency = new HashMap<>();

        for (String document : documents) {
            Map<String, Integer> counts = countTerms(document);
            termCounts.add(counts);
            for (String term : counts.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        double maxDocumentCount = maxDocumentRatio * n;
        TreeMap<String, Integer> vocabulary = new TreeMap<>();
        documentFrequency.entrySet().stream()
            .filter(e -> e.getValue() >= minDocumentFrequency && e.getValue() <= maxDocumentCount)
            .map(Map.Entry::getKey)
            .sorted()
            .forEach(term -> vocabulary.put(term, vocabulary.size()));

        if (vocabulary.isEmpty()) {
            log.warn("TF-IDF vocabulary is empty after pruning {} documents; using zero vectors", n);
        }

        double[] idf = new double[vocabulary.size()];
        for (Map.Entry<String, Integer> entry : vocabulary.entrySet()) {
            int df = documentFrequency.get(entry.getKey());
            idf[entry.getValue()] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        }

        double[][] vectors = new double[n][vocabulary.size()];
        for (int i = 0; i < n; i++) {
            double[] row = vectors[i];
            for (Map.Entry<String, Integer> tc : termCounts.get(i).entrySet()) {
                Integer column = vocabulary.get(tc.getKey());
                if (column != null) {
                    row[column] = tc.getValue() * idf[column];
                }
            }
            normalizeL2(row);
        }

        return new Result(List.copyOf(vocabulary.keySet()), vectors);
    }

    Map<String, Integer> countTerms(String document) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TERM.matcher(document == null ? "" : document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            counts.merge(tokens.get(i), 1, Integer::sum);
            if (i + 1 < tokens.size()) {
                counts.merge(tokens.get(i) + " " + tokens.get(i + 1), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static void normalizeL2(double[] row) {
        double sum = 0.0;
        for (double v : row) {
            sum += v * v;
        }
        if (sum == 0.0) {
            return;
        }
        double norm = Math.sqrt(sum);
        for (int j = 0; j < row.length; j++) {
            row[j] /= norm;
        }
    }

    /**
     * Fitted vocabulary and document vectors
     */
    public record Result(List<String> vocabulary, double[][] vectors) {

        public int dimensions() {
            return vocabulary.size();
        }
    }
}
