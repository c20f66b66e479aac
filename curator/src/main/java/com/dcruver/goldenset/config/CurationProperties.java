package com.dcruver.goldenset.config;

import com.dcruver.goldenset.domain.StratumKey;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the curation pipeline, bound from {@code curation.*}.
 * Defaults reproduce the reference 70-item golden set.
 */
@ConfigurationProperties(prefix = "curation")
@Data
public class CurationProperties {
    private long seed = 2025;
    private int quota = 5;
    private String platform = "replit";
    private String outputDir = "dist";

    // Strata plan
    private List<String> archetypes = new ArrayList<>(List.of(
        "blog", "guestbook", "chat", "notes", "dashboard", "store", "gallery"));
    private List<String> complexities = new ArrayList<>(List.of("MVP", "Pro"));
    private List<String> locales = new ArrayList<>(List.of("en"));

    // Variants generated per slot during the initial synthesis
    private double oversub = 1.2;

    private Dedup dedup = new Dedup();
    private TopUp topUp = new TopUp();
    private Diversity diversity = new Diversity();
    private Split split = new Split();
    private Bands bands = new Bands();

    // archetype -> complexity -> kit
    private Map<String, Map<String, Kit>> kits = new LinkedHashMap<>();

    /**
     * All declared strata in key order
     */
    public List<StratumKey> declaredStrata() {
        List<StratumKey> strata = new ArrayList<>();
        for (String archetype : archetypes) {
            for (String complexity : complexities) {
                for (String locale : locales) {
                    strata.add(new StratumKey(archetype, complexity, locale));
                }
            }
        }
        strata.sort(null);
        return strata;
    }

    public int expectedTotal() {
        return archetypes.size() * complexities.size() * locales.size() * quota;
    }

    /**
     * Pages, features and data models for one archetype at one complexity
     */
    @Data
    public static class Kit {
        private boolean server;
        private List<String> pages = new ArrayList<>();
        private List<String> features = new ArrayList<>();

        // "**Name**: field, field" lines
        private List<String> models = new ArrayList<>();
    }

    @Data
    public static class Dedup {
        private double threshold = 0.85;
        private int numPerm = 128;
        private boolean parallel = false;
    }

    @Data
    public static class TopUp {
        private int maxAttempts = 2;
        private int oversub = 5;
    }

    @Data
    public static class Diversity {
        private int minClusters = 7;
        private int minClusterSize = 3;
        private double maxGini = 0.40;
        private int maxSwaps = 5;
        private int maxIterations = 300;
        private int restarts = 10;
        private double tolerance = 1e-4;
        private int minDocumentFrequency = 2;
        private double maxDocumentRatio = 0.9;
        private double shannonThreshold = 0.97;
    }

    @Data
    public static class Split {
        private int trainCap = 42;
        private int valCap = 14;
        private int testCap = 14;
    }

    @Data
    public static class Bands {
        private int shortTarget = 14;
        private int standardTarget = 42;
        private int extendedTarget = 14;
        private int tolerance = 7;
    }
}
