package com.dcruver.goldenset.domain.diversity;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.nlp.SimilarityEngine;
import com.dcruver.goldenset.nlp.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.dcruver.goldenset.TestItems.item;
import static com.dcruver.goldenset.TestItems.words;
import static org.junit.jupiter.api.Assertions.*;

class DiversityEngineTest {

    private CurationProperties properties;
    private DiversityEngine engine;

    @BeforeEach
    void setUp() {
        properties = new CurationProperties();
        properties.getDiversity().setRestarts(3);
        engine = new DiversityEngine(new TextNormalizer(), properties);
    }

    private static SpecItem doc(String id, String archetype, int topic) {
        String spec = words(id.hashCode(), 60) + " topic" + topic + " focus" + topic + " shared words for every document";
        return item(id, archetype, "MVP", 1, LengthBand.STANDARD, spec);
    }

    private static List<SpecItem> pool(int n) {
        List<SpecItem> items = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            items.add(doc(String.format("c%02d", i), i % 2 == 0 ? "blog" : "chat", i % 3));
        }
        return items;
    }

    // One stratum, so any outgoing item can be replaced from the superset
    private static List<SpecItem> blogPool(int n) {
        List<SpecItem> items = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            items.add(doc(String.format("b%02d", i), "blog", i % 3));
        }
        return items;
    }

    @Test
    void testGini() {
        assertEquals(0.0, ClusterDiversity.gini(List.of(3, 3, 3)));
        assertEquals(0.6667, ClusterDiversity.gini(List.of(0, 0, 10)));
        assertEquals(0.0, ClusterDiversity.gini(List.of()));
    }

    @Test
    void testClusterCount() {
        assertEquals(8, engine.clusterCount(70));
        assertEquals(7, engine.clusterCount(20));
        assertEquals(3, engine.clusterCount(3), "k never exceeds the number of items");
    }

    @Test
    void testBalancedPoolNeedsNoSwaps() {
        properties.getDiversity().setMinClusters(2);
        properties.getDiversity().setMinClusterSize(1);
        properties.getDiversity().setMaxGini(1.0);

        List<SpecItem> items = pool(6);
        DiversityResult result = engine.enforce(items, items);

        assertTrue(result.getReport().getClusterDiversity().isDiverse());
        assertEquals(2, result.getReport().getClusterDiversity().getK());
        assertTrue(result.getReport().getSwaps().isEmpty());
        assertNull(result.getReport().getDiagnostic());
        assertEquals(items, result.getItems());
    }

    @Test
    void testStopsWithDiagnosticWhenNoReplacement() {
        properties.getDiversity().setMinClusterSize(100);

        List<SpecItem> items = pool(10);
        DiversityResult result = engine.enforce(items, items);

        assertFalse(result.getReport().getClusterDiversity().isDiverse());
        assertTrue(result.getReport().getSwaps().isEmpty());
        assertTrue(result.getReport().getDiagnostic().startsWith("No replacement candidates"));
        assertEquals(items, result.getItems());
    }

    @Test
    void testSwapsDrawFromSupersetAndNeverReadmit() {
        properties.getDiversity().setMinClusterSize(100);

        List<SpecItem> items = blogPool(10);
        List<SpecItem> superset = new ArrayList<>(items);
        superset.add(doc("x01", "blog", 0));
        superset.add(doc("x02", "blog", 1));
        superset.add(doc("y01", "blog", 2).withLengthBand(LengthBand.SHORT));

        DiversityResult result = engine.enforce(items, superset);
        List<Swap> swaps = result.getReport().getSwaps();

        assertEquals(2, swaps.size(), "Only two same-band replacements exist");
        assertTrue(result.getReport().getDiagnostic().contains("stopped after 2 swaps"));
        assertEquals(10, result.getItems().size());

        Set<String> removed = swaps.stream().map(Swap::getRemoved).collect(Collectors.toSet());
        Set<String> finalIds = result.getItems().stream().map(SpecItem::getCandidateId).collect(Collectors.toSet());
        assertTrue(removed.stream().noneMatch(finalIds::contains));
        assertFalse(finalIds.contains("y01"));
        assertEquals(1, swaps.get(0).getSwapIdx());
    }

    @Test
    void testSwapsNeverAdmitNearDuplicates() {
        properties.getDiversity().setMinClusterSize(100);
        TextNormalizer normalizer = new TextNormalizer();

        List<SpecItem> items = blogPool(10);
        List<SpecItem> superset = new ArrayList<>(items);
        superset.add(item("dup03", "blog", "MVP", 1, LengthBand.STANDARD, items.get(3).getSpec()));
        superset.add(item("dup04", "blog", "MVP", 1, LengthBand.STANDARD, items.get(4).getSpec()));

        DiversityResult result = engine.enforce(items, superset);

        List<SpecItem> finalItems = result.getItems();
        assertEquals(10, finalItems.size());
        for (int i = 0; i < finalItems.size(); i++) {
            for (int j = i + 1; j < finalItems.size(); j++) {
                double jaccard = SimilarityEngine.maxExactJaccard(
                    normalizer.shingleSet(finalItems.get(i).getSpec()),
                    List.of(normalizer.shingleSet(finalItems.get(j).getSpec())));
                assertTrue(jaccard < properties.getDedup().getThreshold(),
                    finalItems.get(i).getCandidateId() + " / " + finalItems.get(j).getCandidateId());
            }
        }
        assertTrue(result.getReport().getDiagnostic().startsWith("No replacement candidates"));
    }

    @Test
    void testSwappedItemTakesOverSlot() {
        properties.getDiversity().setMinClusterSize(100);
        properties.getDiversity().setMaxSwaps(1);

        List<SpecItem> items = blogPool(10);
        List<SpecItem> superset = new ArrayList<>(items);
        superset.add(doc("x01", "blog", 0));

        DiversityResult result = engine.enforce(items, superset);

        Swap swap = result.getReport().getSwaps().get(0);
        SpecItem outgoing = items.stream().filter(i -> i.getCandidateId().equals(swap.getRemoved())).findFirst().orElseThrow();
        SpecItem incoming = result.getItems().get(items.indexOf(outgoing));

        assertEquals("x01", incoming.getCandidateId());
        assertEquals("x01", incoming.getSourceCandidateId());
        assertEquals(outgoing.getSlotId(), incoming.getSlotId());
        assertEquals(outgoing.getRep(), incoming.getRep());
        assertNull(result.getReport().getDiagnostic(), "Swap budget reached without running out of candidates");
    }

    @Test
    void testEmptyPool() {
        DiversityResult result = engine.enforce(List.of(), List.of());
        assertTrue(result.getItems().isEmpty());
        assertEquals("Pool is empty", result.getReport().getDiagnostic());
    }

    @Test
    void testShannonDiversity() {
        ShannonDiversity even = ShannonDiversity.of(pool(6), 0.97);
        assertEquals(1.0, even.getNormalizedEntropy());
        assertTrue(even.isDiverse());

        ShannonDiversity single = ShannonDiversity.of(List.of(doc("a", "blog", 0)), 0.97);
        assertEquals(0.0, single.getNormalizedEntropy());
        assertFalse(single.isDiverse());
    }
}
