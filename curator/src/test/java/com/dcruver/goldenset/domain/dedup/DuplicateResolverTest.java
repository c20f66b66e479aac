package com.dcruver.goldenset.domain.dedup;

import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.nlp.MinHasher;
import com.dcruver.goldenset.nlp.SimilarityEngine;
import com.dcruver.goldenset.nlp.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dcruver.goldenset.TestItems.item;
import static com.dcruver.goldenset.TestItems.words;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateResolverTest {

    private SimilarityEngine similarity;
    private DuplicateResolver resolver;

    @BeforeEach
    void setUp() {
        similarity = new SimilarityEngine(new TextNormalizer(), new MinHasher(128, 2025));
        resolver = new DuplicateResolver(similarity, 0.85, false);
    }

    @Test
    void testIdenticalTextsCollapseToSmallestId() {
        String shared = words(1, 300);
        List<SpecItem> items = List.of(
            item("c__v02", shared),
            item("a__v01", words(2, 300)),
            item("b__v01", shared));

        DedupResult result = resolver.resolve(items);

        assertEquals(List.of("a__v01", "b__v01"),
            result.getSurvivors().stream().map(SpecItem::getCandidateId).toList(),
            "Survivors keep input order");
        assertEquals(1, result.getReport().getDuplicatesRemoved());
        assertEquals(1, result.getReport().getEdges().size());

        DedupReport.Edge edge = result.getReport().getEdges().get(0);
        assertEquals("c__v02", edge.getSource());
        assertEquals("b__v01", edge.getTarget());
        assertEquals(1.0, edge.getJaccard());

        DedupReport.Component merged = result.getReport().getComponents().stream()
            .filter(c -> c.getItems().size() == 2)
            .findFirst()
            .orElseThrow();
        assertEquals(List.of("b__v01", "c__v02"), merged.getItems());
        assertEquals("b__v01", merged.getKept());
    }

    @Test
    void testChainedDuplicatesFormOneComponent() {
        String text = words(10, 400);
        List<SpecItem> items = List.of(
            item("x1", text),
            item("x2", text + " extra tail"),
            item("x3", text));

        DedupResult result = resolver.resolve(items);

        assertEquals(1, result.getSurvivors().size());
        assertEquals("x1", result.getSurvivors().get(0).getCandidateId());
        assertEquals(1, result.getReport().getComponents().size());
        assertEquals(2, result.getReport().getDuplicatesRemoved());
    }

    @Test
    void testDistinctTextsAllSurvive() {
        List<SpecItem> items = List.of(item("a", words(1, 200)), item("b", words(2, 200)), item("c", words(3, 200)));
        DedupResult result = resolver.resolve(items);
        assertEquals(3, result.getSurvivors().size());
        assertTrue(result.getReport().getEdges().isEmpty());
        assertEquals(3, result.getReport().getComponents().size());
    }

    @Test
    void testParallelScanMatchesSequential() {
        String shared = words(5, 300);
        List<SpecItem> items = List.of(
            item("d", shared), item("a", words(6, 300)), item("c", shared),
            item("b", words(7, 300)), item("e", words(6, 300)));

        DedupResult sequential = resolver.resolve(items);
        DedupResult parallel = new DuplicateResolver(similarity, 0.85, true).resolve(items);

        assertEquals(sequential.getSurvivors(), parallel.getSurvivors());
        assertEquals(sequential.getReport(), parallel.getReport());
    }

    @Test
    void testDuplicateCandidateIdsRejected() {
        List<SpecItem> items = List.of(item("same", words(1, 50)), item("same", words(2, 50)));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(items));
    }

    @Test
    void testEmptyInput() {
        DedupResult result = resolver.resolve(List.of());
        assertTrue(result.getSurvivors().isEmpty());
        assertTrue(result.getReport().getComponents().isEmpty());
    }
}
