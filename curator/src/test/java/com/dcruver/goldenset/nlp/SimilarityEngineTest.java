package com.dcruver.goldenset.nlp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityEngineTest {

    private static final String TEXT_A = "A community blog where writers publish long form posts and readers leave comments on each post";
    private static final String TEXT_B = "A private gallery that groups uploaded photos into collections with tags and captions for browsing";

    private SimilarityEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SimilarityEngine(new TextNormalizer(), new MinHasher(128, 2025));
    }

    @Test
    void testIdenticalTextsEstimateOne() {
        MinHashSketch a = engine.sketch(engine.shingleSet(TEXT_A));
        MinHashSketch b = engine.sketch(engine.shingleSet(TEXT_A));
        assertEquals(1.0, engine.estimateJaccard(a, b));
        assertEquals(a, b);
    }

    @Test
    void testDisjointTextsEstimateLow() {
        MinHashSketch a = engine.sketch(engine.shingleSet(TEXT_A));
        MinHashSketch b = engine.sketch(engine.shingleSet(TEXT_B));
        assertTrue(engine.estimateJaccard(a, b) < 0.1);
        assertEquals(0.0, SimilarityEngine.exactJaccard(engine.shingleSet(TEXT_A), engine.shingleSet(TEXT_B)));
    }

    @Test
    void testSketchIsDeterministicAcrossInstances() {
        MinHasher other = new MinHasher(128, 2025);
        assertArrayEquals(
            new MinHasher(128, 2025).sketch(engine.shingleSet(TEXT_A)).values(),
            other.sketch(engine.shingleSet(TEXT_A)).values());
    }

    @Test
    void testEmptySetSketchIsAllMax() {
        MinHashSketch empty = new MinHasher(16, 2025).sketch(Set.of());
        for (long v : empty.values()) {
            assertEquals(MinHasher.MAX_HASH, v);
        }
    }

    @Test
    void testMismatchedSketchesRejected() {
        MinHashSketch a = new MinHasher(64, 2025).sketch(Set.of("a b c"));
        MinHashSketch b = new MinHasher(64, 7).sketch(Set.of("a b c"));
        MinHashSketch c = new MinHasher(32, 2025).sketch(Set.of("a b c"));
        assertThrows(IllegalArgumentException.class, () -> a.estimateJaccard(b));
        assertThrows(IllegalArgumentException.class, () -> a.estimateJaccard(c));
    }

    @Test
    void testExactJaccard() {
        assertEquals(1.0, SimilarityEngine.exactJaccard(Set.of(), Set.of()));
        assertEquals(0.0, SimilarityEngine.exactJaccard(Set.of("x"), Set.of()));
        assertEquals(0.5, SimilarityEngine.exactJaccard(Set.of("a", "b"), Set.of("a", "b", "c", "d")));
    }

    @Test
    void testMaxExactJaccard() {
        Set<String> probe = Set.of("a", "b");
        assertEquals(0.0, SimilarityEngine.maxExactJaccard(probe, List.of()));
        assertEquals(1.0, SimilarityEngine.maxExactJaccard(probe, List.of(Set.of("c"), Set.of("a", "b"))));
    }

    @Test
    void testShingleHashIs32Bit() {
        long h = MinHasher.shingleHash("hello world again");
        assertTrue(h >= 0 && h <= MinHasher.MAX_HASH);
        assertEquals(h, MinHasher.shingleHash("hello world again"));
    }

    @Test
    void testMulAddModMatchesBigInteger() {
        long a = 0x1234_5678_9ABCL;
        long x = 0xFFFF_FFFFL;
        long b = (1L << 60) + 17;
        long expected = java.math.BigInteger.valueOf(a).multiply(java.math.BigInteger.valueOf(x))
            .add(java.math.BigInteger.valueOf(b))
            .mod(java.math.BigInteger.valueOf(MinHasher.MERSENNE_PRIME))
            .longValue();
        assertEquals(expected, MinHasher.mulAddMod(a, x, b));
    }
}
