package com.dcruver.goldenset.nlp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    void testNormalizeStripsNoise() {
        String text = """
            ---
            title: demo
            ---
            ## Vision
            Tom &amp; Jerry bind to 0.0.0.0 via replit.toml
            ```
            code here
            ```
            done
            """;

        String normalized = normalizer.normalize(text);

        assertFalse(normalized.contains("title: demo"), "Front matter should be removed");
        assertFalse(normalized.contains("## Vision"), "H2 headers should be removed");
        assertFalse(normalized.contains("0.0.0.0"));
        assertFalse(normalized.contains("replit.toml"));
        assertFalse(normalized.contains("code here"), "Fenced code should be removed");
        assertTrue(normalized.contains("Tom & Jerry"), "HTML entities should be unescaped");
        assertTrue(normalized.contains("done"));
    }

    @Test
    void testNormalizeEmpty() {
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    void testH3HeadersSurvive() {
        String normalized = normalizer.normalize("### Access Control\nbody");
        assertTrue(normalized.contains("### Access Control"));
    }

    @Test
    void testTokenizeLowercasesWords() {
        assertEquals(List.of("hello", "world_1", "foo", "bar"), normalizer.tokenize("Hello, World_1! foo-BAR"));
        assertTrue(normalizer.tokenize("").isEmpty());
    }

    @Test
    void testShingleCount() {
        List<String> tokens = List.of("a", "b", "c", "d");
        assertEquals(List.of("a b c", "b c d"), normalizer.shingle(tokens, 3));
        assertTrue(normalizer.shingle(List.of("a", "b"), 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> normalizer.shingle(tokens, 0));
    }

    @Test
    void testShingleSetDeduplicates() {
        Set<String> shingles = normalizer.shingleSet("one two three one two three");
        assertEquals(Set.of("one two three", "two three one", "three one two"), shingles);
    }
}
