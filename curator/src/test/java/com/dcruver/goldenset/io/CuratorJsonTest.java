package com.dcruver.goldenset.io;

import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.SpecItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.dcruver.goldenset.TestItems.item;
import static org.junit.jupiter.api.Assertions.*;

class CuratorJsonTest {

    private CuratorJson json;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        json = new CuratorJson();
    }

    @Test
    void testCanonicalFormat() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("zeta", List.of(1, 2));
        value.put("alpha", Map.of());
        value.put("mid", List.of());

        String expected = """
            {
              "alpha": {},
              "mid": [],
              "zeta": [
                1,
                2
              ]
            }
            """;
        assertEquals(expected, json.canonical(value));
    }

    @Test
    void testCompactSortsKeys() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", 1);
        value.put("a", List.of("x"));
        assertEquals("{\"a\":[\"x\"],\"b\":1}", json.compact(value));
    }

    @Test
    void testItemsUseSnakeCase() {
        String line = json.compact(item("c1", "blog", "MVP", 1, LengthBand.SHORT, "text"));
        assertTrue(line.contains("\"candidate_id\":\"c1\""));
        assertTrue(line.contains("\"length_band\":\"SHORT\""));
        assertFalse(line.contains("stratum"), "Derived stratum key is not serialized");
    }

    @Test
    void testJsonLinesRoundTrip() throws Exception {
        List<SpecItem> items = List.of(
            item("c1", "blog", "MVP", 1, LengthBand.SHORT, "first"),
            item("c2", "chat", "Pro", 2, LengthBand.STANDARD, "second\nline"));
        Path file = tempDir.resolve("nested/items.jsonl");

        json.writeLines(file, items);

        assertEquals(2, Files.readAllLines(file).size());
        assertEquals(items, json.readLines(file, SpecItem.class));
    }

    @Test
    void testWriteIsByteStable() throws Exception {
        Path first = tempDir.resolve("a.json");
        Path second = tempDir.resolve("b.json");
        json.write(first, Map.of("k", 1, "j", 2));
        json.write(second, Map.of("j", 2, "k", 1));
        assertEquals(Files.readString(first), Files.readString(second));
        assertTrue(Files.readString(first).endsWith("}\n"));
    }
}
