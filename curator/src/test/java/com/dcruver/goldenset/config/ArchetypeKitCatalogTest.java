package com.dcruver.goldenset.config;

import com.dcruver.goldenset.TestKits;
import com.dcruver.goldenset.domain.StratumKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArchetypeKitCatalogTest {

    @Test
    void testCompleteTableValidates() {
        ArchetypeKitCatalog catalog = new ArchetypeKitCatalog(TestKits.properties());
        assertDoesNotThrow(catalog::validate);
        assertTrue(catalog.kitFor(new StratumKey("blog", "MVP", "en")).isServer());
        assertFalse(catalog.kitFor(new StratumKey("notes", "MVP", "en")).isServer());
    }

    @Test
    void testLookupIgnoresKeyCase() {
        CurationProperties properties = TestKits.properties();
        Map<String, Map<String, CurationProperties.Kit>> lowered = new LinkedHashMap<>();
        properties.getKits().forEach((archetype, byComplexity) -> {
            Map<String, CurationProperties.Kit> inner = new LinkedHashMap<>();
            byComplexity.forEach((complexity, kit) -> inner.put(complexity.toLowerCase(), kit));
            lowered.put(archetype, inner);
        });
        properties.setKits(lowered);

        ArchetypeKitCatalog catalog = new ArchetypeKitCatalog(properties);
        assertDoesNotThrow(catalog::validate);
        assertNotNull(catalog.kitFor(new StratumKey("blog", "Pro", "en")));
    }

    @Test
    void testMissingKitsReported() {
        CurationProperties properties = TestKits.properties();
        properties.setArchetypes(new ArrayList<>(List.of("blog", "notes", "chat")));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new ArchetypeKitCatalog(properties).validate());
        assertTrue(e.getMessage().contains("missing kit chat/MVP"));
        assertTrue(e.getMessage().contains("missing kit chat/Pro"));
    }

    @Test
    void testUnknownStratumRejected() {
        ArchetypeKitCatalog catalog = new ArchetypeKitCatalog(TestKits.properties());
        assertThrows(IllegalArgumentException.class, () -> catalog.kitFor(new StratumKey("store", "MVP", "en")));
    }
}
