package com.dcruver.goldenset.config;

import com.dcruver.goldenset.config.CurationProperties.Kit;
import com.dcruver.goldenset.domain.StratumKey;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed template table: (archetype, complexity) to the kit the synthesizer expands.
 * Checked for completeness against the declared strata when the application starts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArchetypeKitCatalog {

    private final CurationProperties properties;

    /**
     * Every declared (archetype, complexity) must have a kit with pages and features.
     *
     * @throws IllegalStateException listing every gap
     */
    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();
        for (String archetype : properties.getArchetypes()) {
            for (String complexity : properties.getComplexities()) {
                Kit kit = find(archetype, complexity);
                if (kit == null) {
                    problems.add("missing kit " + archetype + "/" + complexity);
                    continue;
                }
                if (kit.getPages() == null || kit.getPages().isEmpty()) {
                    problems.add("kit " + archetype + "/" + complexity + " has no pages");
                }
                if (kit.getFeatures() == null || kit.getFeatures().isEmpty()) {
                    problems.add("kit " + archetype + "/" + complexity + " has no features");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Archetype kit table is incomplete: " + String.join(", ", problems));
        }
        log.info("Archetype kit table complete for {} archetypes x {} complexities",
            properties.getArchetypes().size(), properties.getComplexities().size());
    }

    public Kit kitFor(StratumKey stratum) {
        Kit kit = find(stratum.archetype(), stratum.complexity());
        if (kit == null) {
            throw new IllegalArgumentException("No archetype kit for " + stratum);
        }
        return kit;
    }

    // Map keys may come back from relaxed binding in a different case
    private Kit find(String archetype, String complexity) {
        Map<String, Kit> byComplexity = lookup(properties.getKits(), archetype);
        return byComplexity == null ? null : lookup(byComplexity, complexity);
    }

    private static <V> V lookup(Map<String, V> map, String key) {
        if (map == null) {
            return null;
        }
        V exact = map.get(key);
        if (exact != null) {
            return exact;
        }
        return map.entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase(key))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(null);
    }
}
