package com.dcruver.goldenset.domain.split;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Slot ids per split, their counts, and the SHA-256 of the canonical form of {@code splits}.
 */
@Value
@Builder
@Jacksonized
public class SplitAssignment {
    public static final List<String> SPLIT_NAMES = List.of("train", "val", "test");

    Map<String, List<String>> splits;
    Map<String, Integer> counts;
    String digest;

    public Optional<String> splitOf(String slotId) {
        return splits.entrySet().stream()
            .filter(e -> e.getValue().contains(slotId))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
