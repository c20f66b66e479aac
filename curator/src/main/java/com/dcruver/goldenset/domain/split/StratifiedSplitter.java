package com.dcruver.goldenset.domain.split;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.io.CuratorJson;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic, seed-free train/val/test partition.
 *
 * Items are visited band by band (SHORT, STANDARD, EXTENDED), strata in key
 * order within a band, slot ids in order within a stratum. Each item goes to
 * the next split in train, val, test rotation that still has room, so every
 * band is spread across all splits. When every split is at its cap the item
 * lands in train.
 */
@Component
@Slf4j
public class StratifiedSplitter {

    private final CuratorJson json;
    private final Caps defaultCaps;

    @Autowired
    public StratifiedSplitter(CuratorJson json, CurationProperties properties) {
        this(json, new Caps(
            properties.getSplit().getTrainCap(),
            properties.getSplit().getValCap(),
            properties.getSplit().getTestCap()));
    }

    public StratifiedSplitter(CuratorJson json, Caps defaultCaps) {
        this.json = json;
        this.defaultCaps = defaultCaps;
    }

    public SplitAssignment split(List<SpecItem> items) {
        return split(items, defaultCaps, null);
    }

    /**
     * @param seed accepted for interface compatibility and ignored; the partition does not depend on it
     */
    public SplitAssignment split(List<SpecItem> items, Caps caps, Long seed) {
        if (seed != null) {
            log.warn("Splitter is seed-free; ignoring seed {}", seed);
        }

        int[] limits = {caps.train(), caps.val(), caps.test()};
        int[] counts = new int[3];
        List<List<String>> assigned = List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());

        int cursor = 0;
        int overflow = 0;
        for (SpecItem item : visitOrder(items)) {
            int target = -1;
            for (int step = 0; step < 3; step++) {
                int candidate = (cursor + step) % 3;
                if (counts[candidate] < limits[candidate]) {
                    target = candidate;
                    break;
                }
            }
            if (target < 0) {
                target = 0;
                overflow++;
            } else {
                cursor = (target + 1) % 3;
            }
            assigned.get(target).add(item.getSlotId());
            counts[target]++;
        }

        if (overflow > 0) {
            log.warn("All splits full; {} items over cap assigned to train", overflow);
        }

        Map<String, List<String>> splits = new LinkedHashMap<>();
        Map<String, Integer> splitCounts = new LinkedHashMap<>();
        for (int i = 0; i < 3; i++) {
            String name = SplitAssignment.SPLIT_NAMES.get(i);
            splits.put(name, List.copyOf(assigned.get(i)));
            splitCounts.put(name, counts[i]);
        }

        SplitAssignment assignment = SplitAssignment.builder()
            .splits(splits)
            .counts(splitCounts)
            .digest(digest(splits))
            .build();

        log.info("Split {} items: train={}, val={}, test={} (digest {})",
            items.size(), counts[0], counts[1], counts[2], assignment.getDigest());
        return assignment;
    }

    public String digest(Map<String, List<String>> splits) {
        return DigestUtils.sha256Hex(json.compact(splits));
    }

    List<SpecItem> visitOrder(List<SpecItem> items) {
        // band -> stratum key -> items
        Map<LengthBand, Map<String, List<SpecItem>>> groups = new TreeMap<>();
        List<SpecItem> unbanded = new ArrayList<>();
        for (SpecItem item : items) {
            if (item.getLengthBand() == null) {
                unbanded.add(item);
                continue;
            }
            groups.computeIfAbsent(item.getLengthBand(), b -> new TreeMap<>())
                .computeIfAbsent(item.getStratumKey(), k -> new ArrayList<>())
                .add(item);
        }

        List<SpecItem> ordered = new ArrayList<>(items.size());
        for (Map<String, List<SpecItem>> byStratum : groups.values()) {
            for (List<SpecItem> group : byStratum.values()) {
                group.sort(Comparator.comparing(SpecItem::getSlotId));
                ordered.addAll(group);
            }
        }
        if (!unbanded.isEmpty()) {
            log.warn("{} items have no length band; splitting them last", unbanded.size());
            unbanded.sort(Comparator.comparing(SpecItem::getStratumKey).thenComparing(SpecItem::getSlotId));
            ordered.addAll(unbanded);
        }
        return ordered;
    }

    /**
     * Maximum items per split
     */
    public record Caps(int train, int val, int test) {
    }
}
