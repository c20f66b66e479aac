package com.dcruver.goldenset.io;

import com.dcruver.goldenset.domain.IntegrityCheckException;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.split.SplitAssignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes the final train / val / test / golden JSON lines, each sorted by id.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatasetPackager {

    private final CuratorJson json;
    private final ArtifactLayout layout;

    /**
     * @return packaged item count per split, plus "golden" for the union
     * @throws IntegrityCheckException if the assignment names a slot that is not in {@code items}
     */
    public Map<String, Integer> packageDataset(List<SpecItem> items, SplitAssignment assignment) throws IOException {
        Map<String, SpecItem> bySlot = items.stream()
            .collect(Collectors.toMap(SpecItem::getSlotId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<String> missing = new ArrayList<>();
        List<PackagedItem> golden = new ArrayList<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (String split : SplitAssignment.SPLIT_NAMES) {
            List<PackagedItem> packaged = new ArrayList<>();
            for (String slotId : assignment.getSplits().getOrDefault(split, List.of())) {
                SpecItem item = bySlot.get(slotId);
                if (item == null) {
                    missing.add("slot " + slotId + " assigned to " + split + " has no item");
                    continue;
                }
                packaged.add(PackagedItem.of(item, split));
            }
            packaged.sort(Comparator.comparing(PackagedItem::getId));
            json.writeLines(layout.split(split), packaged);
            golden.addAll(packaged);
            counts.put(split, packaged.size());
        }

        if (!missing.isEmpty()) {
            throw new IntegrityCheckException(missing);
        }

        golden.sort(Comparator.comparing(PackagedItem::getId));
        json.writeLines(layout.resolve(ArtifactLayout.GOLDEN), golden);
        counts.put("golden", golden.size());

        log.info("Packaged {} items: {}", golden.size(), counts);
        return counts;
    }
}
